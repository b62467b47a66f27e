package com.hkcraft.booking;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main Spring Boot application class for the craft booking engine.
 *
 * System Overview:
 * - Product orders that reserve stock from a durable ledger, all lines or none
 * - Event and course registration with capacity limits and a waitlist
 * - Automatic promotion of the oldest waitlisted user when a seat frees up
 * - Payment after order persistence, with stock released again on decline
 * - Advisory carts held in Redis, re-validated at order time
 *
 * Architecture:
 * - API Layer: thin REST controllers over the services
 * - Service Layer: ledger, reservation, registration state machine, orchestrators
 * - Data Access Layer: JPA repositories with pessimistic row locks
 * - Infrastructure Layer: Redis cart store, Kafka notifications, Micrometer metrics,
 *   transaction retry
 *
 * @author Craft Booking Team
 */
@SpringBootApplication
@EnableJpaRepositories
@EnableTransactionManagement
public class CraftBookingApplication {

    public static void main(String[] args) {
        SpringApplication.run(CraftBookingApplication.class, args);
    }
}
