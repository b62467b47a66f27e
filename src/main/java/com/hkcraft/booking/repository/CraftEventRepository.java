package com.hkcraft.booking.repository;

import com.hkcraft.booking.domain.model.CraftEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;

/**
 * Repository for events and courses.
 *
 * @author Craft Booking Team
 */
@Repository
public interface CraftEventRepository extends JpaRepository<CraftEvent, String> {

    /**
     * Load an event under a pessimistic write lock.
     * Registration, cancellation and promotion for one event serialize on this lock,
     * which keeps the CONFIRMED count read afterwards accurate until commit.
     *
     * @param eventId Event ID
     * @return Optional containing the locked event if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM CraftEvent e WHERE e.eventId = :eventId")
    Optional<CraftEvent> findByIdWithLock(@Param("eventId") String eventId);

    List<CraftEvent> findByOrganizerIdOrderByStartsAtAsc(String organizerId);
}
