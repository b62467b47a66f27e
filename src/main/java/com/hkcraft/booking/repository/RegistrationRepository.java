package com.hkcraft.booking.repository;

import com.hkcraft.booking.domain.model.Registration;
import com.hkcraft.booking.domain.model.Registration.RegistrationStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import jakarta.persistence.LockModeType;

import java.util.List;
import java.util.Optional;

/**
 * Repository for event registrations.
 *
 * @author Craft Booking Team
 */
@Repository
public interface RegistrationRepository extends JpaRepository<Registration, Long> {

    Optional<Registration> findByEventIdAndUserId(String eventId, String userId);

    /**
     * Re-read one user's registration under a pessimistic write lock, so that
     * per-registration updates such as feedback check and write the same row state.
     *
     * @param eventId Event ID
     * @param userId  User ID
     * @return Optional containing the locked registration if found
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT r FROM Registration r WHERE r.eventId = :eventId AND r.userId = :userId")
    Optional<Registration> findByEventIdAndUserIdWithLock(@Param("eventId") String eventId,
                                                          @Param("userId") String userId);

    long countByEventIdAndStatus(String eventId, RegistrationStatus status);

    long countByEventId(String eventId);

    /**
     * The next registration to promote: oldest WAITLISTED first, row id breaking ties.
     *
     * @param eventId Event ID
     * @param status  normally {@link RegistrationStatus#WAITLISTED}
     * @return Optional containing the head of the queue
     */
    Optional<Registration> findFirstByEventIdAndStatusOrderByRegisteredAtAscRegistrationIdAsc(
            String eventId, RegistrationStatus status);

    List<Registration> findByEventIdAndStatusOrderByRegisteredAtAscRegistrationIdAsc(
            String eventId, RegistrationStatus status);

    List<Registration> findByEventIdOrderByRegisteredAtAscRegistrationIdAsc(String eventId);

    List<Registration> findByUserIdOrderByRegisteredAtDesc(String userId);

    @Query("SELECT AVG(r.rating) FROM Registration r WHERE r.eventId = :eventId AND r.rating IS NOT NULL")
    Double averageRating(@Param("eventId") String eventId);

    @Query("SELECT COUNT(r) FROM Registration r WHERE r.eventId = :eventId AND r.feedbackSubmittedAt IS NOT NULL")
    long countFeedback(@Param("eventId") String eventId);
}
