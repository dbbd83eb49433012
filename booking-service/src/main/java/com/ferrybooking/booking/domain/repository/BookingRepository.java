package com.ferrybooking.booking.domain.repository;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Every path that changes a booking's status takes the booking row lock first
 * ({@code findBy...ForUpdate}) and the payment row lock second, so cancellations,
 * webhook cascades and the expiry sweeper are serialized per booking.
 */
public interface BookingRepository extends JpaRepository<Booking, Long> {

    Optional<Booking> findByBookingCode(String bookingCode);

    boolean existsByBookingCode(String bookingCode);

    List<Booking> findByAccountIdOrderByCreatedAtDesc(Long accountId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.id = :id")
    Optional<Booking> findByIdForUpdate(@Param("id") Long id);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT b FROM Booking b WHERE b.bookingCode = :bookingCode")
    Optional<Booking> findByBookingCodeForUpdate(@Param("bookingCode") String bookingCode);

    /**
     * Candidates for the expiry sweeper. The sweeper re-checks each one under the row lock.
     */
    @Query("""
           SELECT b.id FROM Booking b
           WHERE b.status = :pending
             AND b.expiresAt < :now
             AND NOT EXISTS (
                 SELECT p.id FROM Payment p
                 WHERE p.bookingId = b.id
                   AND p.status = com.ferrybooking.payment.domain.model.PaymentStatus.SUCCESS)
           ORDER BY b.expiresAt ASC
           """)
    List<Long> findExpiredPendingIds(@Param("pending") BookingStatus pending,
                                     @Param("now") LocalDateTime now,
                                     Pageable page);

    /**
     * CONFIRMED to COMPLETED once every ticket was redeemed. No-op for any other status.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("""
           UPDATE Booking b
           SET b.status = com.ferrybooking.booking.domain.model.BookingStatus.COMPLETED,
               b.version = b.version + 1,
               b.updatedAt = :now
           WHERE b.id = :id
             AND b.status = com.ferrybooking.booking.domain.model.BookingStatus.CONFIRMED
           """)
    int completeIfConfirmed(@Param("id") Long id, @Param("now") LocalDateTime now);
}
