package com.ferrybooking.payment.domain.repository;

import com.ferrybooking.payment.domain.model.Payment;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PaymentRepository extends JpaRepository<Payment, Long> {

    Optional<Payment> findByBookingId(Long bookingId);

    /**
     * Resolves a gateway order id to its booking without loading the payment entity, so the
     * caller can lock the booking row before the payment row.
     */
    @Query("SELECT p.bookingId FROM Payment p WHERE p.orderId = :orderId")
    Optional<Long> findBookingIdByOrderId(@Param("orderId") String orderId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM Payment p WHERE p.bookingId = :bookingId")
    Optional<Payment> findByBookingIdForUpdate(@Param("bookingId") Long bookingId);
}
