package com.ferrybooking.booking.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.events.BookingExpiredEvent;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class BookingExpiryService {

    static final String EXPIRY_REASON = "Booking expired due to no payment";

    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final SeatHoldReleaser seatHoldReleaser;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    /**
     * Expires one booking in its own transaction. Every condition is re-checked under the
     * booking row lock, so a concurrent sweeper or a payment confirmation that got there first
     * turns this into a no-op.
     *
     * @return true when the booking was expired by this call
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean expireIfOverdue(Long bookingId) {
        LocalDateTime now = LocalDateTime.now(clock);
        Booking booking = bookingRepository.findByIdForUpdate(bookingId).orElse(null);
        if (booking == null || !booking.isPending() || !booking.getExpiresAt().isBefore(now)) {
            log.debug("Booking {} no longer eligible for expiry", bookingId);
            return false;
        }

        Optional<Payment> payment = paymentRepository.findByBookingIdForUpdate(bookingId);
        if (payment.isPresent() && payment.get().getStatus() == PaymentStatus.SUCCESS) {
            log.warn("Booking {} is past its hold but its payment settled; leaving it to reconciliation",
                    booking.getBookingCode());
            return false;
        }

        booking.transitionTo(BookingStatus.EXPIRED);
        booking.setCancelledAt(now);
        booking.setCancellationReason(EXPIRY_REASON);
        seatHoldReleaser.releaseOnce(booking);

        payment.ifPresent(p -> {
            if (p.getStatus().canTransitionTo(PaymentStatus.EXPIRED)) {
                p.transitionTo(PaymentStatus.EXPIRED);
            } else {
                log.info("Payment {} of expired booking {} left in {}",
                        p.getOrderId(), booking.getBookingCode(), p.getStatus());
            }
        });

        log.info("Booking {} expired, {} seat(s) returned to departure {}",
                booking.getBookingCode(), booking.getPassengerCount(), booking.getDepartureId());
        eventPublisher.publishEvent(new BookingExpiredEvent(
                booking.getBookingCode(), booking.getAccountId(), booking.getDepartureId(),
                booking.getPassengerCount(), Instant.now(clock)));
        return true;
    }
}
