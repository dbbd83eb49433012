package com.ferrybooking.booking.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.events.BookingExpiredEvent;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BookingExpiryServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T02:00:00Z"), ZoneId.of("Asia/Jakarta"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private SeatHoldReleaser seatHoldReleaser;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private BookingExpiryService service;

    @BeforeEach
    void setUp() {
        service = new BookingExpiryService(bookingRepository, paymentRepository, seatHoldReleaser, eventPublisher, CLOCK);
    }

    private Booking overdue() {
        return Booking.builder()
                .id(1L).bookingCode("FRB-20261019-ABCDE").departureId(10L).accountId(100L)
                .passengerCount(2).totalAmount(new BigDecimal("300000.00"))
                .status(BookingStatus.PENDING).expiresAt(NOW.minusMinutes(1)).build();
    }

    private Payment payment(PaymentStatus status) {
        return Payment.builder().bookingId(1L).orderId("FRB-20261019-ABCDE")
                .amount(new BigDecimal("300000.00")).status(status).attempt(1).build();
    }

    @Test
    void overdueBooking_isExpiredAndSeatsReleased() {
        Booking booking = overdue();
        Payment payment = payment(PaymentStatus.PENDING);
        when(bookingRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.of(payment));

        assertThat(service.expireIfOverdue(1L)).isTrue();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.EXPIRED);
        assertThat(booking.getCancellationReason()).isEqualTo(BookingExpiryService.EXPIRY_REASON);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.EXPIRED);
        verify(seatHoldReleaser).releaseOnce(booking);
        verify(eventPublisher).publishEvent(any(BookingExpiredEvent.class));
    }

    @Test
    void settledPayment_isNeverOverwritten() {
        Booking booking = overdue();
        when(bookingRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.of(payment(PaymentStatus.SUCCESS)));

        assertThat(service.expireIfOverdue(1L)).isFalse();

        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        verify(seatHoldReleaser, never()).releaseOnce(any());
    }

    @Test
    void bookingConfirmedMeanwhile_isSkipped() {
        Booking booking = overdue();
        booking.transitionTo(BookingStatus.CONFIRMED);
        when(bookingRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(booking));

        assertThat(service.expireIfOverdue(1L)).isFalse();
        verify(paymentRepository, never()).findByBookingIdForUpdate(any());
    }

    @Test
    void challengedPayment_staysForManualReview() {
        Booking booking = overdue();
        Payment payment = payment(PaymentStatus.CHALLENGE);
        when(bookingRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.of(payment));

        assertThat(service.expireIfOverdue(1L)).isTrue();
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.CHALLENGE);
    }
}
