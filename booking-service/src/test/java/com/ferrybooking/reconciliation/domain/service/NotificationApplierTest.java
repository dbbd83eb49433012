package com.ferrybooking.reconciliation.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.domain.service.SeatHoldReleaser;
import com.ferrybooking.booking.events.BookingConfirmedEvent;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import com.ferrybooking.reconciliation.domain.model.NotificationSource;
import com.ferrybooking.reconciliation.domain.model.WebhookOutcome;
import com.ferrybooking.ticket.domain.model.Ticket;
import com.ferrybooking.ticket.domain.repository.TicketRepository;
import com.ferrybooking.ticket.domain.service.TicketIssuanceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
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
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class NotificationApplierTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-10-19T02:00:00Z"), ZoneId.of("Asia/Jakarta"));
    private static final LocalDateTime NOW = LocalDateTime.now(CLOCK);
    private static final String ORDER = "FRB-20261019-ABCDE";

    @Mock
    private BookingRepository bookingRepository;
    @Mock
    private PaymentRepository paymentRepository;
    @Mock
    private DepartureRepository departureRepository;
    @Mock
    private TicketRepository ticketRepository;
    @Mock
    private TicketIssuanceService ticketIssuanceService;
    @Mock
    private SeatHoldReleaser seatHoldReleaser;
    @Mock
    private WebhookAuditService webhookAuditService;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    private NotificationApplier applier;
    private Booking booking;
    private Payment payment;

    @BeforeEach
    void setUp() {
        applier = new NotificationApplier(bookingRepository, paymentRepository, departureRepository, ticketRepository,
                ticketIssuanceService, seatHoldReleaser, webhookAuditService, eventPublisher, CLOCK);
        booking = Booking.builder()
                .id(1L).bookingCode(ORDER).departureId(10L).accountId(100L)
                .passengerCount(2).totalAmount(new BigDecimal("300000.00"))
                .status(BookingStatus.PENDING).expiresAt(NOW.plusMinutes(5)).build();
        payment = Payment.builder()
                .id(7L).bookingId(1L).orderId(ORDER).amount(new BigDecimal("300000.00"))
                .status(PaymentStatus.PENDING).attempt(1).build();
        lenient().when(webhookAuditService.record(any(), any())).thenAnswer(inv -> inv.getArgument(1));
    }

    private void stubLookup() {
        when(paymentRepository.findBookingIdByOrderId(ORDER)).thenReturn(Optional.of(1L));
        when(bookingRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.of(payment));
    }

    private static WebhookAuditService.AuditEntry entry(String orderId, String status, String amount) {
        GatewayTransactionStatus n = new GatewayTransactionStatus(orderId, "200", amount, "sig", status, null,
                "tx-1", "bank_transfer", "2026-10-19 09:05:00", null);
        return new WebhookAuditService.AuditEntry("tx-1:" + status, n, "{}", NotificationSource.WEBHOOK, true);
    }

    @Test
    @DisplayName("settlement confirms the booking, issues tickets and publishes the confirmation")
    void settlement_confirmsBookingAndIssuesTickets() {
        stubLookup();
        when(ticketIssuanceService.issueForBooking(1L)).thenReturn(List.of(new Ticket(), new Ticket()));

        ProcessingResult result = applier.apply(entry(ORDER, "settlement", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.APPLIED);
        assertThat(result.ticketsIssued()).isEqualTo(2);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.SUCCESS);
        assertThat(payment.getPaidAt()).isEqualTo(NOW);
        assertThat(payment.getGatewayTransactionId()).isEqualTo("tx-1");
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(booking.getConfirmedAt()).isEqualTo(NOW);
        verify(eventPublisher).publishEvent(any(BookingConfirmedEvent.class));
    }

    @Test
    void amountMismatch_changesNothing() {
        stubLookup();

        ProcessingResult result = applier.apply(entry(ORDER, "settlement", "1.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.AMOUNT_MISMATCH);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        verify(ticketIssuanceService, never()).issueForBooking(any());
    }

    @Test
    void amountsAreComparedNumerically() {
        stubLookup();
        when(ticketIssuanceService.issueForBooking(1L)).thenReturn(List.of());

        assertThat(applier.apply(entry(ORDER, "settlement", "300000")).outcome()).isEqualTo(WebhookOutcome.APPLIED);
    }

    @Test
    void unknownOrder_isRecordedWithoutStateChange() {
        when(paymentRepository.findBookingIdByOrderId("FRB-NOPE")).thenReturn(Optional.empty());

        ProcessingResult result = applier.apply(entry("FRB-NOPE", "settlement", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.UNKNOWN_ORDER);
        verify(bookingRepository, never()).findByIdForUpdate(any());
    }

    @Test
    void sameStatusAgain_isNoChange() {
        stubLookup();

        assertThat(applier.apply(entry(ORDER, "pending", "300000.00")).outcome()).isEqualTo(WebhookOutcome.NO_CHANGE);
    }

    @Test
    void settlementAfterExpiry_isRejectedTransition() {
        payment.transitionTo(PaymentStatus.EXPIRED);
        booking.transitionTo(BookingStatus.EXPIRED);
        stubLookup();

        ProcessingResult result = applier.apply(entry(ORDER, "settlement", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.REJECTED_TRANSITION);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.EXPIRED);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.EXPIRED);
    }

    @Test
    void settlementForCancelledBooking_keepsPaymentPending() {
        booking.transitionTo(BookingStatus.CANCELLED);
        stubLookup();

        ProcessingResult result = applier.apply(entry(ORDER, "settlement", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.REJECTED_TRANSITION);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
    }

    private void stubSupersededLookup(String oldOrderId) {
        payment.startNewAttempt(ORDER + "-3");
        when(paymentRepository.findBookingIdByOrderId(oldOrderId)).thenReturn(Optional.empty());
        lenient().when(bookingRepository.findByBookingCode(ORDER)).thenReturn(Optional.of(booking));
        when(bookingRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(booking));
        when(paymentRepository.findByBookingIdForUpdate(1L)).thenReturn(Optional.of(payment));
    }

    @Test
    void supersededOrder_isIgnored() {
        stubSupersededLookup(ORDER + "-2");

        ProcessingResult result = applier.apply(entry(ORDER + "-2", "expire", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.IGNORED);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(payment.getOrderId()).isEqualTo(ORDER + "-3");
    }

    @Test
    void supersededOrderReportedPaid_isFlaggedWithoutConfirming() {
        stubSupersededLookup(ORDER);

        ProcessingResult result = applier.apply(entry(ORDER, "settlement", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.REJECTED_TRANSITION);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.PENDING);
        verify(ticketIssuanceService, never()).issueForBooking(any());
    }

    @Test
    void refundOfConfirmedBooking_releasesSeatsAndVoidsTickets() {
        payment.transitionTo(PaymentStatus.SUCCESS);
        booking.transitionTo(BookingStatus.CONFIRMED);
        stubLookup();
        when(ticketRepository.cancelValidTickets(1L, NOW)).thenReturn(2);

        ProcessingResult result = applier.apply(entry(ORDER, "refund", "300000.00"));

        assertThat(result.outcome()).isEqualTo(WebhookOutcome.APPLIED);
        assertThat(payment.getStatus()).isEqualTo(PaymentStatus.REFUNDED);
        assertThat(booking.getStatus()).isEqualTo(BookingStatus.REFUNDED);
        verify(seatHoldReleaser).releaseOnce(booking);
        verify(ticketRepository).cancelValidTickets(1L, NOW);
    }
}
