package com.ferrybooking.reconciliation.domain.service;

import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.model.BookingStatus;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.booking.domain.service.SeatHoldReleaser;
import com.ferrybooking.booking.events.BookingConfirmedEvent;
import com.ferrybooking.inventory.domain.model.Departure;
import com.ferrybooking.inventory.domain.repository.DepartureRepository;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.model.PaymentStatus;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import com.ferrybooking.reconciliation.domain.model.WebhookOutcome;
import com.ferrybooking.ticket.domain.model.Ticket;
import com.ferrybooking.ticket.domain.repository.TicketRepository;
import com.ferrybooking.ticket.domain.service.TicketIssuanceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Applies an authenticated notification (or a resync status) to the payment and cascades to
 * the booking and its tickets. Booking row lock first, payment row lock second; the audit
 * row commits in the same transaction as the state it describes.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationApplier {

    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final DepartureRepository departureRepository;
    private final TicketRepository ticketRepository;
    private final TicketIssuanceService ticketIssuanceService;
    private final SeatHoldReleaser seatHoldReleaser;
    private final WebhookAuditService webhookAuditService;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Retryable(
            retryFor = {CannotAcquireLockException.class, OptimisticLockingFailureException.class},
            maxAttempts = 3,
            backoff = @Backoff(delay = 100, multiplier = 2)
    )
    @Transactional
    public ProcessingResult apply(WebhookAuditService.AuditEntry entry) {
        GatewayTransactionStatus n = entry.notification();
        String orderId = n.orderId();

        Optional<Booking> locked = paymentRepository.findBookingIdByOrderId(orderId)
                .or(() -> bookingIdOfSupersededOrder(orderId))
                .flatMap(bookingRepository::findByIdForUpdate);
        Optional<Payment> lockedPayment = locked.flatMap(b -> paymentRepository.findByBookingIdForUpdate(b.getId()));
        if (lockedPayment.isEmpty()) {
            log.warn("Notification for unknown order {}", orderId);
            return webhookAuditService.record(entry,
                    ProcessingResult.of(orderId, WebhookOutcome.UNKNOWN_ORDER, "No payment with this order id"));
        }
        Booking booking = locked.get();
        Payment payment = lockedPayment.get();
        Optional<PaymentStatus> mapped = GatewayStatusMapper.map(n.transactionStatus(), n.fraudStatus());

        if (!payment.getOrderId().equals(orderId)) {
            if (mapped.orElse(null) == PaymentStatus.SUCCESS) {
                log.error("Order {} of booking {} was paid after being superseded by {}; manual refund or confirmation required",
                        orderId, booking.getBookingCode(), payment.getOrderId());
                return record(entry, WebhookOutcome.REJECTED_TRANSITION, payment, booking, 0,
                        "Superseded order reported paid, needs manual review");
            }
            return record(entry, WebhookOutcome.IGNORED, payment, booking, 0,
                    "Order superseded by " + payment.getOrderId());
        }

        if (new BigDecimal(n.grossAmount()).compareTo(payment.getAmount()) != 0) {
            log.warn("Amount mismatch on order {}: notified {}, expected {}", orderId, n.grossAmount(), payment.getAmount());
            return record(entry, WebhookOutcome.AMOUNT_MISMATCH, payment, booking, 0,
                    "Notified amount " + n.grossAmount() + " does not match payment amount");
        }

        if (mapped.isEmpty()) {
            log.info("Ignoring gateway status '{}' for order {}", n.transactionStatus(), orderId);
            return record(entry, WebhookOutcome.IGNORED, payment, booking, 0,
                    "Gateway status '" + n.transactionStatus() + "' is not acted on");
        }
        PaymentStatus target = mapped.get();
        PaymentStatus current = payment.getStatus();

        if (target == current) {
            fillGatewayDetails(payment, n, entry.rawPayload());
            return record(entry, WebhookOutcome.NO_CHANGE, payment, booking, 0, "Payment already " + current);
        }
        if (!current.canTransitionTo(target)) {
            if (target == PaymentStatus.SUCCESS) {
                log.error("Order {} reported paid but payment is {}; manual refund required", orderId, current);
            } else {
                log.warn("Rejected payment transition {} -> {} for order {}", current, target, orderId);
            }
            return record(entry, WebhookOutcome.REJECTED_TRANSITION, payment, booking, 0,
                    "Payment cannot move from " + current + " to " + target);
        }
        if (target == PaymentStatus.SUCCESS && !booking.isPending()) {
            log.error("Order {} reported paid but booking {} is {}; manual refund required",
                    orderId, booking.getBookingCode(), booking.getStatus());
            return record(entry, WebhookOutcome.REJECTED_TRANSITION, payment, booking, 0,
                    "Booking is " + booking.getStatus() + ", payment needs manual refund");
        }

        LocalDateTime now = LocalDateTime.now(clock);
        payment.transitionTo(target);
        fillGatewayDetails(payment, n, entry.rawPayload());
        log.info("Payment {} moved {} -> {} ({})", orderId, current, target, entry.source());

        int ticketsIssued = 0;
        if (target == PaymentStatus.SUCCESS) {
            ticketsIssued = confirm(booking, payment, now);
        } else if (target == PaymentStatus.REFUNDED) {
            applyRefund(booking, now);
        }
        return record(entry, WebhookOutcome.APPLIED, payment, booking, ticketsIssued,
                "Payment " + current + " -> " + target);
    }

    private int confirm(Booking booking, Payment payment, LocalDateTime now) {
        payment.setPaidAt(now);
        booking.transitionTo(BookingStatus.CONFIRMED);
        booking.setConfirmedAt(now);
        List<Ticket> tickets = ticketIssuanceService.issueForBooking(booking.getId());
        log.info("Booking {} confirmed, {} ticket(s) issued", booking.getBookingCode(), tickets.size());

        Departure departure = departureRepository.findById(booking.getDepartureId()).orElse(null);
        eventPublisher.publishEvent(new BookingConfirmedEvent(
                booking.getBookingCode(),
                booking.getAccountId(),
                booking.getDepartureId(),
                departure == null ? null : departure.getDepartureTime(),
                booking.getPassengerCount(),
                tickets.size(),
                booking.getTotalAmount(),
                Instant.now(clock)));
        return tickets.size();
    }

    private void applyRefund(Booking booking, LocalDateTime now) {
        BookingStatus before = booking.getStatus();
        if (before.canTransitionTo(BookingStatus.REFUNDED)) {
            booking.transitionTo(BookingStatus.REFUNDED);
        }
        if (before == BookingStatus.CONFIRMED) {
            seatHoldReleaser.releaseOnce(booking);
        }
        int voided = ticketRepository.cancelValidTickets(booking.getId(), now);
        log.info("Refund applied to booking {} ({} -> {}, {} ticket(s) voided)",
                booking.getBookingCode(), before, booking.getStatus(), voided);
    }

    /**
     * Order ids are the booking code, then {@code <bookingCode>-<attempt>} for later attempts,
     * so an order that was replaced by a newer attempt still leads back to its booking.
     */
    private Optional<Long> bookingIdOfSupersededOrder(String orderId) {
        Optional<Long> exact = bookingRepository.findByBookingCode(orderId).map(Booking::getId);
        if (exact.isPresent()) {
            return exact;
        }
        int dash = orderId.lastIndexOf('-');
        if (dash <= 0 || dash == orderId.length() - 1
                || !orderId.substring(dash + 1).chars().allMatch(Character::isDigit)) {
            return Optional.empty();
        }
        return bookingRepository.findByBookingCode(orderId.substring(0, dash)).map(Booking::getId);
    }

    private static void fillGatewayDetails(Payment payment, GatewayTransactionStatus n, String rawPayload) {
        if (n.transactionId() != null) {
            payment.setGatewayTransactionId(n.transactionId());
        }
        if (n.paymentType() != null) {
            payment.setPaymentType(n.paymentType());
        }
        if (rawPayload != null) {
            payment.setRawResponse(rawPayload);
        }
    }

    private ProcessingResult record(WebhookAuditService.AuditEntry entry, WebhookOutcome outcome,
                                    Payment payment, Booking booking, int ticketsIssued, String message) {
        ProcessingResult result = new ProcessingResult(null, entry.notification().orderId(), outcome,
                payment.getStatus().name(), booking.getStatus().name(), ticketsIssued, message, false);
        return webhookAuditService.record(entry, result);
    }
}
