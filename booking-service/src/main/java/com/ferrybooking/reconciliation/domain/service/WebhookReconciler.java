package com.ferrybooking.reconciliation.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ferrybooking.booking.domain.model.Booking;
import com.ferrybooking.booking.domain.repository.BookingRepository;
import com.ferrybooking.common.exception.InvalidSignatureException;
import com.ferrybooking.common.exception.ReplayDetectedException;
import com.ferrybooking.common.exception.ResourceNotFoundException;
import com.ferrybooking.common.exception.ServiceUnavailableException;
import com.ferrybooking.common.security.Actor;
import com.ferrybooking.payment.client.PaymentGatewayAdapter;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import com.ferrybooking.payment.domain.model.Payment;
import com.ferrybooking.payment.domain.repository.PaymentRepository;
import com.ferrybooking.reconciliation.domain.model.NotificationSource;
import com.ferrybooking.reconciliation.domain.model.WebhookOutcome;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;

/**
 * Entry point for gateway notifications and manual resyncs. The only path by which a payment
 * reaches a gateway-reported status.
 * <p>
 * Ingest order: parse, verify signature, short-circuit replays, then apply. Rejections never
 * surface as exceptions to the gateway; the audit row is written before returning, and only
 * a failure to write it is reported as {@link ServiceUnavailableException} so the gateway
 * redelivers.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WebhookReconciler {

    private final SignatureVerifier signatureVerifier;
    private final WebhookAuditService webhookAuditService;
    private final NotificationApplier notificationApplier;
    private final PaymentGatewayAdapter gatewayAdapter;
    private final BookingRepository bookingRepository;
    private final PaymentRepository paymentRepository;
    private final ObjectMapper objectMapper;

    public ProcessingResult ingest(String rawPayload) {
        GatewayTransactionStatus notification;
        try {
            notification = objectMapper.readValue(rawPayload, GatewayTransactionStatus.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Unreadable payment notification: {}", e.getMessage());
            return reject(new WebhookAuditService.AuditEntry(null, null, rawPayload, NotificationSource.WEBHOOK, false),
                    ProcessingResult.of(null, WebhookOutcome.MALFORMED, "Notification body is not valid JSON"));
        }

        String missing = missingField(notification);
        if (missing != null && !"signature_key".equals(missing)) {
            log.warn("Payment notification for order {} is missing {}", notification.orderId(), missing);
            return reject(new WebhookAuditService.AuditEntry(null, notification, rawPayload, NotificationSource.WEBHOOK, false),
                    ProcessingResult.of(notification.orderId(), WebhookOutcome.MALFORMED, "Missing or invalid " + missing));
        }

        try {
            signatureVerifier.verify(notification);
        } catch (InvalidSignatureException e) {
            log.warn("Rejected payment notification: {}", e.getMessage());
            return reject(new WebhookAuditService.AuditEntry(null, notification, rawPayload, NotificationSource.WEBHOOK, false),
                    ProcessingResult.of(notification.orderId(), WebhookOutcome.INVALID_SIGNATURE, e.getMessage()));
        }

        String key = NotificationKeys.of(notification);
        try {
            webhookAuditService.assertNotReplayed(key);
        } catch (ReplayDetectedException e) {
            return (ProcessingResult) e.getPreviousResult();
        }

        return applySafely(new WebhookAuditService.AuditEntry(key, notification, rawPayload, NotificationSource.WEBHOOK, true));
    }

    /**
     * Pulls the authoritative status of a booking's current order from the gateway and applies
     * it as if it had been notified. For webhooks that never arrived.
     */
    public ProcessingResult resync(String bookingCode, Actor actor) {
        actor.requireAdmin();
        Booking booking = bookingRepository.findByBookingCode(bookingCode)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", bookingCode));
        Payment payment = paymentRepository.findByBookingId(booking.getId())
                .orElseThrow(() -> new ResourceNotFoundException("No payment has been started for booking " + bookingCode));

        GatewayTransactionStatus status = gatewayAdapter.fetchStatus(payment.getOrderId());
        String raw = toJson(status);
        log.info("Resync of booking {} by admin {}: gateway reports '{}' for order {}",
                bookingCode, actor.accountId(), status.transactionStatus(), payment.getOrderId());

        String missing = missingField(status);
        if (missing != null && !"signature_key".equals(missing)) {
            return reject(new WebhookAuditService.AuditEntry(null, status, raw, NotificationSource.RESYNC, true),
                    ProcessingResult.of(payment.getOrderId(), WebhookOutcome.MALFORMED, "Gateway status lacks " + missing));
        }
        return applySafely(new WebhookAuditService.AuditEntry(
                NotificationKeys.of(status), status, raw, NotificationSource.RESYNC, true));
    }

    private ProcessingResult applySafely(WebhookAuditService.AuditEntry entry) {
        String orderId = entry.notification().orderId();
        try {
            return notificationApplier.apply(entry);
        } catch (DataAccessException e) {
            log.error("Store failure while applying notification for order {}", orderId, e);
            return reject(entry, ProcessingResult.of(orderId, WebhookOutcome.FAILED, "Temporary failure, will be retried"));
        } catch (RuntimeException e) {
            log.error("Failed to apply notification for order {}", orderId, e);
            return reject(entry, ProcessingResult.of(orderId, WebhookOutcome.FAILED, e.getMessage()));
        }
    }

    private ProcessingResult reject(WebhookAuditService.AuditEntry entry, ProcessingResult result) {
        try {
            return webhookAuditService.recordRejection(entry, result);
        } catch (DataAccessException e) {
            log.error("Could not store webhook audit for order {}", result.orderId(), e);
            throw new ServiceUnavailableException("Notification could not be recorded, please redeliver", e);
        }
    }

    private static String missingField(GatewayTransactionStatus n) {
        if (isBlank(n.orderId())) return "order_id";
        if (isBlank(n.statusCode())) return "status_code";
        if (isBlank(n.transactionStatus())) return "transaction_status";
        if (isBlank(n.grossAmount())) return "gross_amount";
        try {
            new BigDecimal(n.grossAmount());
        } catch (NumberFormatException e) {
            return "gross_amount";
        }
        if (isBlank(n.signatureKey())) return "signature_key";
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String toJson(GatewayTransactionStatus status) {
        try {
            return objectMapper.writeValueAsString(status);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize gateway status for order {}", status.orderId());
            return null;
        }
    }
}
