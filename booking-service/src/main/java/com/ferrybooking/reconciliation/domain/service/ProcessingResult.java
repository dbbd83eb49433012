package com.ferrybooking.reconciliation.domain.service;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ferrybooking.reconciliation.domain.model.WebhookOutcome;

/**
 * Answer to one notification delivery. A redelivery of a settled notification receives the
 * stored result with {@code replayed} set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
        Long auditId,
        String orderId,
        WebhookOutcome outcome,
        String paymentStatus,
        String bookingStatus,
        int ticketsIssued,
        String message,
        boolean replayed
) {
    public static ProcessingResult of(String orderId, WebhookOutcome outcome, String message) {
        return new ProcessingResult(null, orderId, outcome, null, null, 0, message, false);
    }

    public ProcessingResult withAuditId(Long id) {
        return new ProcessingResult(id, orderId, outcome, paymentStatus, bookingStatus, ticketsIssued, message, replayed);
    }

    public ProcessingResult asReplay() {
        return new ProcessingResult(auditId, orderId, outcome, paymentStatus, bookingStatus, ticketsIssued, message, true);
    }
}
