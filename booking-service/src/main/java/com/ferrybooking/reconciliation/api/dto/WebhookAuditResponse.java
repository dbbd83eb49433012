package com.ferrybooking.reconciliation.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ferrybooking.reconciliation.domain.model.WebhookAudit;

import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WebhookAuditResponse(
        Long id,
        String orderId,
        String transactionId,
        String transactionStatus,
        String fraudStatus,
        String grossAmount,
        String source,
        boolean signatureValid,
        String outcome,
        String message,
        int deliveryCount,
        LocalDateTime receivedAt,
        LocalDateTime lastDeliveredAt
) {
    public static WebhookAuditResponse from(WebhookAudit audit) {
        return new WebhookAuditResponse(
                audit.getId(),
                audit.getOrderId(),
                audit.getTransactionId(),
                audit.getTransactionStatus(),
                audit.getFraudStatus(),
                audit.getGrossAmount(),
                audit.getSource().name(),
                audit.isSignatureValid(),
                audit.getOutcome().name(),
                audit.getMessage(),
                audit.getDeliveryCount(),
                audit.getReceivedAt(),
                audit.getLastDeliveredAt()
        );
    }
}
