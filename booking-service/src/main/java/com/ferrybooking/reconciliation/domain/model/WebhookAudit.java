package com.ferrybooking.reconciliation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One processing attempt of one gateway notification, accepted or not. Rows are only ever
 * appended; a redelivery of a settled notification bumps {@code deliveryCount} on the
 * original row instead.
 */
@Entity
@Table(name = "webhook_audits", indexes = {
        @Index(name = "idx_webhook_audits_key", columnList = "notification_key"),
        @Index(name = "idx_webhook_audits_order", columnList = "order_id")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookAudit {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "notification_key", length = 160)
    private String notificationKey;

    @Column(name = "order_id", length = 64)
    private String orderId;

    @Column(name = "transaction_id", length = 64)
    private String transactionId;

    @Column(name = "transaction_status", length = 32)
    private String transactionStatus;

    @Column(name = "fraud_status", length = 32)
    private String fraudStatus;

    @Column(name = "status_code", length = 8)
    private String statusCode;

    @Column(name = "gross_amount", length = 32)
    private String grossAmount;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private NotificationSource source;

    @Column(name = "signature_valid", nullable = false)
    private boolean signatureValid;

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome", nullable = false, length = 32)
    private WebhookOutcome outcome;

    @Column(name = "message", length = 500)
    private String message;

    @Column(name = "raw_payload", columnDefinition = "TEXT")
    private String rawPayload;

    /** Serialized result handed back to redeliveries. */
    @Column(name = "result_json", columnDefinition = "TEXT")
    private String resultJson;

    @Column(name = "delivery_count", nullable = false)
    private int deliveryCount;

    @Column(name = "last_delivered_at")
    private LocalDateTime lastDeliveredAt;

    @Column(name = "received_at", nullable = false)
    private LocalDateTime receivedAt;

    @PrePersist
    protected void onCreate() {
        if (receivedAt == null) {
            receivedAt = LocalDateTime.now();
        }
        if (deliveryCount < 1) {
            deliveryCount = 1;
        }
        lastDeliveredAt = receivedAt;
    }
}
