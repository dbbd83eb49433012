package com.ferrybooking.payment.domain.model;

import com.ferrybooking.common.exception.ConflictException;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * The single payment record of a booking. The amount is fixed when the row is created.
 * Status only changes through {@link #transitionTo(PaymentStatus)} or, for a fresh gateway
 * attempt after an unsuccessful one, {@link #startNewAttempt(String)}.
 */
@Entity
@Table(name = "payments", indexes = {
        @Index(name = "idx_payments_status", columnList = "status")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Payment {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "booking_id", nullable = false, unique = true, updatable = false)
    private Long bookingId;

    @Column(name = "order_id", nullable = false, unique = true, length = 64)
    private String orderId;

    @Setter(AccessLevel.NONE)
    @Column(name = "amount", nullable = false, precision = 12, scale = 2, updatable = false)
    private BigDecimal amount;

    @Setter(AccessLevel.NONE)
    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "attempt", nullable = false)
    private Integer attempt;

    @Column(name = "gateway_token")
    private String gatewayToken;

    @Column(name = "redirect_url", length = 512)
    private String redirectUrl;

    @Column(name = "gateway_transaction_id", length = 64)
    private String gatewayTransactionId;

    @Column(name = "payment_type", length = 50)
    private String paymentType;

    @Column(name = "expired_at")
    private LocalDateTime expiredAt;

    @Column(name = "paid_at")
    private LocalDateTime paidAt;

    /** Last payload received from the gateway, kept verbatim for disputes. */
    @Column(name = "raw_response", columnDefinition = "TEXT")
    private String rawResponse;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
        if (status == null) {
            status = PaymentStatus.PENDING;
        }
        if (attempt == null) {
            attempt = 1;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }

    public void transitionTo(PaymentStatus target) {
        if (status == null || !status.canTransitionTo(target)) {
            throw new ConflictException(String.format(
                    "Payment %s cannot move from %s to %s", orderId, status, target));
        }
        status = target;
    }

    /**
     * Re-arms the record for another gateway transaction under a new order id. Allowed only
     * while no money has moved: from PENDING (superseded intent) or an unsuccessful final state.
     */
    public void startNewAttempt(String newOrderId) {
        if (status != PaymentStatus.PENDING && !status.isUnsuccessfulFinal()) {
            throw new ConflictException(String.format(
                    "Payment %s in status %s cannot start a new attempt", orderId, status));
        }
        orderId = newOrderId;
        attempt = attempt == null ? 2 : attempt + 1;
        status = PaymentStatus.PENDING;
        gatewayToken = null;
        redirectUrl = null;
        gatewayTransactionId = null;
        paymentType = null;
        expiredAt = null;
    }

    public boolean hasReusableToken(LocalDateTime now) {
        return status == PaymentStatus.PENDING
                && gatewayToken != null
                && expiredAt != null
                && expiredAt.isAfter(now);
    }
}
