package com.ferrybooking.reconciliation.domain.service;

import com.ferrybooking.payment.domain.model.PaymentStatus;

import java.util.Locale;
import java.util.Optional;

/**
 * Gateway transaction status (plus fraud status for card captures) to internal payment status.
 * Empty for statuses we do not act on.
 */
public final class GatewayStatusMapper {
    private GatewayStatusMapper() {
    }

    public static Optional<PaymentStatus> map(String transactionStatus, String fraudStatus) {
        if (transactionStatus == null) {
            return Optional.empty();
        }
        String fraud = fraudStatus == null ? "" : fraudStatus.trim().toLowerCase(Locale.ROOT);
        return switch (transactionStatus.trim().toLowerCase(Locale.ROOT)) {
            case "capture" -> switch (fraud) {
                case "accept" -> Optional.of(PaymentStatus.SUCCESS);
                case "challenge" -> Optional.of(PaymentStatus.CHALLENGE);
                default -> Optional.of(PaymentStatus.DENY);
            };
            case "settlement" -> Optional.of(PaymentStatus.SUCCESS);
            case "pending", "authorize" -> Optional.of(PaymentStatus.PENDING);
            case "deny" -> Optional.of(PaymentStatus.DENY);
            case "cancel" -> Optional.of(PaymentStatus.CANCELLED);
            case "expire" -> Optional.of(PaymentStatus.EXPIRED);
            case "failure" -> Optional.of(PaymentStatus.FAILED);
            case "refund", "partial_refund", "chargeback", "partial_chargeback" -> Optional.of(PaymentStatus.REFUNDED);
            default -> Optional.empty();
        };
    }
}
