package com.ferrybooking.reconciliation.domain.service;

import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;

import java.util.Locale;

/**
 * Identity of a notification for replay detection. Each lifecycle step of a gateway
 * transaction (pending, settlement, refund...) gets its own key; a byte-identical redelivery
 * maps onto the same key.
 */
public final class NotificationKeys {
    private NotificationKeys() {
    }

    public static String of(GatewayTransactionStatus notification) {
        String transaction = notification.transactionId() != null && !notification.transactionId().isBlank()
                ? notification.transactionId()
                : "order:" + notification.orderId();
        StringBuilder key = new StringBuilder(transaction)
                .append(':')
                .append(normalize(notification.transactionStatus()));
        if (notification.fraudStatus() != null && !notification.fraudStatus().isBlank()) {
            key.append(':').append(normalize(notification.fraudStatus()));
        }
        return key.length() > 160 ? key.substring(0, 160) : key.toString();
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
