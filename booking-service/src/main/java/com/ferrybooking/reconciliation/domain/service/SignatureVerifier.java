package com.ferrybooking.reconciliation.domain.service;

import com.ferrybooking.common.exception.InvalidSignatureException;
import com.ferrybooking.payment.client.dto.GatewayTransactionStatus;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Checks the gateway's {@code signature_key}: SHA-512 hex of
 * {@code order_id + status_code + gross_amount + serverKey}.
 */
@Component
public class SignatureVerifier {

    private final String serverKey;

    public SignatureVerifier(@Value("${payment.gateway.server-key}") String serverKey) {
        this.serverKey = serverKey;
    }

    public void verify(GatewayTransactionStatus notification) {
        String provided = notification.signatureKey();
        if (provided == null || provided.isBlank()) {
            throw new InvalidSignatureException("Notification for order " + notification.orderId() + " is not signed");
        }
        String expected = sign(notification.orderId(), notification.statusCode(), notification.grossAmount());
        boolean matches = MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                provided.trim().toLowerCase(Locale.ROOT).getBytes(StandardCharsets.US_ASCII));
        if (!matches) {
            throw new InvalidSignatureException("Signature mismatch for order " + notification.orderId());
        }
    }

    String sign(String orderId, String statusCode, String grossAmount) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-512");
            byte[] hash = digest.digest((orderId + statusCode + grossAmount + serverKey).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-512 unavailable", e);
        }
    }
}
