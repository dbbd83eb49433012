package com.ferrybooking.ticket.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.Base64;
import java.util.HexFormat;
import java.util.Optional;

/**
 * Encodes ticket claims as {@code FRB1.<base64url JSON>}. The JSON carries a truncated
 * HMAC-SHA256 ({@code sig}) so a gate can reject payloads that were edited or made up.
 */
@Slf4j
@Component
public class QrPayloadCodec {

    public static final String PREFIX = "FRB1.";
    private static final String HMAC = "HmacSHA256";
    private static final int SIGNATURE_HEX_LENGTH = 16;

    private final ObjectMapper objectMapper;
    private final SecretKeySpec signingKey;

    public QrPayloadCodec(ObjectMapper objectMapper, @Value("${ticket.qr.signing-key}") String signingKey) {
        if (signingKey == null || signingKey.isBlank()) {
            throw new IllegalStateException("ticket.qr.signing-key must be configured");
        }
        this.objectMapper = objectMapper;
        this.signingKey = new SecretKeySpec(signingKey.getBytes(StandardCharsets.UTF_8), HMAC);
    }

    public static boolean looksLikePayload(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    public String encode(QrClaims claims) {
        ObjectNode node = objectMapper.valueToTree(claims);
        node.put("sig", sign(claims));
        try {
            byte[] json = objectMapper.writeValueAsBytes(node);
            return PREFIX + Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not encode QR payload for ticket " + claims.ticketCode(), e);
        }
    }

    /**
     * @return the claims, or empty when the payload is malformed or its signature does not match
     */
    public Optional<QrClaims> decode(String payload) {
        if (!looksLikePayload(payload)) {
            return Optional.empty();
        }
        try {
            byte[] json = Base64.getUrlDecoder().decode(payload.substring(PREFIX.length()));
            JsonNode node = objectMapper.readTree(json);
            JsonNode sig = node.get("sig");
            if (sig == null || !sig.isTextual()) {
                return Optional.empty();
            }
            QrClaims claims = new QrClaims(
                    text(node, "t"), text(node, "b"), text(node, "p"),
                    node.hasNonNull("d") ? node.get("d").asLong() : null,
                    text(node, "dt"));
            boolean signatureMatches = MessageDigest.isEqual(
                    sign(claims).getBytes(StandardCharsets.US_ASCII),
                    sig.asText().getBytes(StandardCharsets.US_ASCII));
            return signatureMatches ? Optional.of(claims) : Optional.empty();
        } catch (IllegalArgumentException | IOException e) {
            log.debug("Unreadable QR payload: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String sign(QrClaims claims) {
        String canonical = String.join("|",
                String.valueOf(claims.ticketCode()),
                String.valueOf(claims.bookingCode()),
                String.valueOf(claims.passengerName()),
                String.valueOf(claims.departureId()),
                String.valueOf(claims.departureTime()));
        try {
            Mac mac = Mac.getInstance(HMAC);
            mac.init(signingKey);
            byte[] digest = mac.doFinal(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest).substring(0, SIGNATURE_HEX_LENGTH);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA256 unavailable", e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
