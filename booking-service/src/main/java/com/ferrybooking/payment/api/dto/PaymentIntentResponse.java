package com.ferrybooking.payment.api.dto;

import java.time.LocalDateTime;

public record PaymentIntentResponse(
        String token,
        String redirectUrl,
        String orderId,
        LocalDateTime expiredAt,
        boolean reused
) {
}
