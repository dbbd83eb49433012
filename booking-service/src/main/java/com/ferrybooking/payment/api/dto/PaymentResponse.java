package com.ferrybooking.payment.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ferrybooking.payment.domain.model.Payment;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PaymentResponse(
        String bookingCode,
        String orderId,
        String status,
        BigDecimal amount,
        Integer attempt,
        String paymentType,
        LocalDateTime expiredAt,
        LocalDateTime paidAt
) {
    public static PaymentResponse from(String bookingCode, Payment payment) {
        return new PaymentResponse(
                bookingCode,
                payment.getOrderId(),
                payment.getStatus().name(),
                payment.getAmount(),
                payment.getAttempt(),
                payment.getPaymentType(),
                payment.getExpiredAt(),
                payment.getPaidAt()
        );
    }
}
