package com.ferrybooking.payment.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * @param force open a new gateway transaction even if an unexpired token exists
 */
public record CreatePaymentIntentRequest(
        @NotBlank(message = "Booking code is required")
        String bookingCode,
        boolean force
) {
}
