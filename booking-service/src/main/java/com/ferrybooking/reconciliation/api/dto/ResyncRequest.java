package com.ferrybooking.reconciliation.api.dto;

import jakarta.validation.constraints.NotBlank;

public record ResyncRequest(
        @NotBlank(message = "Booking code is required")
        String bookingCode
) {
}
