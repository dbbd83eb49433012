package com.ferrybooking.booking.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CreateBookingRequest(
        @NotNull(message = "Departure is required")
        Long departureId,

        @NotEmpty(message = "At least one passenger is required")
        List<@Valid @NotNull PassengerRequest> passengers
) {
}
