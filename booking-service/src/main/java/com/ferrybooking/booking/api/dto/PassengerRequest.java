package com.ferrybooking.booking.api.dto;

import com.ferrybooking.booking.domain.model.Passenger;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record PassengerRequest(
        @NotBlank(message = "Passenger name is required")
        @Size(min = 2, max = 100, message = "Passenger name must be 2 to 100 characters")
        String fullName,

        @NotNull(message = "Identity type is required")
        Passenger.IdentityType identityType,

        @NotBlank(message = "Identity number is required")
        @Pattern(regexp = "^[A-Za-z0-9]{5,30}$", message = "Identity number must be 5 to 30 letters or digits")
        String identityNumber,

        Passenger.PassengerCategory category,

        @Pattern(regexp = "^$|^(\\+62|62|0)8[0-9]{7,11}$", message = "Invalid phone number")
        String phone
) {
}
