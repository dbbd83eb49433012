package com.ferrybooking.booking.api.dto;

import com.ferrybooking.booking.domain.model.Passenger;

public record PassengerResponse(
        String fullName,
        String identityType,
        String maskedIdentityNumber,
        String category
) {
    public static PassengerResponse from(Passenger passenger) {
        return new PassengerResponse(
                passenger.getFullName(),
                passenger.getIdentityType().name(),
                mask(passenger.getIdentityNumber()),
                passenger.getCategory().name()
        );
    }

    private static String mask(String identityNumber) {
        if (identityNumber == null || identityNumber.length() <= 4) {
            return identityNumber;
        }
        return "*".repeat(identityNumber.length() - 4) + identityNumber.substring(identityNumber.length() - 4);
    }
}
