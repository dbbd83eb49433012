package com.ferrybooking.booking.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ferrybooking.booking.domain.model.Booking;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Public view of a booking. The booking code is the only identifier exposed.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BookingResponse(
        String bookingCode,
        Long departureId,
        String status,
        Integer passengerCount,
        BigDecimal totalAmount,
        LocalDateTime expiresAt,
        LocalDateTime confirmedAt,
        LocalDateTime cancelledAt,
        String cancellationReason,
        LocalDateTime createdAt,
        List<PassengerResponse> passengers
) {
    public static BookingResponse from(Booking booking) {
        return new BookingResponse(
                booking.getBookingCode(),
                booking.getDepartureId(),
                booking.getStatus().name(),
                booking.getPassengerCount(),
                booking.getTotalAmount(),
                booking.getExpiresAt(),
                booking.getConfirmedAt(),
                booking.getCancelledAt(),
                booking.getCancellationReason(),
                booking.getCreatedAt(),
                booking.getPassengers().stream().map(PassengerResponse::from).toList()
        );
    }
}
