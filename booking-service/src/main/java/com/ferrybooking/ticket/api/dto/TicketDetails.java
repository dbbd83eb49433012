package com.ferrybooking.ticket.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.LocalDateTime;

/**
 * What a gate operator sees about a scanned ticket. No QR payload and no identity numbers.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TicketDetails(
        String ticketCode,
        String bookingCode,
        String passengerName,
        String seatLabel,
        String status,
        Long departureId,
        String route,
        LocalDateTime departureTime,
        LocalDateTime checkedInAt
) {
}
