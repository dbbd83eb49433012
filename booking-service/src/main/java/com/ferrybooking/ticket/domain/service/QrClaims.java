package com.ferrybooking.ticket.domain.service;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Facts bound into a ticket's QR code.
 */
public record QrClaims(
        @JsonProperty("t") String ticketCode,
        @JsonProperty("b") String bookingCode,
        @JsonProperty("p") String passengerName,
        @JsonProperty("d") Long departureId,
        @JsonProperty("dt") String departureTime
) {
}
