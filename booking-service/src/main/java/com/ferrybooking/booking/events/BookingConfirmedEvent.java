package com.ferrybooking.booking.events;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDateTime;

/**
 * Published after the transaction that confirmed a booking commits.
 */
public record BookingConfirmedEvent(
        String bookingCode,
        Long accountId,
        Long departureId,
        LocalDateTime departureTime,
        int passengerCount,
        int ticketsIssued,
        BigDecimal totalAmount,
        Instant timestamp
) {
}
