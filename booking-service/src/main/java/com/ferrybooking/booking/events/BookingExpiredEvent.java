package com.ferrybooking.booking.events;

import java.time.Instant;

public record BookingExpiredEvent(
        String bookingCode,
        Long accountId,
        Long departureId,
        int seatsReleased,
        Instant timestamp
) {
}
