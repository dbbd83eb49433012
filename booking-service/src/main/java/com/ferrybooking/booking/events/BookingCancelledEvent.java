package com.ferrybooking.booking.events;

import java.time.Instant;

/**
 * {@code refunded} is true when the booking had a settled payment that was marked refunded.
 */
public record BookingCancelledEvent(
        String bookingCode,
        Long accountId,
        Long cancelledBy,
        String reason,
        boolean refunded,
        Instant timestamp
) {
}
