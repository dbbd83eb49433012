package com.ferrybooking.booking.job;

import java.util.List;

/**
 * Outcome of one sweeper run. {@code failedBookingIds} lists bookings whose expiry threw;
 * they stay PENDING and are picked up again by the next run.
 */
public record SweepSummary(int examined, int expired, int skipped, List<Long> failedBookingIds) {

    public static SweepSummary empty() {
        return new SweepSummary(0, 0, 0, List.of());
    }
}
