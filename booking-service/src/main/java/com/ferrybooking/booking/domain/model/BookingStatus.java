package com.ferrybooking.booking.domain.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Booking lifecycle. The allowed targets of each state are the whole transition table;
 * every status change goes through {@link #canTransitionTo(BookingStatus)}.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    CANCELLED,
    EXPIRED,
    COMPLETED,
    REFUNDED;

    private Set<BookingStatus> targets;

    static {
        PENDING.targets = EnumSet.of(CONFIRMED, CANCELLED, EXPIRED);
        CONFIRMED.targets = EnumSet.of(CANCELLED, COMPLETED, REFUNDED);
        CANCELLED.targets = EnumSet.of(REFUNDED);
        COMPLETED.targets = EnumSet.of(REFUNDED);
        EXPIRED.targets = EnumSet.noneOf(BookingStatus.class);
        REFUNDED.targets = EnumSet.noneOf(BookingStatus.class);
    }

    public boolean canTransitionTo(BookingStatus target) {
        return targets.contains(target);
    }

    public Set<BookingStatus> allowedTargets() {
        return Collections.unmodifiableSet(targets);
    }
}
