package com.ferrybooking.payment.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Payment lifecycle as reported by the gateway. Only PENDING, CHALLENGE and SUCCESS have
 * outgoing edges; everything else is final.
 */
public enum PaymentStatus {
    PENDING,
    CHALLENGE,
    SUCCESS,
    FAILED,
    EXPIRED,
    DENY,
    CANCELLED,
    REFUNDED;

    private Set<PaymentStatus> targets;

    static {
        PENDING.targets = EnumSet.of(SUCCESS, FAILED, EXPIRED, CHALLENGE, DENY, CANCELLED);
        CHALLENGE.targets = EnumSet.of(SUCCESS, DENY, FAILED);
        SUCCESS.targets = EnumSet.of(REFUNDED);
        FAILED.targets = EnumSet.noneOf(PaymentStatus.class);
        EXPIRED.targets = EnumSet.noneOf(PaymentStatus.class);
        DENY.targets = EnumSet.noneOf(PaymentStatus.class);
        CANCELLED.targets = EnumSet.noneOf(PaymentStatus.class);
        REFUNDED.targets = EnumSet.noneOf(PaymentStatus.class);
    }

    public boolean canTransitionTo(PaymentStatus target) {
        return targets.contains(target);
    }

    /** The attempt is over without money moving; a new gateway attempt may be opened. */
    public boolean isUnsuccessfulFinal() {
        return this == FAILED || this == EXPIRED || this == DENY || this == CANCELLED;
    }
}
