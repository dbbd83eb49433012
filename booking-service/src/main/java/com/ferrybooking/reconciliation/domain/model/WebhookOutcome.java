package com.ferrybooking.reconciliation.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * What processing a notification did. Settled outcomes are final for their notification key:
 * a redelivery gets the recorded result back. The others leave the notification open to
 * redelivery or resync.
 */
public enum WebhookOutcome {
    APPLIED(true),
    NO_CHANGE(true),
    IGNORED(true),
    REJECTED_TRANSITION(true),
    AMOUNT_MISMATCH(true),
    UNKNOWN_ORDER(false),
    INVALID_SIGNATURE(false),
    MALFORMED(false),
    FAILED(false);

    public static final Set<WebhookOutcome> SETTLED = EnumSet.of(APPLIED, NO_CHANGE, IGNORED, REJECTED_TRANSITION, AMOUNT_MISMATCH);

    private final boolean settled;

    WebhookOutcome(boolean settled) {
        this.settled = settled;
    }

    public boolean isSettled() {
        return settled;
    }
}
