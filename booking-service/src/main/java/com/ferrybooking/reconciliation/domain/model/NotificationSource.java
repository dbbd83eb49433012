package com.ferrybooking.reconciliation.domain.model;

public enum NotificationSource {
    /** Pushed by the gateway. */
    WEBHOOK,
    /** Pulled from the gateway's status API by an administrator. */
    RESYNC
}
