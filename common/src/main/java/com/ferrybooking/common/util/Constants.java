package com.ferrybooking.common.util;

/**
 * Header names and key prefixes shared by the engine.
 */
public final class Constants {
    private Constants() {
    }

    /** Injected by the upstream authentication layer. */
    public static final String HEADER_ACCOUNT_ID = "X-Account-Id";
    public static final String HEADER_ACCOUNT_ROLE = "X-Account-Role";

    public static final String REDIS_SETTLED_NOTIFICATION_PREFIX = "webhook:settled:";

    public static final String BOOKING_CODE_PREFIX = "FRB";
    public static final String TICKET_CODE_PREFIX = "TKT";
}
