package com.ferrybooking.common.exception;

import lombok.Getter;

/**
 * The payment provider was unreachable or answered with something we cannot use.
 * Transient failures (timeouts, 5xx, open circuit) may be retried; the rest may not.
 */
@Getter
public class GatewayException extends BusinessException {
    private final boolean transientFailure;

    public GatewayException(String message, boolean transientFailure) {
        super(message, ErrorCode.GATEWAY_ERROR);
        this.transientFailure = transientFailure;
    }

    public GatewayException(String message, Throwable cause, boolean transientFailure) {
        super(message, cause, ErrorCode.GATEWAY_ERROR);
        this.transientFailure = transientFailure;
    }
}
