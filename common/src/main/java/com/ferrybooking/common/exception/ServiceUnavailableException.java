package com.ferrybooking.common.exception;

/**
 * A required store (audit log, replay cache backing DB) is temporarily unavailable.
 * Callers are expected to retry the same request later.
 */
public class ServiceUnavailableException extends BusinessException {

    public ServiceUnavailableException(String message) {
        super(message, ErrorCode.SERVICE_UNAVAILABLE);
    }

    public ServiceUnavailableException(String message, Throwable cause) {
        super(message, cause, ErrorCode.SERVICE_UNAVAILABLE);
    }
}
