package com.ferrybooking.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error categories exposed to API clients, each bound to the HTTP status it is rendered with.
 */
@Getter
public enum ErrorCode {
    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    CONFLICT(HttpStatus.CONFLICT),
    FORBIDDEN(HttpStatus.FORBIDDEN),
    INVALID_SIGNATURE(HttpStatus.UNAUTHORIZED),
    REPLAY_DETECTED(HttpStatus.CONFLICT),
    GATEWAY_ERROR(HttpStatus.BAD_GATEWAY),
    SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }
}
