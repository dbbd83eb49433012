package com.ferrybooking.common.exception;

import lombok.Getter;

/**
 * Root of the engine's error taxonomy. Subclasses fix the {@link ErrorCode};
 * {@link GlobalExceptionHandler} turns the code into an HTTP status.
 */
@Getter
public class BusinessException extends RuntimeException {
    private final ErrorCode errorCode;

    public BusinessException(String message, ErrorCode errorCode) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String message, Throwable cause, ErrorCode errorCode) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
