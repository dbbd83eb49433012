package com.ferrybooking.common.exception;

/**
 * Malformed input that the caller has to fix before retrying.
 */
public class ValidationException extends BusinessException {
    public ValidationException(String message) {
        super(message, ErrorCode.VALIDATION_ERROR);
    }
}
