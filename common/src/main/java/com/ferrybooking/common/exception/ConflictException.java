package com.ferrybooking.common.exception;

/**
 * Illegal state transition, stale inventory or exhausted code generation.
 */
public class ConflictException extends BusinessException {
    public ConflictException(String message) {
        super(message, ErrorCode.CONFLICT);
    }
}
