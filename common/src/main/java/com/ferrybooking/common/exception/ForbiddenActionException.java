package com.ferrybooking.common.exception;

/**
 * The caller is identified but not allowed to perform the requested mutation.
 */
public class ForbiddenActionException extends BusinessException {
    public ForbiddenActionException(String message) {
        super(message, ErrorCode.FORBIDDEN);
    }
}
