package com.ferrybooking.common.exception;

public class InvalidSignatureException extends BusinessException {
    public InvalidSignatureException(String message) {
        super(message, ErrorCode.INVALID_SIGNATURE);
    }
}
