package com.ferrybooking.common.exception;

/**
 * Unknown booking, departure, payment or ticket.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, ErrorCode.NOT_FOUND);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s %s not found", resourceType, identifier), ErrorCode.NOT_FOUND);
    }
}
