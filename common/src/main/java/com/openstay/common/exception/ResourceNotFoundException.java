package com.openstay.common.exception;

/**
 * Thrown when a booking, token or inventory cell does not exist.
 */
public class ResourceNotFoundException extends BusinessException {
    public ResourceNotFoundException(String message) {
        super(message, ErrorCodes.RESOURCE_NOT_FOUND);
    }

    public ResourceNotFoundException(String resourceType, Object identifier) {
        super(String.format("%s with identifier %s not found", resourceType, identifier), ErrorCodes.RESOURCE_NOT_FOUND);
        detail("resourceType", resourceType);
        detail("identifier", identifier);
    }
}
