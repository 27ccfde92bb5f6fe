package com.hftrisk.exception;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public ResourceNotFoundException(String resourceType, String id) {
        super(ErrorCode.NOT_FOUND, resourceType + " not found: " + id);
    }
}
