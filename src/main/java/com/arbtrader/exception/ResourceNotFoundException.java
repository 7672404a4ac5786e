package com.arbtrader.exception;

import java.util.Map;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, Object id) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " not found: " + id,
                Map.of("resourceType", resourceType, "id", String.valueOf(id)));
    }
}
