package com.copytrader.exception;

import java.util.Map;

/** Unknown follower, short-sale task or queued action. */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resourceType, String identifier) {
        super(
                ErrorCode.NOT_FOUND,
                resourceType + " not found with identifier: " + identifier,
                Map.of("type", resourceType, "id", identifier));
    }
}
