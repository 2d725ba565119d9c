package com.flagship.savings_circle.engine.exception;

import java.util.UUID;

/**
 * Pool or member does not exist.
 */
public class NotFoundException extends PoolEngineException {

    public NotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static NotFoundException pool(UUID poolId) {
        return new NotFoundException("Pool not found: " + poolId);
    }

    public static NotFoundException member(String identifier) {
        return new NotFoundException("Member not found in pool: " + identifier);
    }
}
