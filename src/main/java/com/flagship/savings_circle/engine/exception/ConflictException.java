package com.flagship.savings_circle.engine.exception;

/**
 * Concurrent writers kept invalidating each other and the retry budget ran out.
 */
public class ConflictException extends PoolEngineException {

    public ConflictException(String message, Throwable cause) {
        super(ErrorCode.CONFLICT, message, cause);
    }
}
