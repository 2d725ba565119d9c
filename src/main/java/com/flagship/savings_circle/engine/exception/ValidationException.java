package com.flagship.savings_circle.engine.exception;

/**
 * Input is malformed or violates a pool rule (amount range, position, roster capacity).
 */
public class ValidationException extends PoolEngineException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }
}
