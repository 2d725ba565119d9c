package com.flagship.savings_circle.engine.exception;

/**
 * The action is not valid for the current pool or round status.
 */
public class StateException extends PoolEngineException {

    public StateException(String message) {
        super(ErrorCode.INVALID_STATE, message);
    }
}
