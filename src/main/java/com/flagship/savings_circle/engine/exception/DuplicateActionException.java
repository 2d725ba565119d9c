package com.flagship.savings_circle.engine.exception;

/**
 * The action was already performed (contribution already confirmed, round already paid).
 */
public class DuplicateActionException extends PoolEngineException {

    public DuplicateActionException(String message) {
        super(ErrorCode.DUPLICATE_ACTION, message);
    }
}
