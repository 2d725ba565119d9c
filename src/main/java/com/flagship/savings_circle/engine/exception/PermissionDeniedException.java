package com.flagship.savings_circle.engine.exception;

public class PermissionDeniedException extends PoolEngineException {

    public PermissionDeniedException(String message) {
        super(ErrorCode.PERMISSION_DENIED, message);
    }
}
