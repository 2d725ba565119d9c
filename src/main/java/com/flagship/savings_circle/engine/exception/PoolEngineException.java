package com.flagship.savings_circle.engine.exception;

import lombok.Getter;

/**
 * Base type for every expected failure raised by the rotation engine.
 *
 * Subclasses map one-to-one onto {@link ErrorCode}. The engine boundary
 * catches these and turns them into structured results; they are never
 * meant to escape to an HTTP client as a stack trace.
 */
@Getter
public abstract class PoolEngineException extends RuntimeException {

    private final ErrorCode errorCode;

    protected PoolEngineException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected PoolEngineException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
