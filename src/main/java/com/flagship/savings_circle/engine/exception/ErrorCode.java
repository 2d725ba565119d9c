package com.flagship.savings_circle.engine.exception;

import org.springframework.http.HttpStatus;

/**
 * Stable error codes returned to callers of the rotation engine.
 *
 * The code string is part of the API contract: clients branch on it,
 * so existing values must never be renamed.
 */
public enum ErrorCode {

    VALIDATION_ERROR(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    DUPLICATE_ACTION(HttpStatus.CONFLICT),
    CONFLICT(HttpStatus.CONFLICT),
    INVALID_STATE(HttpStatus.UNPROCESSABLE_ENTITY),
    PERMISSION_DENIED(HttpStatus.FORBIDDEN),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
