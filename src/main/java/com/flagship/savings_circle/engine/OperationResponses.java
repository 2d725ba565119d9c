package com.flagship.savings_circle.engine;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * HTTP binding of engine results: the status follows the error code.
 */
public final class OperationResponses {

    private OperationResponses() {
    }

    public static <T> ResponseEntity<OperationResult<T>> of(OperationResult<T> result) {
        return of(result, HttpStatus.OK);
    }

    public static <T> ResponseEntity<OperationResult<T>> of(OperationResult<T> result, HttpStatus onSuccess) {
        HttpStatus status = result.isSuccess() ? onSuccess : result.errorCode().getHttpStatus();
        return ResponseEntity.status(status).body(result);
    }
}
