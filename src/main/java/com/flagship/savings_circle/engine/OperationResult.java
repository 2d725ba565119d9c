package com.flagship.savings_circle.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.savings_circle.engine.exception.ErrorCode;
import com.flagship.savings_circle.engine.exception.PoolEngineException;
import lombok.Value;

/**
 * Result of a rotation engine operation. Engine operations report failures
 * here instead of throwing.
 */
@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OperationResult<T> {

    @JsonProperty("success")
    boolean success;

    @JsonProperty("message")
    String message;

    @JsonProperty("error")
    ErrorDetail error;

    @JsonProperty("data")
    T data;

    public static <T> OperationResult<T> success(String message, T data) {
        return new OperationResult<>(true, message, null, data);
    }

    public static <T> OperationResult<T> failure(PoolEngineException e) {
        return failure(e.getErrorCode(), e.getMessage());
    }

    public static <T> OperationResult<T> failure(ErrorCode code, String message) {
        return new OperationResult<>(false, null, new ErrorDetail(code, message), null);
    }

    /**
     * Error code of a failed result, null on success.
     */
    public ErrorCode errorCode() {
        return error == null ? null : error.getCode();
    }

    @Value
    public static class ErrorDetail {

        @JsonProperty("code")
        ErrorCode code;

        @JsonProperty("message")
        String message;
    }
}
