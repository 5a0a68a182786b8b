package com.streamfirst.worklog.domain;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.Value;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a call into an external collaborator: either a value or a failure message.
 * Ports return this instead of throwing so that callers can degrade per unit of work.
 *
 * @param <T> the type of data returned on success
 */
@Value
@EqualsAndHashCode
public class Result<T> {

    boolean success;
    T data;
    String errorMessage;
    Optional<String> errorCode;

    private Result(boolean success, T data, String errorMessage, Optional<String> errorCode) {
        this.success = success;
        this.data = data;
        this.errorMessage = errorMessage;
        this.errorCode = errorCode;
    }

    /**
     * Creates a successful result with data.
     */
    public static <T> Result<T> success(@NonNull T data) {
        return new Result<>(true, data, null, Optional.empty());
    }

    /**
     * Creates a failure result with error message.
     */
    public static <T> Result<T> failure(String errorMessage) {
        return new Result<>(false, null, errorMessage, Optional.empty());
    }

    /**
     * Creates a failure result with error message and code, e.g. an HTTP status.
     */
    public static <T> Result<T> failure(String errorMessage, String errorCode) {
        return new Result<>(false, null, errorMessage, Optional.ofNullable(errorCode));
    }

    /**
     * Maps the data to another type if successful, preserves failure if failed.
     */
    public <U> Result<U> map(Function<T, U> mapper) {
        if (success) {
            return Result.success(mapper.apply(data));
        }
        return Result.failure(errorMessage, errorCode.orElse(null));
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    /**
     * Gets the data if successful, empty otherwise.
     */
    public Optional<T> getData() {
        return success ? Optional.ofNullable(data) : Optional.empty();
    }

    /**
     * Gets the error message if failed, empty otherwise.
     */
    public Optional<String> getErrorMessage() {
        return success ? Optional.empty() : Optional.ofNullable(errorMessage);
    }

    @Override
    public String toString() {
        if (success) {
            return "Result.success(" + data + ")";
        }
        return "Result.failure(" + errorMessage
                + errorCode.map(code -> ", code=" + code).orElse("") + ")";
    }
}
