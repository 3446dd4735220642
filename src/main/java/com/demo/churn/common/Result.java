package com.demo.churn.common;

import lombok.Getter;
import lombok.ToString;

/**
 * Success-or-error value returned by pipeline steps that must not throw,
 * so that callers (notably the batch loop) can keep going past a bad record.
 */
@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;

    private Result(boolean success, T data, String error, String errorCode) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null);
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code);
    }

    // ---------- convenience helpers ----------

    public boolean isOk() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
