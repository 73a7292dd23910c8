package com.regimetrader.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's runtime exceptions. Carries a stable {@link ErrorCode} and an
 * immutable map of the values that identify the failing input (model location, policy id,
 * symbol).
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        this(errorCode, message, details, null);
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, cause);
    }

    private BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super("[" + errorCode.getCode() + "] " + message, cause);
        this.errorCode = errorCode;
        this.details = details != null ? Map.copyOf(details) : Map.of();
    }
}
