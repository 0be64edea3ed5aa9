package com.optionsterminal.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the gateway's own failures: not connected, pacing queue full or timed out, broker
 * call failed, malformed tick key, invalid order leg.
 *
 * <p>Each carries the {@link ErrorCode} that decides its HTTP status and the optional
 * {@code details} map (missing leg fields, the pacing lane name) that
 * {@link GlobalExceptionHandler} copies into the error envelope. Inside a strategy these are
 * caught per leg and reported as that leg's failure instead.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.details = Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details) {
        super(message);
        this.errorCode = errorCode;
        this.details = details != null ? details : Map.of();
    }

    protected BaseException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = Map.of();
    }
}
