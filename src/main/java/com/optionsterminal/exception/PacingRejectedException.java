package com.optionsterminal.exception;

/**
 * A work item was evicted from a full pacing queue, or refused admission because every
 * pending item was order-mutating.
 */
public class PacingRejectedException extends BaseException {

    public PacingRejectedException(String message) {
        super(ErrorCode.RATE_LIMITED, message);
    }
}
