package com.optionsterminal.exception;

import java.util.Map;

/**
 * The caller stopped waiting for its paced work item. The item itself is not cancelled
 * and may still execute; only its result is lost.
 */
public class PacingTimeoutException extends BaseException {

    public PacingTimeoutException(String queueName, long timeoutMs) {
        super(
                ErrorCode.PACING_TIMEOUT,
                "Broker call did not execute within " + timeoutMs + "ms on pacing queue '" + queueName + "'",
                Map.of("queue", queueName, "timeoutMs", timeoutMs));
    }
}
