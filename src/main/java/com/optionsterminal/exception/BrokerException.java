package com.optionsterminal.exception;

/**
 * A call into the broker failed. Raised only to the caller whose call failed; the pacing
 * lane and sibling order legs keep running.
 */
public class BrokerException extends BaseException {

    public BrokerException(String message) {
        super(ErrorCode.BROKER_ERROR, message);
    }

    public BrokerException(String message, Throwable cause) {
        super(ErrorCode.BROKER_ERROR, message, cause);
    }
}
