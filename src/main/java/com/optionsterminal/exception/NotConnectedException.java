package com.optionsterminal.exception;

/**
 * Thrown when a broker operation is attempted with no open session, or after the
 * session that owned the operation has been closed.
 */
public class NotConnectedException extends BaseException {

    public NotConnectedException(String message) {
        super(ErrorCode.NOT_CONNECTED, message);
    }
}
