package com.optionsterminal.exception;

/** A push-feed payload lacks the fields needed to identify its instrument. */
public class MalformedTickException extends BaseException {

    public MalformedTickException(String message) {
        super(ErrorCode.BAD_REQUEST, message);
    }
}
