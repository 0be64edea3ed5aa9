package com.optionsterminal.exception;

public class MalformedKeyException extends BaseException {

    public MalformedKeyException(String wireKey) {
        super(ErrorCode.BAD_REQUEST, "Malformed tick key: '" + wireKey + "'");
    }
}
