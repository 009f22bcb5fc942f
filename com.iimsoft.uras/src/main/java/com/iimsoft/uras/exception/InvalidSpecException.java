package com.iimsoft.uras.exception;

public class InvalidSpecException extends SchedulingException {

    public InvalidSpecException(String message) {
        super(ErrorKind.INVALID_SPEC, message);
    }

    public InvalidSpecException(String message, Throwable cause) {
        super(ErrorKind.INVALID_SPEC, message, cause);
    }
}
