package com.iimsoft.uras.exception;

import java.util.Objects;

public class SchedulingException extends RuntimeException {

    private final ErrorKind kind;

    public SchedulingException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public SchedulingException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
