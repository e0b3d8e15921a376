package com.titiplex.frost.core.error;

public class FrostException extends RuntimeException {
    private final ErrorKind kind;

    public FrostException(ErrorKind kind, String reason) {
        super(reason);
        this.kind = kind;
    }

    public FrostException(ErrorKind kind, String reason, Throwable cause) {
        super(reason, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public String reason() {
        return getMessage();
    }

    @Override
    public String toString() {
        return "FrostException[" + kind + "]: " + getMessage();
    }
}
