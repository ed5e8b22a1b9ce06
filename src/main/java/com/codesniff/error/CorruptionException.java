package com.codesniff.error;

public class CorruptionException extends CodeSniffException {
    public CorruptionException(String message) {
        super(message);
    }

    public CorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
