package com.codesniff.error;

public class CodeSniffException extends RuntimeException {
    public CodeSniffException(String message) {
        super(message);
    }

    public CodeSniffException(String message, Throwable cause) {
        super(message, cause);
    }
}
