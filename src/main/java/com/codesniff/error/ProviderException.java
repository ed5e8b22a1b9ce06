package com.codesniff.error;

/**
 * An external collaborator (embedding provider, completion service) was unreachable or
 * answered with something unusable.
 */
public class ProviderException extends CodeSniffException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
