package com.codesniff.error;

/**
 * Fatal for the current operation only: a malformed symbol, an invalid setting or an
 * embedding whose dimensionality does not match the corpus.
 */
public class ConfigurationException extends CodeSniffException {
    public ConfigurationException(String message) {
        super(message);
    }
}
