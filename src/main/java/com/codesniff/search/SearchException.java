package com.codesniff.search;

import com.codesniff.error.CodeSniffException;

/**
 * A query that could not be answered, as opposed to one with no matches.
 */
public class SearchException extends CodeSniffException {
    public SearchException(String message, Throwable cause) {
        super(message, cause);
    }
}
