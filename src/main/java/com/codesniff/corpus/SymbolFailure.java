package com.codesniff.corpus;

/**
 * One symbol that could not be indexed. {@code position} is its index in the submitted sequence;
 * a {@link Category#PARSE} failure covers a whole file, so it has position -1 and no symbol.
 */
public record SymbolFailure(int position, String symbol, String filePath, Category category, String message) {
    public enum Category {
        INVALID_SYMBOL,
        PROVIDER,
        WRITE,
        PARSE
    }
}
