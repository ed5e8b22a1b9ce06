package com.codesniff.context;

import java.util.List;

/**
 * Context for a grounded answer. {@code grounded} is false when nothing scored above the
 * threshold or fit the budget; text and citations are then empty.
 */
public record AssembledContext(String text, List<Citation> citations, boolean grounded) {
    public AssembledContext {
        citations = List.copyOf(citations);
    }

    public static AssembledContext empty() {
        return new AssembledContext("", List.of(), false);
    }
}
