package com.codesniff.ingest;

import java.util.Locale;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SymbolKind {
    FUNCTION("function"),
    CLASS("class"),
    METHOD("method");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Optional<SymbolKind> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String normalized = label.strip().toLowerCase(Locale.ROOT);
        for (SymbolKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    static SymbolKind parse(String label) {
        return fromLabel(label).orElseThrow(() -> new IllegalArgumentException("Unknown symbol kind: " + label));
    }
}
