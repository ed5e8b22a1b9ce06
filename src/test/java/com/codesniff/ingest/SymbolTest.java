package com.codesniff.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.codesniff.error.ConfigurationException;

class SymbolTest {

    @Test
    void shouldDeriveStableIdAndHash() {
        ParsedSymbol parsed = new ParsedSymbol("load", SymbolKind.FUNCTION, "src\\io.py", 3, 5, "def load(): pass", null);

        Symbol first = Symbol.from(parsed);
        Symbol second = Symbol.from(parsed);

        assertEquals("src/io.py::load@3", first.id());
        assertEquals(first.contentHash(), second.contentHash());
        assertEquals("", first.docText());
        assertEquals(3, first.lineCount());
    }

    @Test
    void shouldChangeHashWhenCodeChanges() {
        Symbol before = Symbol.from(new ParsedSymbol("f", SymbolKind.FUNCTION, "a.py", 1, 1, "def f(): return 1", ""));
        Symbol after = Symbol.from(new ParsedSymbol("f", SymbolKind.FUNCTION, "a.py", 1, 1, "def f(): return 2", ""));

        assertEquals(before.id(), after.id());
        assertNotEquals(before.contentHash(), after.contentHash());
    }

    @Test
    void shouldRejectMissingRequiredFields() {
        ConfigurationException error = assertThrows(ConfigurationException.class,
                () -> Symbol.from(new ParsedSymbol("f", SymbolKind.FUNCTION, null, 1, 2, "def f(): pass", "")));

        assertTrue(error.getMessage().contains("file_path"));
        assertThrows(ConfigurationException.class,
                () -> Symbol.from(new ParsedSymbol("f", null, "a.py", 1, 2, "def f(): pass", "")));
        assertThrows(ConfigurationException.class,
                () -> Symbol.from(new ParsedSymbol("f", SymbolKind.FUNCTION, "a.py", 5, 2, "def f(): pass", "")));
    }

    @Test
    void shouldParseKindLabelsCaseInsensitively() {
        assertEquals(SymbolKind.METHOD, SymbolKind.fromLabel(" Method ").orElseThrow());
        assertTrue(SymbolKind.fromLabel("module").isEmpty());
    }
}
