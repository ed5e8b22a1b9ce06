package com.codesniff.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class RegexSymbolParserTest {

    @TempDir
    Path tempDir;

    private final RegexSymbolParser python = new RegexSymbolParser(List.of(".py"), RegexSymbolParser.BlockStyle.INDENTATION);
    private final RegexSymbolParser javascript = new RegexSymbolParser(List.of(".js", ".ts"), RegexSymbolParser.BlockStyle.BRACES);

    @Test
    void shouldExtractPythonFunctionsClassesMethodsAndDocstrings() throws Exception {
        Path file = tempDir.resolve("auth.py");
        Files.writeString(file, """
                import hashlib


                def authenticate_user(username, password):
                    \"\"\"Verifies user credentials.\"\"\"
                    return check(username, password)


                class Session:
                    \"\"\"
                    Tracks a logged in user.
                    \"\"\"

                    def refresh(self):
                        return True

                def connect_db():  # opens a connection
                    pass
                """);

        List<ParsedSymbol> symbols = python.parse(file, "src/auth.py");

        assertEquals(List.of("authenticate_user", "Session", "refresh", "connect_db"),
                symbols.stream().map(ParsedSymbol::name).toList());
        assertEquals(List.of(SymbolKind.FUNCTION, SymbolKind.CLASS, SymbolKind.METHOD, SymbolKind.FUNCTION),
                symbols.stream().map(ParsedSymbol::kind).toList());

        ParsedSymbol authenticate = symbols.get(0);
        assertEquals("Verifies user credentials.", authenticate.docText());
        assertEquals(4, authenticate.startLine());
        assertEquals(6, authenticate.endLine());
        assertEquals("src/auth.py", authenticate.filePath());
        assertEquals("Tracks a logged in user.", symbols.get(1).docText());
        assertEquals(9, symbols.get(1).startLine());
        assertEquals(15, symbols.get(1).endLine());
        assertEquals("", symbols.get(3).docText());
    }

    @Test
    void shouldSpanMultiLinePythonSignatures() throws Exception {
        Path file = tempDir.resolve("multi.py");
        Files.writeString(file, """
                def build(
                    name,
                    value,
                ):
                    \"\"\"Builds a thing.\"\"\"
                    return name
                """);

        List<ParsedSymbol> symbols = python.parse(file, "multi.py");

        assertEquals(1, symbols.size());
        assertEquals("Builds a thing.", symbols.get(0).docText());
        assertEquals(6, symbols.get(0).endLine());
    }

    @Test
    void shouldExtractJavaScriptSymbolsWithJsDoc() throws Exception {
        Path file = tempDir.resolve("api.js");
        Files.writeString(file, """
                /**
                 * Sends a request to the API.
                 * @param {string} url
                 */
                export async function sendRequest(url) {
                  if (url) {
                    return fetch(url);
                  }
                }

                const formatName = (first, last) => {
                  return `${first} ${last}`;
                };

                class UserService {
                  constructor(client) {
                    this.client = client;
                  }

                  async loadUser(id) {
                    for (const x of []) {}
                    return this.client.get(id);
                  }
                }
                """);

        List<ParsedSymbol> symbols = javascript.parse(file, "api.js");

        assertEquals(List.of("sendRequest", "formatName", "UserService", "constructor", "loadUser"),
                symbols.stream().map(ParsedSymbol::name).toList());
        assertEquals("Sends a request to the API.", symbols.get(0).docText());
        assertEquals(5, symbols.get(0).startLine());
        assertEquals(9, symbols.get(0).endLine());
        assertEquals(SymbolKind.CLASS, symbols.get(2).kind());
        assertEquals(SymbolKind.METHOD, symbols.get(4).kind());
        assertEquals(24, symbols.get(2).endLine());
    }

    @Test
    void shouldParseFilesContainingInvalidUtf8Bytes() throws Exception {
        Path sourceFile = tempDir.resolve("broken.py");
        byte[] prefix = "def bro():\n    return '".getBytes(StandardCharsets.UTF_8);
        byte[] invalidUtf8 = new byte[] {(byte) 0xC3, (byte) 0x28};
        byte[] suffix = "ken'\n".getBytes(StandardCharsets.UTF_8);

        byte[] content = new byte[prefix.length + invalidUtf8.length + suffix.length];
        System.arraycopy(prefix, 0, content, 0, prefix.length);
        System.arraycopy(invalidUtf8, 0, content, prefix.length, invalidUtf8.length);
        System.arraycopy(suffix, 0, content, prefix.length + invalidUtf8.length, suffix.length);
        Files.write(sourceFile, content);

        List<ParsedSymbol> symbols = python.parse(sourceFile, "broken.py");

        assertEquals(1, symbols.size());
        assertTrue(symbols.get(0).codeText().contains("\uFFFD"));
    }

    @Test
    void shouldIgnoreUnsupportedExtensions() throws Exception {
        Path file = tempDir.resolve("notes.txt");
        Files.writeString(file, "def not_code(): pass\n");

        assertFalse(python.supports(file));
        assertTrue(python.parse(file, "notes.txt").isEmpty());
    }
}
