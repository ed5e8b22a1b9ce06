package com.codesniff.ingest;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SourceScannerTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldSkipVendoredDirectoriesAndUseRelativePaths() throws Exception {
        Files.createDirectories(tempDir.resolve("src/app"));
        Files.createDirectories(tempDir.resolve("node_modules/lib"));
        Files.writeString(tempDir.resolve("src/app/db.py"), "def connect_db():\n    pass\n");
        Files.writeString(tempDir.resolve("src/app/util.ts"), "export function slugify(text) {\n  return text;\n}\n");
        Files.writeString(tempDir.resolve("node_modules/lib/index.js"), "function vendored() {\n}\n");
        Files.writeString(tempDir.resolve("README.md"), "# readme\n");

        SourceScanner.ScanResult result = new SourceScanner().scan(tempDir);

        assertEquals(2, result.filesParsed());
        assertEquals(List.of("src/app/db.py", "src/app/util.ts"),
                result.symbols().stream().map(ParsedSymbol::filePath).toList());
        assertEquals(List.of(), result.failures());
    }

    @Test
    void shouldReportFailingFilesAndKeepScanning() throws Exception {
        Files.writeString(tempDir.resolve("good.py"), "def fine():\n    pass\n");
        Files.writeString(tempDir.resolve("bad.py"), "def broken():\n    pass\n");
        SymbolParser failing = new SymbolParser() {
            private final SymbolParser delegate = new RegexSymbolParser(List.of(".py"), RegexSymbolParser.BlockStyle.INDENTATION);

            @Override
            public boolean supports(Path path) {
                return delegate.supports(path);
            }

            @Override
            public List<ParsedSymbol> parse(Path path, String relativePath) throws IOException {
                if (relativePath.startsWith("bad")) {
                    throw new IOException("unreadable");
                }
                return delegate.parse(path, relativePath);
            }
        };

        SourceScanner.ScanResult result = new SourceScanner(List.of(failing)).scan(tempDir);

        assertEquals(1, result.filesParsed());
        assertEquals(List.of("fine"), result.symbols().stream().map(ParsedSymbol::name).toList());
        assertEquals(1, result.failures().size());
        assertEquals("bad.py", result.failures().get(0).filePath());
    }
}
