package com.codesniff.ingest;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Walks a source tree and hands every supported file to its parser. A file that fails to parse is
 * logged and reported but never aborts the scan.
 */
public class SourceScanner {
    private static final Logger log = LoggerFactory.getLogger(SourceScanner.class);
    private static final Set<String> SKIPPED_DIRECTORIES = Set.of(
            ".git", ".hg", ".svn", "node_modules", "__pycache__", ".venv", "venv", "env",
            "dist", "build", "target", ".idea", ".mypy_cache", ".pytest_cache", ".codesniff");

    private final List<SymbolParser> parsers;

    public SourceScanner() {
        this(RegexSymbolParser.defaults());
    }

    public SourceScanner(List<SymbolParser> parsers) {
        this.parsers = List.copyOf(parsers);
    }

    public ScanResult scan(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new IOException("Not a directory: " + root);
        }
        List<Path> files = new ArrayList<>();
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                if (!dir.equals(root) && SKIPPED_DIRECTORIES.contains(dir.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                if (attrs.isRegularFile() && parserFor(file).isPresent()) {
                    files.add(file);
                }
                return FileVisitResult.CONTINUE;
            }
        });
        files.sort(null);

        List<ParsedSymbol> symbols = new ArrayList<>();
        List<FileFailure> failures = new ArrayList<>();
        int parsed = 0;
        for (Path file : files) {
            String relative = root.relativize(file).toString().replace('\\', '/');
            try {
                symbols.addAll(parserFor(file).orElseThrow().parse(file, relative));
                parsed++;
            } catch (IOException | RuntimeException e) {
                log.warn("Skipping unparseable file path={} error={}", relative, e.toString());
                failures.add(new FileFailure(relative, e.toString()));
            }
        }
        log.info("Scanned source tree root={} files={} parsed={} failed={} symbols={}",
                root, files.size(), parsed, failures.size(), symbols.size());
        return new ScanResult(symbols, parsed, failures);
    }

    private Optional<SymbolParser> parserFor(Path path) {
        return parsers.stream().filter(parser -> parser.supports(path)).findFirst();
    }

    public record FileFailure(String filePath, String reason) {
    }

    public record ScanResult(List<ParsedSymbol> symbols, int filesParsed, List<FileFailure> failures) {
    }
}
