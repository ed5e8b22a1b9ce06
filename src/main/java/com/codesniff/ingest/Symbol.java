package com.codesniff.ingest;

import java.util.ArrayList;
import java.util.List;

import com.codesniff.error.ConfigurationException;

/**
 * A validated, indexable code unit. The id is derived from (file path, name, start line) and the
 * content hash from the code text, so both are stable across runs.
 */
public record Symbol(
        String id,
        String name,
        SymbolKind kind,
        String filePath,
        int startLine,
        int endLine,
        String codeText,
        String docText,
        String contentHash) {

    public static Symbol from(ParsedSymbol parsed) {
        if (parsed == null) {
            throw new ConfigurationException("Symbol record is null");
        }
        List<String> missing = new ArrayList<>();
        if (isBlank(parsed.name())) {
            missing.add("name");
        }
        if (parsed.kind() == null) {
            missing.add("kind");
        }
        if (isBlank(parsed.filePath())) {
            missing.add("file_path");
        }
        if (parsed.codeText() == null) {
            missing.add("code_text");
        }
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Symbol is missing required fields " + missing);
        }
        if (parsed.startLine() < 1 || parsed.endLine() < parsed.startLine()) {
            throw new ConfigurationException("Symbol " + parsed.name() + " has invalid line range "
                    + parsed.startLine() + "-" + parsed.endLine());
        }
        String filePath = parsed.filePath().replace('\\', '/');
        String docText = parsed.docText() == null ? "" : parsed.docText().strip();
        return new Symbol(
                idOf(filePath, parsed.name(), parsed.startLine()),
                parsed.name(),
                parsed.kind(),
                filePath,
                parsed.startLine(),
                parsed.endLine(),
                parsed.codeText(),
                docText,
                ContentHashes.sha256(parsed.codeText()));
    }

    public static String idOf(String filePath, String name, int startLine) {
        return filePath.replace('\\', '/') + "::" + name + "@" + startLine;
    }

    public int lineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Text sent to the embedding provider.
     */
    public String embeddingText() {
        StringBuilder builder = new StringBuilder()
                .append(kind.label())
                .append(' ')
                .append(name)
                .append('\n');
        if (!docText.isEmpty()) {
            builder.append(docText).append('\n');
        }
        return builder.append(codeText).toString();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
