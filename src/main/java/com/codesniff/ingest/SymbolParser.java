package com.codesniff.ingest;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

public interface SymbolParser {
    boolean supports(Path path);

    /**
     * @param path         file to parse
     * @param relativePath path recorded on the produced symbols
     */
    List<ParsedSymbol> parse(Path path, String relativePath) throws IOException;
}
