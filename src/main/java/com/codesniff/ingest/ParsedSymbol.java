package com.codesniff.ingest;

/**
 * Raw record handed over by a parser. Fields are not validated yet; see {@link Symbol#from(ParsedSymbol)}.
 */
public record ParsedSymbol(
        String name,
        SymbolKind kind,
        String filePath,
        int startLine,
        int endLine,
        String codeText,
        String docText) {
}
