package com.codesniff;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.codesniff.context.AssembledContext;
import com.codesniff.context.ContextAssembler;
import com.codesniff.corpus.CancellationToken;
import com.codesniff.corpus.Corpus;
import com.codesniff.corpus.CorpusStats;
import com.codesniff.corpus.IndexingPipeline;
import com.codesniff.corpus.RunStats;
import com.codesniff.corpus.SymbolFailure;
import com.codesniff.ingest.EmbeddingService;
import com.codesniff.ingest.ParsedSymbol;
import com.codesniff.ingest.SourceScanner;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.runtime.AppConfig;
import com.codesniff.search.HybridRanker;
import com.codesniff.search.SearchRequest;
import com.codesniff.search.SearchResult;

/**
 * Entry point to one corpus: indexing goes through the pipeline, queries through the ranker.
 */
public class CodeSearchEngine {
    private final Corpus corpus;
    private final IndexingPipeline pipeline;
    private final HybridRanker ranker;
    private final ContextAssembler contextAssembler;
    private final SourceScanner scanner;
    private final AppConfig config;

    public CodeSearchEngine(Corpus corpus, EmbeddingService embeddingService, AppConfig config) {
        this(corpus, embeddingService, config, new SourceScanner());
    }

    public CodeSearchEngine(Corpus corpus, EmbeddingService embeddingService, AppConfig config, SourceScanner scanner) {
        this.corpus = corpus;
        this.config = config;
        this.pipeline = new IndexingPipeline(corpus, embeddingService, config.getEmbedding());
        this.ranker = new HybridRanker(corpus, embeddingService, config.getSearch());
        this.contextAssembler = new ContextAssembler(ranker, config.getContext());
        this.scanner = scanner;
    }

    public static CodeSearchEngine open(Path dataDir, AppConfig config, EmbeddingService embeddingService) throws IOException {
        return new CodeSearchEngine(Corpus.open(dataDir, config), embeddingService, config);
    }

    public RunStats index(List<ParsedSymbol> symbols) {
        return pipeline.index(symbols);
    }

    public RunStats index(List<ParsedSymbol> symbols, CancellationToken cancellation) {
        return pipeline.index(symbols, cancellation);
    }

    /**
     * Brings the corpus in line with the source tree under {@code root}: symbols of every file
     * found are synced, so moved or removed symbols are pruned, and symbols of files no longer on
     * disk are dropped. A file that fails to parse keeps its previously indexed symbols and is
     * reported as a {@link SymbolFailure.Category#PARSE} failure.
     */
    public RunStats indexDirectory(Path root) throws IOException {
        return indexDirectory(root, CancellationToken.none());
    }

    public RunStats indexDirectory(Path root, CancellationToken cancellation) throws IOException {
        SourceScanner.ScanResult scan = scanner.scan(root);
        Set<String> unparsed = new HashSet<>();
        List<SymbolFailure> parseFailures = new ArrayList<>();
        for (SourceScanner.FileFailure failure : scan.failures()) {
            unparsed.add(failure.filePath());
            parseFailures.add(new SymbolFailure(-1, null, failure.filePath(), SymbolFailure.Category.PARSE, failure.reason()));
        }
        Set<String> files = corpus.read(view -> {
            Set<String> paths = new HashSet<>();
            view.symbols().forEach(symbol -> paths.add(symbol.filePath()));
            return paths;
        });
        scan.symbols().forEach(symbol -> files.add(symbol.filePath()));
        files.removeAll(unparsed);
        return pipeline.syncFiles(files, scan.symbols(), cancellation).withFailuresBefore(parseFailures);
    }

    public List<SearchResult> search(String query, int limit, double minScore, Optional<SymbolKind> kind) {
        return ranker.search(new SearchRequest(query, limit, minScore, kind, Optional.empty()));
    }

    public List<SearchResult> search(SearchRequest request) {
        return ranker.search(request);
    }

    public List<SearchResult> search(String query) {
        return search(query, config.getSearch().getDefaultLimit(), config.getSearch().getMinScore(), Optional.empty());
    }

    public AssembledContext buildContext(String query) {
        return contextAssembler.assemble(query);
    }

    public void clear() {
        corpus.clear();
    }

    public CorpusStats stats() {
        return corpus.stats();
    }

    public void persist(Path dataDir) throws IOException {
        corpus.persist(dataDir);
    }

    public IndexingPipeline pipeline() {
        return pipeline;
    }

    public HybridRanker ranker() {
        return ranker;
    }

    public ContextAssembler contextAssembler() {
        return contextAssembler;
    }
}
