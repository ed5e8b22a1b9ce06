package com.codesniff.corpus;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.error.CodeSniffException;
import com.codesniff.error.DimensionMismatchException;
import com.codesniff.error.ProviderException;
import com.codesniff.index.CodeTokenizer;
import com.codesniff.ingest.EmbeddingService;
import com.codesniff.ingest.ParsedSymbol;
import com.codesniff.ingest.Symbol;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.runtime.AppConfig;

/**
 * The only write path into a {@link Corpus}. A run validates and deduplicates the submitted
 * symbols, embeds new or changed ones in batches (up to {@code maxConcurrentRequests} batches in
 * flight), then commits each symbol on its own. Failures are collected into {@link RunStats} and
 * never abort the run.
 */
public class IndexingPipeline {
    private static final Logger log = LoggerFactory.getLogger(IndexingPipeline.class);
    private static final AtomicInteger THREADS = new AtomicInteger();

    private final Corpus corpus;
    private final EmbeddingService embeddingService;
    private final TermVectors termVectors;
    private final int batchSize;
    private final int minBatchSize;
    private final int maxConcurrentRequests;

    public IndexingPipeline(Corpus corpus, EmbeddingService embeddingService, AppConfig.EmbeddingConfig config) {
        this(corpus, embeddingService, config.getBatchSize(), config.getMinBatchSize(), config.getMaxConcurrentRequests());
    }

    public IndexingPipeline(Corpus corpus,
                            EmbeddingService embeddingService,
                            int batchSize,
                            int minBatchSize,
                            int maxConcurrentRequests) {
        if (batchSize < 1 || maxConcurrentRequests < 1) {
            throw new IllegalArgumentException("batchSize and maxConcurrentRequests must be positive");
        }
        if (embeddingService.dimension() != corpus.dimension()) {
            throw new DimensionMismatchException(corpus.dimension(), embeddingService.dimension());
        }
        this.corpus = corpus;
        this.embeddingService = embeddingService;
        this.termVectors = new TermVectors(new CodeTokenizer());
        this.batchSize = batchSize;
        this.minBatchSize = Math.max(1, minBatchSize);
        this.maxConcurrentRequests = maxConcurrentRequests;
    }

    public RunStats index(List<ParsedSymbol> symbols) {
        return index(symbols, CancellationToken.none());
    }

    public RunStats index(List<ParsedSymbol> symbols, CancellationToken cancellation) {
        corpus.ingestLock().lock();
        try {
            return run(symbols, cancellation, Set.of());
        } finally {
            corpus.ingestLock().unlock();
        }
    }

    /**
     * Indexes the current symbols of one file and deletes that file's previously indexed symbols
     * that are no longer among them. A cancelled run prunes nothing.
     */
    public RunStats sync(String filePath, List<ParsedSymbol> symbols) {
        return sync(filePath, symbols, CancellationToken.none());
    }

    public RunStats sync(String filePath, List<ParsedSymbol> symbols, CancellationToken cancellation) {
        corpus.ingestLock().lock();
        try {
            return run(symbols, cancellation, Set.of(filePath.replace('\\', '/')));
        } finally {
            corpus.ingestLock().unlock();
        }
    }

    /**
     * Multi-file {@link #sync}: indexes {@code symbols} in one run, then prunes every indexed symbol
     * of the listed files that the run did not see. A listed file without submitted symbols is
     * emptied, which is how deleted files leave the corpus.
     */
    public RunStats syncFiles(Set<String> filePaths, List<ParsedSymbol> symbols, CancellationToken cancellation) {
        Set<String> normalized = new HashSet<>();
        filePaths.forEach(path -> normalized.add(path.replace('\\', '/')));
        corpus.ingestLock().lock();
        try {
            return run(symbols, cancellation, normalized);
        } finally {
            corpus.ingestLock().unlock();
        }
    }

    /**
     * Unknown ids are a no-op.
     */
    public boolean delete(String symbolId) {
        corpus.ingestLock().lock();
        try {
            boolean removed = corpus.delete(symbolId);
            log.debug("index.delete id={} removed={}", symbolId, removed);
            return removed;
        } finally {
            corpus.ingestLock().unlock();
        }
    }

    public int removeFile(String filePath) {
        corpus.ingestLock().lock();
        try {
            int removed = 0;
            for (String id : corpus.idsForFile(filePath)) {
                if (corpus.delete(id)) {
                    removed++;
                }
            }
            log.info("index.removeFile path={} removed={}", filePath, removed);
            return removed;
        } finally {
            corpus.ingestLock().unlock();
        }
    }

    private RunStats run(List<ParsedSymbol> input, CancellationToken cancellation, Set<String> syncedFiles) {
        long start = System.nanoTime();
        Tally tally = new Tally(input.size());
        List<Pending> pending = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int position = 0; position < input.size(); position++) {
            ParsedSymbol parsed = input.get(position);
            Symbol symbol;
            try {
                symbol = Symbol.from(parsed);
            } catch (CodeSniffException e) {
                tally.fail(position, parsed == null ? null : parsed.name(), parsed == null ? null : parsed.filePath(),
                        SymbolFailure.Category.INVALID_SYMBOL, e.getMessage());
                continue;
            }
            if (!seen.add(symbol.id())) {
                log.debug("index.skip reason=duplicate id={} position={}", symbol.id(), position);
                tally.skipped++;
                continue;
            }
            Optional<Symbol> existing = corpus.read(view -> view.symbol(symbol.id()));
            if (existing.isPresent() && existing.get().contentHash().equals(symbol.contentHash())) {
                log.debug("index.skip reason=unchanged id={}", symbol.id());
                tally.skipped++;
                continue;
            }
            pending.add(new Pending(position, symbol));
        }

        List<List<Pending>> batches = partition(pending);
        ExecutorService executor = batches.isEmpty() ? null : Executors.newFixedThreadPool(
                Math.min(maxConcurrentRequests, batches.size()), this::embeddingThread);
        try {
            Deque<Future<List<float[]>>> inFlight = new ArrayDeque<>();
            int submitted = 0;
            for (int b = 0; b < batches.size(); b++) {
                if (cancellation.isCancelled()) {
                    // prefetched embeddings are dropped; nothing of these batches was written
                    inFlight.forEach(remaining -> remaining.cancel(true));
                    for (int rest = b; rest < batches.size(); rest++) {
                        tally.cancelled += batches.get(rest).size();
                    }
                    log.info("index.cancelled remainingBatches={} remainingSymbols={}", batches.size() - b, tally.cancelled);
                    break;
                }
                while (submitted < batches.size() && inFlight.size() < maxConcurrentRequests) {
                    List<Pending> next = batches.get(submitted++);
                    inFlight.addLast(executor.submit(() -> embed(next)));
                }
                commitBatch(batches.get(b), Objects.requireNonNull(inFlight.pollFirst()), tally);
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        if (!syncedFiles.isEmpty() && tally.cancelled == 0) {
            List<String> stale = corpus.read(view -> view.symbols().stream()
                    .filter(symbol -> syncedFiles.contains(symbol.filePath()) && !seen.contains(symbol.id()))
                    .map(Symbol::id)
                    .toList());
            for (String id : stale) {
                if (corpus.delete(id)) {
                    tally.removed++;
                }
            }
        }

        RunStats stats = tally.toStats(Duration.ofNanos(System.nanoTime() - start));
        log.info("index.run submitted={} processed={} skipped={} failed={} cancelled={} removed={} lines={} elapsedMs={}",
                stats.submitted(), stats.processed(), stats.skipped(), stats.failed(), stats.cancelled(),
                stats.removed(), stats.totalLines(), stats.elapsed().toMillis());
        return stats;
    }

    private void commitBatch(List<Pending> batch, Future<List<float[]>> future, Tally tally) {
        List<float[]> vectors;
        try {
            vectors = future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failBatch(batch, tally, "interrupted while waiting for embeddings");
            return;
        } catch (CancellationException e) {
            failBatch(batch, tally, "embedding request cancelled");
            return;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("index.batch.failed size={} first={} reason={}", batch.size(), batch.get(0).symbol().id(), cause.getMessage());
            failBatch(batch, tally, cause.getMessage());
            return;
        }

        for (int i = 0; i < batch.size(); i++) {
            Pending item = batch.get(i);
            Symbol symbol = item.symbol();
            IndexEntry entry = new IndexEntry(symbol.id(), vectors.get(i), termVectors.of(symbol));
            try {
                corpus.commit(symbol, entry);
                tally.committed(symbol);
                log.debug("index.commit id={}", symbol.id());
            } catch (RuntimeException e) {
                log.warn("index.commit.failed id={} reason={}", symbol.id(), e.getMessage());
                tally.fail(item.position(), symbol.id(), symbol.filePath(), SymbolFailure.Category.WRITE, e.getMessage());
            }
        }
    }

    /**
     * Runs on the embedding executor. Any wrong-sized vector fails the whole batch.
     */
    private List<float[]> embed(List<Pending> batch) {
        List<String> texts = new ArrayList<>(batch.size());
        for (Pending item : batch) {
            texts.add(item.symbol().embeddingText());
        }
        List<float[]> vectors;
        if (texts.size() >= minBatchSize) {
            vectors = embeddingService.embedBatch(texts);
        } else {
            vectors = new ArrayList<>(texts.size());
            for (String text : texts) {
                vectors.add(embeddingService.embed(text));
            }
        }
        if (vectors == null || vectors.size() != texts.size()) {
            throw new ProviderException("Embedding provider returned " + (vectors == null ? 0 : vectors.size())
                    + " vectors for " + texts.size() + " inputs");
        }
        for (float[] vector : vectors) {
            if (vector == null || vector.length != corpus.dimension()) {
                throw new ProviderException("Embedding provider returned dimension "
                        + (vector == null ? 0 : vector.length) + ", expected " + corpus.dimension());
            }
        }
        return vectors;
    }

    private void failBatch(List<Pending> batch, Tally tally, String reason) {
        for (Pending item : batch) {
            tally.fail(item.position(), item.symbol().id(), item.symbol().filePath(), SymbolFailure.Category.PROVIDER, reason);
        }
    }

    private List<List<Pending>> partition(List<Pending> pending) {
        List<List<Pending>> batches = new ArrayList<>();
        for (int i = 0; i < pending.size(); i += batchSize) {
            batches.add(pending.subList(i, Math.min(i + batchSize, pending.size())));
        }
        return batches;
    }

    private Thread embeddingThread(Runnable task) {
        Thread thread = new Thread(task, "codesniff-embed-" + THREADS.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    }

    private record Pending(int position, Symbol symbol) {
    }

    private static final class Tally {
        private final int submitted;
        private int processed;
        private int skipped;
        private int cancelled;
        private int removed;
        private long totalLines;
        private final Map<SymbolKind, Integer> countsByKind = new EnumMap<>(SymbolKind.class);
        private final Set<String> files = new HashSet<>();
        private final List<SymbolFailure> failures = new ArrayList<>();

        Tally(int submitted) {
            this.submitted = submitted;
        }

        void committed(Symbol symbol) {
            processed++;
            totalLines += symbol.lineCount();
            countsByKind.merge(symbol.kind(), 1, Integer::sum);
            files.add(symbol.filePath());
        }

        void fail(int position, String symbol, String filePath, SymbolFailure.Category category, String message) {
            failures.add(new SymbolFailure(position, symbol, filePath, category, message));
        }

        RunStats toStats(Duration elapsed) {
            List<SymbolFailure> ordered = new ArrayList<>(failures);
            ordered.sort(Comparator.comparingInt(SymbolFailure::position));
            return new RunStats(
                    submitted,
                    processed,
                    skipped,
                    ordered.size(),
                    cancelled,
                    removed,
                    Map.copyOf(countsByKind),
                    totalLines,
                    files.size(),
                    elapsed,
                    List.copyOf(ordered));
        }
    }
}
