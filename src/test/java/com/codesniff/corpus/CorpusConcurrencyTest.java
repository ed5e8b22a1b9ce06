package com.codesniff.corpus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.codesniff.ScriptedEmbeddingService;
import com.codesniff.index.LexicalIndex;
import com.codesniff.index.LocalVectorIndex;
import com.codesniff.ingest.ParsedSymbol;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.search.HybridRanker;
import com.codesniff.search.SearchRequest;
import com.codesniff.search.SearchResult;

class CorpusConcurrencyTest {
    private static final int DIMENSION = 32;

    private final ExecutorService executor = Executors.newFixedThreadPool(2);
    private final CountDownLatch started = new CountDownLatch(1);
    private final CountDownLatch release = new CountDownLatch(1);
    private Corpus corpus;
    private ScriptedEmbeddingService embedder;
    private IndexingPipeline pipeline;

    @BeforeEach
    void setUp() {
        corpus = new Corpus(DIMENSION, new LexicalIndex(), new LocalVectorIndex(DIMENSION, LocalVectorIndex.Options.exact()));
        embedder = new ScriptedEmbeddingService(DIMENSION);
        pipeline = new IndexingPipeline(corpus, embedder, 1, 2, 1);
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        executor.shutdownNow();
    }

    @Test
    void shouldWaitForInFlightReadBeforeClearing() throws Exception {
        pipeline.index(symbols("auth.py", "authenticate_user", "logout_user", "refresh_token"));
        Future<Integer> reading = executor.submit(() -> corpus.read(view -> {
            started.countDown();
            await(release);
            return view.size();
        }));
        await(started);

        Future<?> clearing = executor.submit(corpus::clear);

        assertThrows(TimeoutException.class, () -> clearing.get(200, TimeUnit.MILLISECONDS));
        release.countDown();
        assertEquals(3, reading.get(5, TimeUnit.SECONDS));
        clearing.get(5, TimeUnit.SECONDS);
        assertEquals(0, corpus.stats().totalSymbols());
    }

    @Test
    void shouldSeeClearedCorpusWhenClearLandsBeforeSearchReads() throws Exception {
        pipeline.index(symbols("auth.py", "authenticate_user", "logout_user", "refresh_token"));
        embedder.beforeCall(texts -> {
            started.countDown();
            await(release);
        });
        HybridRanker ranker = new HybridRanker(corpus, embedder, 0.7, 3, 50);
        Future<List<SearchResult>> searching = executor.submit(() ->
                ranker.search(SearchRequest.of("authenticate user", 5, 0.0)));
        await(started);

        corpus.clear();
        release.countDown();

        assertTrue(searching.get(5, TimeUnit.SECONDS).isEmpty());
    }

    @Test
    void shouldWaitForInFlightIndexingRunBeforeClearing() throws Exception {
        embedder.beforeCall(texts -> {
            started.countDown();
            await(release);
        });
        Future<RunStats> indexing = executor.submit(() ->
                pipeline.index(symbols("auth.py", "authenticate_user", "logout_user", "refresh_token")));
        await(started);

        Future<?> clearing = executor.submit(corpus::clear);

        assertThrows(TimeoutException.class, () -> clearing.get(200, TimeUnit.MILLISECONDS));
        release.countDown();
        assertEquals(3, indexing.get(5, TimeUnit.SECONDS).processed());
        clearing.get(5, TimeUnit.SECONDS);
        assertEquals(0, corpus.stats().totalSymbols());
        assertEquals(0, corpus.stats().vectorCount());
    }

    @Test
    void shouldRunConcurrentIndexingRunsOneAfterAnother() throws Exception {
        List<String> embedded = Collections.synchronizedList(new ArrayList<>());
        embedder.beforeCall(texts -> {
            embedded.addAll(texts);
            started.countDown();
            await(release);
        });
        Future<RunStats> first = executor.submit(() -> pipeline.index(symbols("alpha.py", "alpha_one", "alpha_two", "alpha_three")));
        await(started);
        Future<RunStats> second = executor.submit(() -> pipeline.index(symbols("beta.py", "beta_one", "beta_two", "beta_three")));
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!corpus.ingestLock().hasQueuedThreads() && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(corpus.ingestLock().hasQueuedThreads());
        assertEquals(1, embedded.size());

        release.countDown();

        assertEquals(3, first.get(5, TimeUnit.SECONDS).processed());
        assertEquals(3, second.get(5, TimeUnit.SECONDS).processed());
        List<String> order = new ArrayList<>(embedded);
        assertEquals(6, order.size());
        assertTrue(order.subList(0, 3).stream().allMatch(text -> text.contains("alpha_")), order.toString());
        assertFalse(order.subList(3, 6).stream().anyMatch(text -> text.contains("alpha_")), order.toString());
        assertEquals(6, corpus.stats().totalSymbols());
    }

    private static List<ParsedSymbol> symbols(String filePath, String... names) {
        List<ParsedSymbol> symbols = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            int line = i * 4 + 1;
            symbols.add(new ParsedSymbol(names[i], SymbolKind.FUNCTION, filePath, line, line + 1,
                    "def " + names[i] + "(user):\n    return user\n", ""));
        }
        return symbols;
    }

    private static void await(CountDownLatch latch) {
        try {
            if (!latch.await(5, TimeUnit.SECONDS)) {
                throw new AssertionError("latch not released");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssertionError("interrupted", e);
        }
    }
}
