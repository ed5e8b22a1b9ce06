package com.codesniff.corpus;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.codesniff.ScriptedEmbeddingService;
import com.codesniff.error.CorruptionException;
import com.codesniff.error.DimensionMismatchException;
import com.codesniff.ingest.ParsedSymbol;
import com.codesniff.ingest.Symbol;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.runtime.AppConfig;
import com.codesniff.search.HybridRanker;
import com.codesniff.search.SearchRequest;
import com.codesniff.search.SearchResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

class CorpusTest {
    private static final int DIMENSION = 32;

    @TempDir
    Path tempDir;

    private AppConfig config;
    private ScriptedEmbeddingService embedder;

    @BeforeEach
    void setUp() {
        config = new AppConfig();
        config.getCorpus().setDimension(DIMENSION);
        config.getVectorIndex().setApproximate(false);
        embedder = new ScriptedEmbeddingService(DIMENSION);
    }

    @Test
    void shouldReportEmptyStatsAndNoResultsAfterClear() {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());
        long version = corpus.version();

        corpus.clear();

        CorpusStats stats = corpus.stats();
        assertEquals(0, stats.totalSymbols());
        assertEquals(0, stats.totalFiles());
        assertEquals(0, stats.vectorCount());
        assertEquals(0, stats.uniqueTerms());
        assertTrue(stats.countsByKind().isEmpty());
        assertFalse(stats.ready());
        assertTrue(stats.version() > version);
        assertTrue(ranker(corpus).search(SearchRequest.of("user", 5, 0.0)).isEmpty());
    }

    @Test
    void shouldCountSymbolsFilesAndKinds() {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());

        CorpusStats stats = corpus.stats();

        assertEquals(3, stats.totalSymbols());
        assertEquals(2, stats.totalFiles());
        assertEquals(3, stats.vectorCount());
        assertEquals(2, stats.countsByKind().get(SymbolKind.FUNCTION));
        assertEquals(1, stats.countsByKind().get(SymbolKind.CLASS));
        assertEquals(DIMENSION, stats.dimension());
        assertTrue(stats.uniqueTerms() > 0);
        assertTrue(stats.averageDocumentLength() >= 1.0);
        assertTrue(stats.ready());
    }

    @Test
    void shouldAnswerIdenticallyAfterPersistAndOpen() throws Exception {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());
        List<SearchResult> before = ranker(corpus).search(SearchRequest.of("authenticate user", 5, 0.0));

        corpus.persist(tempDir);
        Corpus reopened = Corpus.open(tempDir, config);

        assertEquals(corpus.stats().totalSymbols(), reopened.stats().totalSymbols());
        assertEquals(corpus.stats().uniqueTerms(), reopened.stats().uniqueTerms());
        assertEquals(corpus.stats().averageDocumentLength(), reopened.stats().averageDocumentLength(), 1e-9);
        assertEquals(before, ranker(reopened).search(SearchRequest.of("authenticate user", 5, 0.0)));
    }

    @Test
    void shouldRebuildVectorsWhenVectorFileIsCorrupted() throws Exception {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());
        corpus.persist(tempDir);
        Files.writeString(tempDir.resolve(Corpus.VECTORS_FILE), "{\"type\":\"header\"\ngarbage");

        Corpus reopened = Corpus.open(tempDir, config);

        assertEquals(3, reopened.stats().vectorCount());
        assertFalse(ranker(reopened).findSimilar("def authenticate_user(name, password):", 3, 0.0).isEmpty());
    }

    @Test
    void shouldRebuildVectorsWhenVectorFileIsMissing() throws Exception {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());
        corpus.persist(tempDir);
        Files.delete(tempDir.resolve(Corpus.VECTORS_FILE));

        Corpus reopened = Corpus.open(tempDir, config);

        assertEquals(3, reopened.stats().vectorCount());
    }

    @Test
    void shouldRebuildVectorsThatDisagreeWithStoredEmbeddings() throws Exception {
        Corpus corpus = Corpus.inMemory(config);
        IndexingPipeline pipeline = new IndexingPipeline(corpus, embedder, config.getEmbedding());
        pipeline.index(List.of(loadUser("def load_user(uid):\n    return db.get(uid)\n")));
        corpus.persist(tempDir);
        byte[] previousVectors = Files.readAllBytes(tempDir.resolve(Corpus.VECTORS_FILE));
        pipeline.index(List.of(loadUser("def load_user(uid):\n    cache = Cache()\n    return cache.fetch(uid)\n")));
        corpus.persist(tempDir);
        Files.write(tempDir.resolve(Corpus.VECTORS_FILE), previousVectors);

        Corpus reopened = Corpus.open(tempDir, config);

        String id = Symbol.idOf("users.py", "load_user", 1);
        double similarity = reopened.read(view ->
                view.similarity(id, view.entry(id).orElseThrow().embedding()).orElseThrow());
        assertEquals(1.0, similarity, 1e-6);
    }

    @Test
    void shouldRefuseStoredEntryWithoutId() throws Exception {
        persistAndEditFirstEntry(entry -> ((ObjectNode) entry.get("symbol")).putNull("id"));

        assertThrows(CorruptionException.class, () -> Corpus.open(tempDir, config));
    }

    @Test
    void shouldRefuseStoredEmbeddingOfWrongSize() throws Exception {
        persistAndEditFirstEntry(entry -> ((ObjectNode) entry.get("entry")).putArray("embedding").add(1.0));

        assertThrows(CorruptionException.class, () -> Corpus.open(tempDir, config));
    }

    @Test
    void shouldRefuseStoredEntryWithoutEmbedding() throws Exception {
        persistAndEditFirstEntry(entry -> ((ObjectNode) entry.get("entry")).remove("embedding"));

        assertThrows(CorruptionException.class, () -> Corpus.open(tempDir, config));
    }

    @Test
    void shouldRefuseUnreadableSymbolStore() throws Exception {
        Files.writeString(tempDir.resolve(Corpus.SYMBOLS_FILE), "{\"version\": 1, \"symbols\": [");

        assertThrows(CorruptionException.class, () -> Corpus.open(tempDir, config));
    }

    @Test
    void shouldRefuseCorpusBuiltForAnotherDimension() throws Exception {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());
        corpus.persist(tempDir);

        AppConfig wider = new AppConfig();
        wider.getCorpus().setDimension(DIMENSION * 2);

        assertThrows(DimensionMismatchException.class, () -> Corpus.open(tempDir, wider));
    }

    @Test
    void shouldOpenEmptyCorpusWhenNothingWasPersisted() throws Exception {
        Corpus corpus = Corpus.open(tempDir.resolve("fresh"), config);

        assertEquals(0, corpus.stats().totalSymbols());
        assertTrue(corpus.read(CorpusView::isEmpty));
    }

    @Test
    void shouldReclaimSlotsOnVectorRebuild() {
        Corpus corpus = Corpus.inMemory(config);
        IndexingPipeline pipeline = new IndexingPipeline(corpus, embedder, config.getEmbedding());
        pipeline.index(symbols());
        pipeline.removeFile("auth/session.py");

        corpus.rebuildVectorIndex();

        assertEquals(1, corpus.stats().vectorCount());
        assertEquals(1, corpus.read(view -> view.nearest(embedder.embed("connect database"), 10)).size());
    }

    private void persistAndEditFirstEntry(Consumer<JsonNode> edit) throws Exception {
        Corpus corpus = Corpus.inMemory(config);
        new IndexingPipeline(corpus, embedder, config.getEmbedding()).index(symbols());
        corpus.persist(tempDir);
        ObjectMapper mapper = new ObjectMapper();
        Path file = tempDir.resolve(Corpus.SYMBOLS_FILE);
        JsonNode snapshot = mapper.readTree(file.toFile());
        edit.accept(snapshot.get("symbols").get(0));
        mapper.writeValue(file.toFile(), snapshot);
    }

    private static ParsedSymbol loadUser(String code) {
        return new ParsedSymbol("load_user", SymbolKind.FUNCTION, "users.py", 1, 3, code, "Loads a user.");
    }

    private HybridRanker ranker(Corpus corpus) {
        return new HybridRanker(corpus, embedder, config.getSearch());
    }

    private static List<ParsedSymbol> symbols() {
        return List.of(
                new ParsedSymbol("authenticate_user", SymbolKind.FUNCTION, "auth/session.py", 1, 3,
                        "def authenticate_user(name, password):\n    return check(name, password)\n", "Validates user credentials."),
                new ParsedSymbol("Session", SymbolKind.CLASS, "auth/session.py", 5, 9,
                        "class Session:\n    def __init__(self, user):\n        self.user = user\n", "Tracks a logged in user."),
                new ParsedSymbol("connect_db", SymbolKind.FUNCTION, "db/pool.py", 1, 2,
                        "def connect_db(url):\n    return Pool(url)\n", "Opens the database pool."));
    }
}
