package com.codesniff.corpus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.error.DimensionMismatchException;
import com.codesniff.index.LexicalIndex;
import com.codesniff.index.LexicalIndex.LexicalHit;
import com.codesniff.index.LocalVectorIndex;
import com.codesniff.index.VectorHit;
import com.codesniff.index.VectorIndex;
import com.codesniff.ingest.Symbol;
import com.codesniff.ingest.SymbolKind;
import com.codesniff.runtime.AppConfig;

/**
 * Owns the symbol store and both indexes. Reads run concurrently under a shared lock; commits,
 * deletes and {@link #clear()} take the exclusive lock, so a search sees the corpus either before
 * or after a write, never in between. Indexing runs are additionally serialized by a per-corpus
 * ingest lock.
 */
public class Corpus {
    private static final Logger log = LoggerFactory.getLogger(Corpus.class);
    static final String SYMBOLS_FILE = "symbols.json";
    static final String VECTORS_FILE = "vectors.jsonl";

    private final int dimension;
    private final SymbolStore store;
    private final LexicalIndex lexical;
    private final VectorIndex vectors;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final ReentrantLock ingestLock = new ReentrantLock();
    private final View view = new View();
    private long version;

    public Corpus(int dimension, LexicalIndex lexical, VectorIndex vectors) {
        this(dimension, new SymbolStore(), lexical, vectors);
    }

    Corpus(int dimension, SymbolStore store, LexicalIndex lexical, VectorIndex vectors) {
        if (vectors.dimension() != dimension) {
            throw new DimensionMismatchException(dimension, vectors.dimension());
        }
        this.dimension = dimension;
        this.store = store;
        this.lexical = lexical;
        this.vectors = vectors;
    }

    public static Corpus inMemory(AppConfig config) {
        int dimension = config.getCorpus().getDimension();
        return new Corpus(dimension, lexicalIndex(config), new LocalVectorIndex(dimension, vectorOptions(config)));
    }

    /**
     * Opens the corpus persisted under {@code directory}, or an empty one when nothing was
     * persisted yet. A vector file that is corrupted, or holds a different id set or a different
     * vector for any stored symbol, is rebuilt from the stored embeddings; the lexical index is
     * always rebuilt from the stored term vectors.
     *
     * @throws com.codesniff.error.CorruptionException when the symbol store itself is unreadable
     * @throws DimensionMismatchException when the persisted corpus was built for another dimensionality
     */
    public static Corpus open(Path directory, AppConfig config) throws IOException {
        int dimension = config.getCorpus().getDimension();
        SymbolStore store = SymbolStore.load(directory.resolve(SYMBOLS_FILE));
        if (store.size() > 0 && store.storedDimension() != dimension) {
            throw new DimensionMismatchException(dimension, store.storedDimension());
        }
        LocalVectorIndex.LoadResult loaded =
                LocalVectorIndex.load(directory.resolve(VECTORS_FILE), dimension, vectorOptions(config));

        Corpus corpus = new Corpus(dimension, store, lexicalIndex(config), loaded.index());
        for (SymbolStore.StoredSymbol stored : store.all()) {
            corpus.lexical.index(stored.symbol().id(), stored.entry().termVector());
        }
        Set<String> storedIds = new HashSet<>();
        int stale = 0;
        for (SymbolStore.StoredSymbol stored : store.all()) {
            storedIds.add(stored.symbol().id());
            if (!loaded.index().holds(stored.symbol().id(), stored.entry().embedding())) {
                stale++;
            }
        }
        if (loaded.corrupted() || stale > 0 || !loaded.index().ids().equals(storedIds)) {
            log.warn("corpus.vectors.rebuild directory={} corrupted={} discarded={} detail={} stored={} loaded={} stale={}",
                    directory, loaded.corrupted(), loaded.discardedRecords(), loaded.detail(),
                    storedIds.size(), loaded.index().size(), stale);
            corpus.rebuildVectorIndex();
        }
        log.info("corpus.open directory={} symbols={} dimension={}", directory, store.size(), dimension);
        return corpus;
    }

    static LocalVectorIndex.Options vectorOptions(AppConfig config) {
        AppConfig.VectorIndexConfig vectorIndex = config.getVectorIndex();
        return new LocalVectorIndex.Options(
                vectorIndex.isApproximate(),
                vectorIndex.getApproximateMinSize(),
                vectorIndex.getMinCandidateFraction(),
                vectorIndex.getSignatureBits(),
                vectorIndex.getPersistBatchSize());
    }

    private static LexicalIndex lexicalIndex(AppConfig config) {
        return new LexicalIndex(config.getLexical().getK1(), config.getLexical().getB());
    }

    public int dimension() {
        return dimension;
    }

    public long version() {
        lock.readLock().lock();
        try {
            return version;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Runs {@code reader} against a consistent snapshot. The view must not escape the callback.
     */
    public <T> T read(Function<CorpusView, T> reader) {
        lock.readLock().lock();
        try {
            return reader.apply(view);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Writes symbol, vector and lexical entry as one unit. Any previous entry for the id is removed
     * from both indexes first; if an index rejects the new entry, the previous state is restored and
     * the failure rethrown.
     */
    void commit(Symbol symbol, IndexEntry entry) {
        lock.writeLock().lock();
        try {
            String id = symbol.id();
            SymbolStore.StoredSymbol previous = store.put(symbol, entry);
            if (previous != null) {
                vectors.delete(id);
                lexical.remove(id);
            }
            try {
                vectors.insert(id, entry.embedding());
                lexical.index(id, entry.termVector());
            } catch (RuntimeException e) {
                vectors.delete(id);
                lexical.remove(id);
                store.restore(id, previous);
                if (previous != null) {
                    vectors.insert(id, previous.entry().embedding());
                    lexical.index(id, previous.entry().termVector());
                }
                throw e;
            }
            version++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes a symbol and its index entries. Unknown ids are a no-op.
     *
     * @return whether anything was removed
     */
    boolean delete(String id) {
        lock.writeLock().lock();
        try {
            if (store.remove(id) == null) {
                return false;
            }
            vectors.delete(id);
            lexical.remove(id);
            version++;
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    List<String> idsForFile(String filePath) {
        String normalized = filePath.replace('\\', '/');
        return read(corpus -> {
            List<String> ids = new ArrayList<>();
            for (Symbol symbol : corpus.symbols()) {
                if (symbol.filePath().equals(normalized)) {
                    ids.add(symbol.id());
                }
            }
            return ids;
        });
    }

    ReentrantLock ingestLock() {
        return ingestLock;
    }

    /**
     * Drops every symbol and index entry. Waits for a running indexing run and in-flight reads.
     */
    public void clear() {
        ingestLock.lock();
        try {
            lock.writeLock().lock();
            try {
                int dropped = store.size();
                store.clear();
                lexical.clear();
                vectors.clear();
                version++;
                log.info("corpus.clear dropped={}", dropped);
            } finally {
                lock.writeLock().unlock();
            }
        } finally {
            ingestLock.unlock();
        }
    }

    /**
     * Recreates the vector index from the stored embeddings, reclaiming space left by deletes.
     */
    public void rebuildVectorIndex() {
        lock.writeLock().lock();
        try {
            vectors.rebuild(store.embeddings());
            log.info("corpus.vectors.rebuilt vectors={}", vectors.size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    public CorpusStats stats() {
        lock.readLock().lock();
        try {
            Map<SymbolKind, Integer> countsByKind = new EnumMap<>(SymbolKind.class);
            Set<String> files = new HashSet<>();
            for (SymbolStore.StoredSymbol stored : store.all()) {
                countsByKind.merge(stored.symbol().kind(), 1, Integer::sum);
                files.add(stored.symbol().filePath());
            }
            return new CorpusStats(
                    store.size(),
                    files.size(),
                    Map.copyOf(countsByKind),
                    vectors.size(),
                    lexical.termCount(),
                    lexical.averageDocumentLength(),
                    dimension,
                    version);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void persist(Path directory) throws IOException {
        lock.readLock().lock();
        try {
            Files.createDirectories(directory);
            store.save(directory.resolve(SYMBOLS_FILE), dimension);
            vectors.persist(directory.resolve(VECTORS_FILE));
            log.info("corpus.persist directory={} symbols={} vectors={}", directory, store.size(), vectors.size());
        } finally {
            lock.readLock().unlock();
        }
    }

    private final class View implements CorpusView {
        @Override
        public int size() {
            return store.size();
        }

        @Override
        public Optional<Symbol> symbol(String id) {
            return store.get(id).map(SymbolStore.StoredSymbol::symbol);
        }

        @Override
        public Optional<IndexEntry> entry(String id) {
            return store.get(id).map(SymbolStore.StoredSymbol::entry);
        }

        @Override
        public Collection<Symbol> symbols() {
            List<Symbol> symbols = new ArrayList<>(store.size());
            store.all().forEach(stored -> symbols.add(stored.symbol()));
            return symbols;
        }

        @Override
        public Map<String, LexicalHit> lexicalMatch(Map<String, Double> weightedTerms) {
            return lexical.match(weightedTerms);
        }

        @Override
        public List<VectorHit> nearest(float[] queryEmbedding, int k) {
            return vectors.search(queryEmbedding, k);
        }

        @Override
        public OptionalDouble similarity(String id, float[] queryEmbedding) {
            return vectors.similarity(id, queryEmbedding);
        }

        @Override
        public List<String> autocomplete(String prefix, int limit) {
            return lexical.autocomplete(prefix, limit);
        }

        @Override
        public List<String> popularTerms(int limit) {
            return lexical.popularTerms(limit);
        }
    }
}
