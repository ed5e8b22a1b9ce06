package com.codesniff.corpus;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.codesniff.error.CorruptionException;
import com.codesniff.ingest.Symbol;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Durable record of every indexed symbol with its index entry, keyed by symbol id. Iteration is in
 * id order.
 */
public class SymbolStore {
    static final int FORMAT_VERSION = 1;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TreeMap<String, StoredSymbol> symbols = new TreeMap<>();
    private int storedDimension;

    public record StoredSymbol(Symbol symbol, IndexEntry entry) {
    }

    public record Snapshot(int version, int dimension, List<StoredSymbol> symbols) {
    }

    public static SymbolStore load(Path path) throws IOException {
        SymbolStore store = new SymbolStore();
        if (!Files.exists(path)) {
            return store;
        }
        Snapshot snapshot;
        try {
            snapshot = store.mapper.readValue(path.toFile(), Snapshot.class);
        } catch (JsonProcessingException e) {
            throw new CorruptionException("Symbol store " + path + " is unreadable", e);
        }
        if (snapshot == null || snapshot.symbols() == null) {
            throw new CorruptionException("Symbol store " + path + " has no symbol list");
        }
        if (snapshot.version() != FORMAT_VERSION) {
            throw new CorruptionException("Symbol store " + path + " has unsupported version " + snapshot.version());
        }
        for (StoredSymbol stored : snapshot.symbols()) {
            if (stored == null || stored.symbol() == null || stored.entry() == null || stored.symbol().id() == null
                    || !stored.symbol().id().equals(stored.entry().symbolId())) {
                throw new CorruptionException("Symbol store " + path + " holds an inconsistent entry");
            }
            float[] embedding = stored.entry().embedding();
            if (embedding == null || embedding.length != snapshot.dimension()) {
                throw new CorruptionException("Symbol store " + path + " holds an embedding of the wrong size for "
                        + stored.symbol().id());
            }
            store.symbols.put(stored.symbol().id(), stored);
        }
        store.storedDimension = snapshot.dimension();
        return store;
    }

    public void save(Path path, int dimension) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        mapper.writeValue(temp.toFile(), new Snapshot(FORMAT_VERSION, dimension, new ArrayList<>(symbols.values())));
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    /**
     * Dimensionality recorded by the last load, or 0 for a fresh store.
     */
    public int storedDimension() {
        return storedDimension;
    }

    public Optional<StoredSymbol> get(String id) {
        return Optional.ofNullable(symbols.get(id));
    }

    /**
     * Returns the replaced value, if any.
     */
    StoredSymbol put(Symbol symbol, IndexEntry entry) {
        return symbols.put(symbol.id(), new StoredSymbol(symbol, entry));
    }

    StoredSymbol remove(String id) {
        return symbols.remove(id);
    }

    void restore(String id, StoredSymbol previous) {
        if (previous == null) {
            symbols.remove(id);
        } else {
            symbols.put(id, previous);
        }
    }

    public Collection<StoredSymbol> all() {
        return symbols.values();
    }

    public int size() {
        return symbols.size();
    }

    /**
     * Embedding per symbol id, as needed to rebuild the vector index.
     */
    public Map<String, float[]> embeddings() {
        Map<String, float[]> vectors = new TreeMap<>();
        symbols.forEach((id, stored) -> vectors.put(id, stored.entry().embedding()));
        return vectors;
    }

    void clear() {
        symbols.clear();
    }
}
