package com.codesniff.index;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.PriorityQueue;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.zip.CRC32;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codesniff.error.DimensionMismatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * In-memory vector index backed by one packed float array.
 *
 * <p>Small indexes are searched exactly. Once the index holds {@link Options#approximateMinSize()}
 * vectors and approximate search is enabled, candidates come from random-hyperplane signature
 * buckets visited in order of Hamming distance until at least
 * {@link Options#minCandidateFraction()} of the index has been scored, then re-ranked by exact
 * cosine similarity.
 *
 * <p>Deletes leave tombstoned slots behind; they are reclaimed by {@link #rebuild(Map)} or
 * automatically once tombstones outnumber live vectors.
 */
public class LocalVectorIndex implements VectorIndex {
    private static final Logger log = LoggerFactory.getLogger(LocalVectorIndex.class);
    static final String FORMAT = "codesniff-vectors";
    static final int FORMAT_VERSION = 1;
    private static final long HYPERPLANE_SEED = 0x5EED_C0DEL;
    private static final int INITIAL_CAPACITY = 16;

    private final int dimension;
    private final Options options;
    private final float[][] hyperplanes;
    private final ObjectMapper mapper = new ObjectMapper();

    private float[] data;
    private double[] norms;
    private int[] signatures;
    private String[] slotIds;
    private int slotCount;
    private final BitSet tombstones = new BitSet();
    private final Map<String, Integer> slots = new HashMap<>();
    private final Map<Integer, Set<Integer>> buckets = new HashMap<>();

    public record Options(
            boolean approximate,
            int approximateMinSize,
            double minCandidateFraction,
            int signatureBits,
            int persistBatchSize) {

        public Options {
            if (signatureBits < 1 || signatureBits > 30) {
                throw new IllegalArgumentException("signatureBits must be within 1..30");
            }
            if (minCandidateFraction <= 0d || minCandidateFraction > 1d) {
                throw new IllegalArgumentException("minCandidateFraction must be within (0, 1]");
            }
            if (persistBatchSize < 1) {
                throw new IllegalArgumentException("persistBatchSize must be positive");
            }
        }

        public static Options exact() {
            return new Options(false, Integer.MAX_VALUE, 1d, 12, 256);
        }
    }

    /**
     * Outcome of {@link #load}. {@code corrupted} is set when records had to be discarded because
     * they were not covered by a valid commit marker.
     */
    public record LoadResult(LocalVectorIndex index, int discardedRecords, boolean corrupted, String detail) {
    }

    public LocalVectorIndex(int dimension, Options options) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be positive");
        }
        this.dimension = dimension;
        this.options = options;
        this.hyperplanes = hyperplanes(dimension, options.signatureBits());
        this.data = new float[dimension * INITIAL_CAPACITY];
        this.norms = new double[INITIAL_CAPACITY];
        this.signatures = new int[INITIAL_CAPACITY];
        this.slotIds = new String[INITIAL_CAPACITY];
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public void insert(String id, float[] embedding) {
        if (embedding.length != dimension) {
            throw new DimensionMismatchException(dimension, embedding.length);
        }
        // replaced vectors get a fresh slot; indexed vectors are never mutated in place
        delete(id);
        ensureCapacity(slotCount + 1);
        int slot = slotCount++;
        System.arraycopy(embedding, 0, data, slot * dimension, dimension);
        norms[slot] = VectorMath.norm(data, slot * dimension, dimension);
        signatures[slot] = signature(embedding);
        slotIds[slot] = id;
        slots.put(id, slot);
        buckets.computeIfAbsent(signatures[slot], unused -> new HashSet<>()).add(slot);
    }

    @Override
    public List<VectorHit> search(float[] queryEmbedding, int k) {
        if (queryEmbedding.length != dimension) {
            throw new DimensionMismatchException(dimension, queryEmbedding.length);
        }
        if (k <= 0 || slots.isEmpty()) {
            return List.of();
        }
        int wanted = Math.min(k, slots.size());
        double queryNorm = VectorMath.norm(queryEmbedding, 0, dimension);
        Comparator<VectorHit> worstFirst = VectorHit.RANKING.reversed();
        PriorityQueue<VectorHit> top = new PriorityQueue<>(wanted + 1, worstFirst);
        for (int slot : candidateSlots(queryEmbedding, wanted)) {
            top.add(new VectorHit(slotIds[slot], similarity(slot, queryEmbedding, queryNorm)));
            if (top.size() > wanted) {
                top.poll();
            }
        }
        List<VectorHit> hits = new ArrayList<>(top);
        hits.sort(VectorHit.RANKING);
        return hits;
    }

    /**
     * Exact scan regardless of configuration; the reference ranking for recall checks.
     */
    public List<VectorHit> exactSearch(float[] queryEmbedding, int k) {
        if (queryEmbedding.length != dimension) {
            throw new DimensionMismatchException(dimension, queryEmbedding.length);
        }
        double queryNorm = VectorMath.norm(queryEmbedding, 0, dimension);
        List<VectorHit> hits = new ArrayList<>(slots.size());
        for (int slot : slots.values()) {
            hits.add(new VectorHit(slotIds[slot], similarity(slot, queryEmbedding, queryNorm)));
        }
        hits.sort(VectorHit.RANKING);
        return List.copyOf(hits.subList(0, Math.min(Math.max(k, 0), hits.size())));
    }

    @Override
    public void delete(String id) {
        Integer slot = slots.remove(id);
        if (slot == null) {
            return;
        }
        tombstones.set(slot);
        slotIds[slot] = null;
        Set<Integer> bucket = buckets.get(signatures[slot]);
        if (bucket != null) {
            bucket.remove(slot);
            if (bucket.isEmpty()) {
                buckets.remove(signatures[slot]);
            }
        }
        if (tombstones.cardinality() > Math.max(INITIAL_CAPACITY, slots.size())) {
            compact();
        }
    }

    @Override
    public boolean contains(String id) {
        return slots.containsKey(id);
    }

    @Override
    public OptionalDouble similarity(String id, float[] queryEmbedding) {
        Integer slot = slots.get(id);
        if (slot == null) {
            return OptionalDouble.empty();
        }
        if (queryEmbedding.length != dimension) {
            throw new DimensionMismatchException(dimension, queryEmbedding.length);
        }
        return OptionalDouble.of(similarity(slot, queryEmbedding, VectorMath.norm(queryEmbedding, 0, dimension)));
    }

    /**
     * Whether {@code id} is stored with exactly this vector.
     */
    public boolean holds(String id, float[] embedding) {
        Integer slot = slots.get(id);
        return slot != null && Arrays.equals(vector(slot), embedding);
    }

    @Override
    public int size() {
        return slots.size();
    }

    @Override
    public Set<String> ids() {
        return Set.copyOf(slots.keySet());
    }

    int allocatedSlots() {
        return slotCount;
    }

    @Override
    public void rebuild(Map<String, float[]> vectors) {
        clear();
        new TreeMap<>(vectors).forEach(this::insert);
        log.debug("Vector index rebuilt vectors={}", slots.size());
    }

    @Override
    public void clear() {
        slots.clear();
        buckets.clear();
        tombstones.clear();
        Arrays.fill(slotIds, 0, slotCount, null);
        slotCount = 0;
    }

    @Override
    public void persist(Path path) throws IOException {
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        Path temp = path.resolveSibling(path.getFileName() + ".tmp");
        List<String> ids = new ArrayList<>(slots.keySet());
        ids.sort(null);
        try (BufferedWriter writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
            writer.write(mapper.writeValueAsString(new Header(FORMAT, FORMAT_VERSION, dimension)));
            writer.newLine();
            int batch = 0;
            for (int start = 0; start < ids.size(); start += options.persistBatchSize()) {
                List<String> batchIds = ids.subList(start, Math.min(ids.size(), start + options.persistBatchSize()));
                CRC32 crc = new CRC32();
                for (String id : batchIds) {
                    String line = mapper.writeValueAsString(new VectorRecord(id, vector(slots.get(id))));
                    crc.update(line.getBytes(StandardCharsets.UTF_8));
                    writer.write(line);
                    writer.newLine();
                }
                writer.write(mapper.writeValueAsString(new CommitMarker(batch++, batchIds.size(), crc.getValue())));
                writer.newLine();
            }
        }
        try {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, path, StandardCopyOption.REPLACE_EXISTING);
        }
        log.debug("Vector index persisted path={} vectors={}", path, ids.size());
    }

    /**
     * Restores an index written by {@link #persist(Path)}. Only batches followed by a matching
     * commit marker are loaded; anything after the first missing or invalid marker is discarded.
     *
     * @throws DimensionMismatchException when the file was written for another dimensionality
     */
    public static LoadResult load(Path path, int dimension, Options options) throws IOException {
        LocalVectorIndex index = new LocalVectorIndex(dimension, options);
        if (!Files.exists(path)) {
            return new LoadResult(index, 0, false, "");
        }
        ObjectMapper mapper = index.mapper;
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String headerLine = reader.readLine();
            if (headerLine == null) {
                return new LoadResult(index, 0, true, "empty file");
            }
            Header header;
            try {
                header = mapper.readValue(headerLine, Header.class);
            } catch (JsonProcessingException e) {
                return new LoadResult(index, 0, true, "unreadable header");
            }
            if (!FORMAT.equals(header.format()) || header.version() != FORMAT_VERSION) {
                return new LoadResult(index, 0, true, "unknown format " + header.format() + " v" + header.version());
            }
            if (header.dimension() != dimension) {
                throw new DimensionMismatchException(dimension, header.dimension());
            }

            List<VectorRecord> pending = new ArrayList<>();
            CRC32 crc = new CRC32();
            String line;
            while ((line = reader.readLine()) != null) {
                JsonNode node;
                try {
                    node = mapper.readTree(line);
                } catch (JsonProcessingException e) {
                    return discard(index, pending.size() + 1, "garbled line after " + index.size() + " committed vectors");
                }
                if (node != null && node.has("commit")) {
                    CommitMarker marker = readOrNull(mapper, node, CommitMarker.class);
                    if (marker == null || marker.count() != pending.size() || marker.crc32() != crc.getValue()) {
                        return discard(index, pending.size(), "commit marker does not match its batch");
                    }
                    for (VectorRecord record : pending) {
                        index.insert(record.id(), record.vector());
                    }
                    pending.clear();
                    crc.reset();
                    continue;
                }
                VectorRecord record = node == null ? null : readOrNull(mapper, node, VectorRecord.class);
                if (record == null || record.id() == null || record.vector() == null || record.vector().length != dimension) {
                    return discard(index, pending.size() + 1, "malformed vector record");
                }
                crc.update(line.getBytes(StandardCharsets.UTF_8));
                pending.add(record);
            }
            if (!pending.isEmpty()) {
                return discard(index, pending.size(), "trailing batch without commit marker");
            }
        }
        return new LoadResult(index, 0, false, "");
    }

    private static <T> T readOrNull(ObjectMapper mapper, JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return null;
        }
    }

    private static LoadResult discard(LocalVectorIndex index, int discarded, String detail) {
        log.warn("Vector index snapshot is incomplete: {}; discarded={} kept={}", detail, discarded, index.size());
        return new LoadResult(index, discarded, true, detail);
    }

    private Iterable<Integer> candidateSlots(float[] queryEmbedding, int k) {
        int live = slots.size();
        if (!options.approximate() || live < options.approximateMinSize()) {
            return slots.values();
        }
        int target = (int) Math.max((long) k * 8, (long) Math.ceil(options.minCandidateFraction() * live));
        if (target >= live) {
            return slots.values();
        }
        int querySignature = signature(queryEmbedding);
        List<Integer> bucketOrder = new ArrayList<>(buckets.keySet());
        bucketOrder.sort(Comparator
                .comparingInt((Integer key) -> Integer.bitCount(key ^ querySignature))
                .thenComparing(Comparator.naturalOrder()));
        Set<Integer> candidates = new LinkedHashSet<>();
        for (Integer key : bucketOrder) {
            candidates.addAll(buckets.get(key));
            if (candidates.size() >= target) {
                break;
            }
        }
        return candidates;
    }

    private double similarity(int slot, float[] query, double queryNorm) {
        double slotNorm = norms[slot];
        if (slotNorm == 0d || queryNorm == 0d) {
            return 0d;
        }
        int offset = slot * dimension;
        double dot = 0d;
        for (int i = 0; i < dimension; i++) {
            dot += (double) data[offset + i] * query[i];
        }
        return VectorMath.clamp(dot / (slotNorm * queryNorm));
    }

    private float[] vector(int slot) {
        return Arrays.copyOfRange(data, slot * dimension, (slot + 1) * dimension);
    }

    private int signature(float[] embedding) {
        int signature = 0;
        for (int bit = 0; bit < hyperplanes.length; bit++) {
            float[] plane = hyperplanes[bit];
            double dot = 0d;
            for (int i = 0; i < dimension; i++) {
                dot += (double) plane[i] * embedding[i];
            }
            if (dot >= 0d) {
                signature |= (1 << bit);
            }
        }
        return signature;
    }

    private void compact() {
        Map<String, float[]> live = new HashMap<>();
        for (Map.Entry<String, Integer> entry : slots.entrySet()) {
            live.put(entry.getKey(), vector(entry.getValue()));
        }
        int before = slotCount;
        rebuild(live);
        log.debug("Vector index compacted slots={} -> {}", before, slotCount);
    }

    private void ensureCapacity(int required) {
        if (required <= slotIds.length) {
            return;
        }
        int capacity = Math.max(required, slotIds.length * 2);
        data = Arrays.copyOf(data, capacity * dimension);
        norms = Arrays.copyOf(norms, capacity);
        signatures = Arrays.copyOf(signatures, capacity);
        slotIds = Arrays.copyOf(slotIds, capacity);
    }

    private static float[][] hyperplanes(int dimension, int bits) {
        Random random = new Random(HYPERPLANE_SEED);
        float[][] planes = new float[bits][dimension];
        for (float[] plane : planes) {
            for (int i = 0; i < dimension; i++) {
                plane[i] = (float) random.nextGaussian();
            }
        }
        return planes;
    }

    record Header(String format, int version, int dimension) {
    }

    record VectorRecord(String id, float[] vector) {
    }

    record CommitMarker(long commit, int count, long crc32) {
    }
}
