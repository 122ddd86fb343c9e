package com.memorybox.store;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.embed.Vectors;
import com.memorybox.error.ConsistencyException;

import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.Pipeline;
import redis.clients.jedis.exceptions.JedisDataException;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.search.Document;
import redis.clients.jedis.search.FTCreateParams;
import redis.clients.jedis.search.IndexDataType;
import redis.clients.jedis.search.Query;
import redis.clients.jedis.search.schemafields.SchemaField;
import redis.clients.jedis.search.schemafields.VectorField;

/**
 * Networked index on Redis with the search module. Each vector is a hash at
 * {@code <prefix>:<libraryUuid>:<itemUuid>}; the FLAT vector index over that key prefix is
 * built once the dimension is known, after a scan has staged its vectors. The dimension is
 * recorded in a metadata hash as soon as the first vector is written.
 */
public class RedisVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(RedisVectorStore.class);

    static final String VECTOR_FIELD = "embedding";
    static final String DISTANCE_FIELD = "distance";
    static final String DIMENSION_FIELD = "dimension";
    static final int SCAN_PAGE_SIZE = 500;

    private static final Comparator<VectorMatch> NEAREST_FIRST = Comparator
            .comparing(VectorMatch::distance)
            .thenComparing(VectorMatch::key);

    private final JedisPooled jedis;
    private final String itemPrefix;
    private final String indexName;
    private final String metaKey;

    public RedisVectorStore(JedisPooled jedis, String keyPrefix, String libraryUuid) {
        this.jedis = jedis;
        this.itemPrefix = keyPrefix + ":" + libraryUuid + ":";
        this.indexName = keyPrefix + "-idx:" + libraryUuid;
        this.metaKey = keyPrefix + "-meta:" + libraryUuid;
    }

    @Override
    public IndexBootstrap bootstrap() {
        return IndexBootstrap.AFTER_ALL_WRITES;
    }

    @Override
    public boolean isIndexInitialized() {
        try {
            jedis.ftInfo(indexName);
            return true;
        } catch (JedisDataException e) {
            log.trace("Index {} not found: {}", indexName, e.getMessage());
            return false;
        }
    }

    @Override
    public int dimension() {
        String stored = jedis.hget(metaKey, DIMENSION_FIELD);
        return stored == null ? -1 : Integer.parseInt(stored);
    }

    @Override
    public void initializeIndex(int dimension) {
        if (dimension <= 0) {
            throw new ConsistencyException("Index dimension must be positive, got " + dimension);
        }
        int known = dimension();
        if (known > 0 && known != dimension) {
            throw new ConsistencyException("Index holds vectors of dimension " + known
                    + ", cannot build it with dimension " + dimension);
        }
        if (known < 0) {
            jedis.hset(metaKey, DIMENSION_FIELD, Integer.toString(dimension));
        }
        if (isIndexInitialized()) {
            return;
        }
        List<SchemaField> schema = List.of(new VectorField(VECTOR_FIELD, VectorField.VectorAlgorithm.FLAT, Map.of(
                "TYPE", "FLOAT32",
                "DIM", dimension,
                "DISTANCE_METRIC", "L2")));
        jedis.ftCreate(indexName, FTCreateParams.createParams().on(IndexDataType.HASH).prefix(itemPrefix), schema);
        log.info("Redis index {} created with dimension {}", indexName, dimension);
    }

    @Override
    public void add(String key, float[] vector) {
        checkDimension(key, vector);
        jedis.hset(itemKey(key).getBytes(StandardCharsets.UTF_8), VECTOR_FIELD.getBytes(StandardCharsets.UTF_8), toBytes(vector));
    }

    @Override
    public boolean remove(String key) {
        return jedis.del(itemKey(key)) > 0;
    }

    @Override
    public List<VectorMatch> query(float[] vector, int topK) {
        if (topK <= 0 || !isIndexInitialized()) {
            return List.of();
        }
        Query query = new Query("*=>[KNN " + topK + " @" + VECTOR_FIELD + " $vec AS " + DISTANCE_FIELD + "]")
                .addParam("vec", toBytes(vector))
                .setSortBy(DISTANCE_FIELD, true)
                .returnFields(DISTANCE_FIELD)
                .limit(0, topK)
                .dialect(2);
        List<VectorMatch> matches = new ArrayList<>();
        for (Document document : jedis.ftSearch(indexName, query).getDocuments()) {
            String id = document.getId();
            if (!id.startsWith(itemPrefix)) {
                continue;
            }
            matches.add(new VectorMatch(id.substring(itemPrefix.length()),
                    Float.parseFloat(document.getString(DISTANCE_FIELD))));
        }
        matches.sort(NEAREST_FIRST);
        return matches;
    }

    @Override
    public void persist() {
        // Redis owns durability
    }

    @Override
    public void cleanAllData() {
        if (isIndexInitialized()) {
            jedis.ftDropIndexDD(indexName);
        }
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            ScanResult<String> page = jedis.scan(cursor, itemScan());
            if (!page.getResult().isEmpty()) {
                jedis.del(page.getResult().toArray(String[]::new));
            }
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
        jedis.del(metaKey);
        log.info("Redis index {} purged", indexName);
    }

    @Override
    public void deleteStore() {
        cleanAllData();
    }

    @Override
    public boolean dbIsEmpty() {
        return itemKeys(1).isEmpty();
    }

    @Override
    public int size() {
        return itemKeys(Integer.MAX_VALUE).size();
    }

    @Override
    public Optional<VectorBatch> batchWriter(int batchSize) {
        return Optional.of(new PipelineBatch(batchSize));
    }

    String itemKey(String key) {
        return itemPrefix + key;
    }

    String indexName() {
        return indexName;
    }

    /** Item keys found by cursor, stopping once {@code limit} distinct keys are seen. */
    private Set<String> itemKeys(int limit) {
        Set<String> keys = new LinkedHashSet<>();
        String cursor = ScanParams.SCAN_POINTER_START;
        do {
            ScanResult<String> page = jedis.scan(cursor, itemScan());
            keys.addAll(page.getResult());
            cursor = page.getCursor();
        } while (!ScanParams.SCAN_POINTER_START.equals(cursor) && keys.size() < limit);
        return keys;
    }

    private ScanParams itemScan() {
        return new ScanParams().match(itemPrefix + "*").count(SCAN_PAGE_SIZE);
    }

    /** Records the dimension on the first write and returns the dimension in force. */
    private int checkDimension(String key, float[] vector) {
        if (Vectors.isEmpty(vector)) {
            throw new ConsistencyException("Empty vector for " + key);
        }
        int known = dimension();
        if (known < 0) {
            jedis.hset(metaKey, DIMENSION_FIELD, Integer.toString(vector.length));
            return vector.length;
        }
        requireDimension(key, vector, known);
        return known;
    }

    private static void requireDimension(String key, float[] vector, int dimension) {
        if (Vectors.isEmpty(vector) || vector.length != dimension) {
            throw new ConsistencyException("Vector for " + key + " has dimension "
                    + (vector == null ? 0 : vector.length) + ", index dimension is " + dimension);
        }
    }

    static byte[] toBytes(float[] vector) {
        ByteBuffer buffer = ByteBuffer.allocate(vector.length * Float.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        for (float value : vector) {
            buffer.putFloat(value);
        }
        return buffer.array();
    }

    private final class PipelineBatch implements VectorBatch {
        private final int batchSize;
        private final Pipeline pipeline;
        private final List<String> pending = new ArrayList<>();
        private int dimension = -1;

        private PipelineBatch(int batchSize) {
            this.batchSize = Math.max(1, batchSize);
            this.pipeline = jedis.pipelined();
        }

        @Override
        public void add(String key, float[] vector) {
            if (dimension < 0) {
                dimension = checkDimension(key, vector);
            } else {
                requireDimension(key, vector, dimension);
            }
            pipeline.hset(itemKey(key).getBytes(StandardCharsets.UTF_8),
                    VECTOR_FIELD.getBytes(StandardCharsets.UTF_8),
                    toBytes(vector));
            pending.add(key);
            if (pending.size() >= batchSize) {
                flush();
            }
        }

        @Override
        public void flush() {
            if (pending.isEmpty()) {
                return;
            }
            pipeline.sync();
            log.debug("Flushed {} vectors to {}", pending.size(), indexName);
            pending.clear();
        }

        @Override
        public void discard() {
            if (pending.isEmpty()) {
                return;
            }
            // a pipeline may already have pushed part of its buffer, so drain it and delete
            pipeline.sync();
            jedis.del(pending.stream().map(RedisVectorStore.this::itemKey).toArray(String[]::new));
            log.debug("Discarded {} staged vectors from {}", pending.size(), indexName);
            pending.clear();
        }

        @Override
        public int pendingCount() {
            return pending.size();
        }

        @Override
        public void close() {
            flush();
            pipeline.close();
        }
    }
}
