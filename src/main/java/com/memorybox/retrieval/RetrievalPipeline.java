package com.memorybox.retrieval;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.IntStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.memorybox.embed.Embedder;
import com.memorybox.embed.Ranker;
import com.memorybox.error.ConsistencyException;
import com.memorybox.error.LibraryUsageException;
import com.memorybox.runtime.AppConfig;

/**
 * Retrieve-then-rerank over a message corpus: a wide nearest-neighbor pass on an IVF index,
 * followed by Ranker scoring of the surviving candidates.
 */
public class RetrievalPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RetrievalPipeline.class);

    private final Embedder<String> embedder;
    private final Ranker ranker;
    private final AppConfig.RetrievalConfig config;
    private final CorpusOpener corpusOpener;

    private volatile CorpusProvider corpus;
    private volatile IvfFlatIndex index;

    public RetrievalPipeline(Embedder<String> embedder, Ranker ranker, AppConfig.RetrievalConfig config,
            CorpusOpener corpusOpener) {
        this.embedder = embedder;
        this.ranker = ranker;
        this.config = config;
        this.corpusOpener = corpusOpener;
    }

    /**
     * Loads an existing index when one is present at {@code indexPath} and no raw source is given.
     * Otherwise opens the corpus (importing {@code rawSource} when supplied), embeds every record,
     * trains a fresh index and writes it to {@code indexPath}. A corpus opened earlier is closed
     * once its replacement is in place.
     */
    public synchronized void initialize(Path indexPath, String corpusId, Path rawSource) throws IOException {
        if (rawSource == null && Files.exists(indexPath)) {
            IndexSnapshot snapshot = IndexSnapshot.load(indexPath);
            if (corpusId != null && !corpusId.equals(snapshot.corpusId())) {
                throw new LibraryUsageException("Index " + indexPath + " was built for corpus "
                        + snapshot.corpusId() + ", not " + corpusId);
            }
            CorpusProvider reopened = corpusOpener.open(snapshot.corpusId(), null);
            IvfFlatIndex loaded;
            try {
                loaded = IvfFlatIndex.fromState(snapshot.trainedIndex());
            } catch (RuntimeException e) {
                reopened.close();
                throw e;
            }
            install(reopened, loaded);
            log.info("Loaded retrieval index {} ({} vectors) for corpus {}", indexPath, loaded.size(), snapshot.corpusId());
            return;
        }
        if (corpusId == null || corpusId.isBlank()) {
            throw new LibraryUsageException("A corpus id is required to build a retrieval index");
        }

        CorpusProvider opened = corpusOpener.open(corpusId, rawSource);
        IvfFlatIndex trained;
        try {
            trained = build(opened, indexPath);
        } catch (RuntimeException | IOException e) {
            opened.close();
            throw e;
        }
        install(opened, trained);
        log.info("Built retrieval index {} over {} records in {} clusters", indexPath, trained.size(), trained.clusterCount());
    }

    private IvfFlatIndex build(CorpusProvider opened, Path indexPath) throws IOException {
        List<CorpusRecord> records = opened.records();
        if (records.isEmpty()) {
            throw new LibraryUsageException("Corpus " + opened.corpusId() + " has no records to index");
        }
        long[] ids = new long[records.size()];
        float[][] matrix = new float[records.size()][];
        for (int i = 0; i < records.size(); i++) {
            CorpusRecord record = records.get(i);
            float[] vector = embedder.embed(record.content());
            if (vector == null || vector.length == 0) {
                throw new ConsistencyException("Embedder returned no vector for record " + record.id());
            }
            if (i > 0 && vector.length != matrix[0].length) {
                throw new ConsistencyException("Record " + record.id() + " embedded to dimension " + vector.length
                        + ", expected " + matrix[0].length);
            }
            ids[i] = record.id();
            matrix[i] = vector;
        }

        IvfFlatIndex trained = IvfFlatIndex.train(matrix, config.getClusters(), config.getKmeansIterations(),
                config.getSeed());
        for (int i = 0; i < ids.length; i++) {
            trained.add(ids[i], matrix[i]);
        }
        new IndexSnapshot(opened.corpusId(), ids, matrix, trained.toState()).save(indexPath);
        return trained;
    }

    private void install(CorpusProvider next, IvfFlatIndex nextIndex) {
        CorpusProvider previous = corpus;
        index = nextIndex;
        corpus = next;
        if (previous != null && previous != next) {
            previous.close();
        }
    }

    public boolean isInitialized() {
        return index != null && corpus != null;
    }

    /**
     * First pass: up to {@code limit} records nearest to {@code text}. Ids that no longer resolve
     * in the corpus are dropped.
     */
    public List<CorpusRecord> retrieve(String text, int limit) {
        requireInitialized();
        if (text == null || text.isBlank() || limit <= 0) {
            return List.of();
        }
        List<Neighbor> neighbors = index.search(embedder.embed(text), limit, config.getProbes());
        List<CorpusRecord> records = new ArrayList<>(neighbors.size());
        for (Neighbor neighbor : neighbors) {
            Optional<CorpusRecord> record = corpus.find(neighbor.id());
            if (record.isPresent()) {
                records.add(record.get());
            } else {
                log.debug("Dropping unresolved record id {}", neighbor.id());
            }
        }
        return records;
    }

    /** Candidates ordered by descending Ranker score; equal scores keep their input order. */
    public List<String> rerank(String text, List<String> candidates) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        List<Float> scores = ranker.scoreAll(text, candidates);
        return IntStream.range(0, candidates.size())
                .boxed()
                .sorted(Comparator.comparing((Integer i) -> scores.get(i)).reversed())
                .map(candidates::get)
                .toList();
    }

    public List<String> query(String text, int k) {
        requireInitialized();
        if (text == null || text.isBlank() || k <= 0) {
            return List.of();
        }
        List<String> candidates = retrieve(text, fetchSize(k)).stream()
                .map(CorpusRecord::content)
                .toList();
        List<String> ranked = rerank(text, candidates);
        return ranked.size() > k ? ranked.subList(0, k) : ranked;
    }

    /** {@code k * retrievalMultiplier}, computed without overflow and capped at the index size. */
    int fetchSize(int k) {
        long wanted = (long) k * Math.max(1, config.getRetrievalMultiplier());
        return (int) Math.min(wanted, Math.max(k, index.size()));
    }

    @Override
    public synchronized void close() {
        CorpusProvider current = corpus;
        corpus = null;
        index = null;
        if (current != null) {
            current.close();
        }
    }

    private void requireInitialized() {
        if (!isInitialized()) {
            throw new LibraryUsageException("Not initialized");
        }
    }
}
