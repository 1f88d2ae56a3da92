package org.carball.lbs.embedding;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.exception.EmbeddingException;
import org.carball.lbs.model.example.ExampleDraft;
import org.carball.lbs.model.example.ExampleMatch;
import org.carball.lbs.model.example.IndexStats;
import org.carball.lbs.model.example.QueryExample;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Nearest-neighbour index of question/SQL examples. Searches share a read lock, mutations take
 * the write lock; embeddings are computed before any lock is taken. The repository is written
 * every {@code flushEvery} mutations and on close.
 */
@Slf4j
public class QueryExampleIndex implements AutoCloseable {

    public static final String DEFAULT_INTENT = "general_query";

    private final EmbeddingProvider embeddings;
    private final ExampleRepository repository;
    private final int flushEvery;
    private final Clock clock;

    private final Map<String, QueryExample> examples = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Object flushMonitor = new Object();
    private int pendingMutations;

    public QueryExampleIndex(EmbeddingProvider embeddings, ExampleRepository repository, int flushEvery) {
        this(embeddings, repository, flushEvery, Clock.systemUTC());
    }

    public QueryExampleIndex(EmbeddingProvider embeddings, ExampleRepository repository, int flushEvery, Clock clock) {
        this.embeddings = embeddings;
        this.repository = repository;
        this.flushEvery = Math.max(1, flushEvery);
        this.clock = clock;
        load();
    }

    /**
     * Embeds and stores an example.
     *
     * @return the new example id
     * @throws IllegalArgumentException for a blank question or SQL
     * @throws EmbeddingException       when the question cannot be embedded
     */
    public String add(String question, String sql, String intent, Map<String, Object> metadata) {
        ExampleDraft draft = new ExampleDraft(question, sql, intent, metadata == null ? Map.of() : metadata);
        if (!draft.isValid()) {
            throw new IllegalArgumentException("Example needs a question and SQL");
        }
        QueryExample example = toExample(draft, embeddings.embed(question));
        lock.writeLock().lock();
        try {
            examples.put(example.getId(), example);
            pendingMutations++;
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Added example {} ({})", example.getId(), example.getIntent());
        flushIfDue();
        return example.getId();
    }

    /**
     * Adds every valid draft, skipping malformed ones.
     *
     * @return number of examples added
     */
    public int bulkAdd(List<ExampleDraft> drafts) {
        List<ExampleDraft> valid = drafts.stream().filter(d -> d != null && d.isValid()).toList();
        if (valid.size() < drafts.size()) {
            log.warn("Skipping {} malformed examples", drafts.size() - valid.size());
        }
        if (valid.isEmpty()) {
            return 0;
        }

        List<float[]> vectors;
        try {
            vectors = embeddings.embedAll(valid.stream().map(ExampleDraft::question).toList());
        } catch (EmbeddingException e) {
            log.warn("Batch embedding failed, embedding examples one by one: {}", e.getMessage());
            vectors = null;
        }

        List<QueryExample> added = new ArrayList<>();
        for (int i = 0; i < valid.size(); i++) {
            ExampleDraft draft = valid.get(i);
            try {
                float[] vector = vectors != null ? vectors.get(i) : embeddings.embed(draft.question());
                added.add(toExample(draft, vector));
            } catch (EmbeddingException e) {
                log.warn("Skipping example '{}': {}", draft.question(), e.getMessage());
            }
        }

        lock.writeLock().lock();
        try {
            added.forEach(example -> examples.put(example.getId(), example));
            pendingMutations += added.size();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Bulk added {} of {} examples", added.size(), drafts.size());
        flushIfDue();
        return added.size();
    }

    /**
     * Returns up to {@code k} examples closest to the question, nearest first. Ties keep
     * insertion order.
     *
     * @param intentFilter only consider examples with this intent; null for all
     */
    public List<ExampleMatch> search(String question, int k, String intentFilter) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be at least 1: " + k);
        }
        if (size() == 0) {
            return List.of();
        }
        float[] query = embeddings.embed(question);

        lock.readLock().lock();
        try {
            List<ExampleMatch> matches = new ArrayList<>();
            for (QueryExample example : examples.values()) {
                if (intentFilter != null && !intentFilter.equals(example.getIntent())) {
                    continue;
                }
                matches.add(new ExampleMatch(example, 1.0 - cosine(query, example.getEmbedding())));
            }
            matches.sort(Comparator.comparingDouble(ExampleMatch::distance));
            return matches.size() > k ? List.copyOf(matches.subList(0, k)) : List.copyOf(matches);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<QueryExample> list() {
        lock.readLock().lock();
        try {
            return List.copyOf(examples.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<QueryExample> get(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(examples.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean delete(String id) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = examples.remove(id) != null;
            if (removed) {
                pendingMutations++;
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed) {
            log.debug("Deleted example {}", id);
            flushIfDue();
        }
        return removed;
    }

    /**
     * Removes every example and persists the empty index.
     */
    public boolean clear() {
        lock.writeLock().lock();
        try {
            examples.clear();
            pendingMutations++;
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Cleared example index");
        return flush();
    }

    public int size() {
        lock.readLock().lock();
        try {
            return examples.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public IndexStats stats() {
        List<QueryExample> snapshot = list();
        Map<String, Long> intents = snapshot.stream()
                .collect(Collectors.groupingBy(QueryExample::getIntent, TreeMap::new, Collectors.counting()));
        Map<String, Long> sources = snapshot.stream()
                .collect(Collectors.groupingBy(QueryExample::getSource, TreeMap::new, Collectors.counting()));
        return new IndexStats(snapshot.size(), intents, sources, embeddings.modelName(), embeddings.dimension(),
                repository.description());
    }

    /**
     * Writes the current examples to the repository.
     *
     * @return false when the write failed; the index keeps working in memory
     */
    public boolean flush() {
        synchronized (flushMonitor) {
            List<QueryExample> snapshot;
            int flushed;
            lock.readLock().lock();
            try {
                snapshot = List.copyOf(examples.values());
                flushed = pendingMutations;
            } finally {
                lock.readLock().unlock();
            }
            try {
                repository.save(snapshot);
                lock.writeLock().lock();
                try {
                    // mutations made while saving stay pending
                    pendingMutations -= flushed;
                } finally {
                    lock.writeLock().unlock();
                }
                return true;
            } catch (IOException e) {
                log.warn("Could not persist example index to {}: {}", repository.description(), e.getMessage());
                return false;
            }
        }
    }

    @Override
    public void close() {
        boolean dirty;
        lock.readLock().lock();
        try {
            dirty = pendingMutations > 0;
        } finally {
            lock.readLock().unlock();
        }
        if (dirty) {
            flush();
        }
    }

    static double cosine(float[] a, float[] b) {
        if (a == null || b == null || a.length != b.length) {
            return 0.0;
        }
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += a[i] * b[i];
            normA += a[i] * a[i];
            normB += b[i] * b[i];
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }

    private void flushIfDue() {
        boolean due;
        lock.readLock().lock();
        try {
            due = pendingMutations >= flushEvery;
        } finally {
            lock.readLock().unlock();
        }
        if (due) {
            flush();
        }
    }

    private QueryExample toExample(ExampleDraft draft, float[] vector) {
        if (vector.length != embeddings.dimension()) {
            throw new EmbeddingException(String.format("Embedding has %d dimensions, index expects %d",
                    vector.length, embeddings.dimension()), null);
        }
        return QueryExample.builder()
                .id("query_" + UUID.randomUUID())
                .question(draft.question().trim())
                .sql(draft.sql().trim())
                .intent(draft.intent() == null || draft.intent().isBlank() ? DEFAULT_INTENT : draft.intent())
                .metadata(draft.metadata() == null ? Map.of() : Map.copyOf(draft.metadata()))
                .addedAt(clock.instant())
                .embedding(vector)
                .build();
    }

    private static QueryExample withDefaults(QueryExample example) {
        if (example.getIntent() == null || example.getIntent().isBlank()) {
            return example.toBuilder().intent(DEFAULT_INTENT).build();
        }
        return example;
    }

    private void load() {
        try {
            List<QueryExample> stored = repository.load();
            Map<String, QueryExample> usable = stored.stream()
                    .filter(example -> example.getEmbedding() != null && example.getEmbedding().length == embeddings.dimension())
                    .map(QueryExampleIndex::withDefaults)
                    .collect(Collectors.toMap(QueryExample::getId, Function.identity(), (a, b) -> b, LinkedHashMap::new));
            if (usable.size() < stored.size()) {
                log.warn("Ignoring {} stored examples whose embeddings do not match dimension {}",
                        stored.size() - usable.size(), embeddings.dimension());
            }
            examples.putAll(usable);
        } catch (IOException e) {
            log.warn("Could not load example index from {}, starting empty: {}", repository.description(), e.getMessage());
        }
    }
}
