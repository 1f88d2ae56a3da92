package org.carball.lbs.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.config.CacheConfig;
import org.carball.lbs.model.anomaly.DetectionResult;
import org.carball.lbs.model.query.QueryResult;
import org.carball.lbs.model.query.TabularResult;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the cache for the three families of cached values: detection results,
 * answered questions and executed SQL.
 */
@Slf4j
public class ResultCache implements AutoCloseable {

    public static final String ANOMALY_PREFIX = "anomaly";
    public static final String QUERY_PREFIX = "query";
    public static final String SQL_PREFIX = "sql";

    private final CacheStore store;
    private final CacheConfig config;
    private final ObjectMapper mapper;

    public ResultCache(CacheStore store, CacheConfig config, ObjectMapper mapper) {
        this.store = store;
        this.config = config;
        this.mapper = mapper;
    }

    public Optional<DetectionResult> getDetection(Map<String, Object> parameters) {
        return read(detectionKey(parameters), DetectionResult.class)
                .map(result -> result.toBuilder().cached(true).build());
    }

    public void putDetection(DetectionResult result) {
        write(detectionKey(result.getParameters()), result, Duration.ofSeconds(config.getAnomalyTtlSeconds()));
    }

    public Optional<QueryResult> getQuery(String question, boolean execute) {
        return read(queryKey(question, execute), QueryResult.class)
                .map(result -> result.toBuilder().cached(true).build());
    }

    public void putQuery(QueryResult result, boolean execute) {
        long ttl = execute ? config.getQueryTtlSeconds() : config.getUnexecutedQueryTtlSeconds();
        write(queryKey(result.getQuestion(), execute), result, Duration.ofSeconds(ttl));
    }

    public Optional<TabularResult> getSqlResult(String sql) {
        return read(CacheKeys.key(SQL_PREFIX, Map.of("sql", sql)), TabularResult.class);
    }

    public void putSqlResult(String sql, TabularResult result) {
        write(CacheKeys.key(SQL_PREFIX, Map.of("sql", sql)), result, Duration.ofSeconds(config.getSqlTtlSeconds()));
    }

    public long clearQueries() {
        long removed = store.clear(QUERY_PREFIX + ":*") + store.clear(SQL_PREFIX + ":*");
        log.info("Cleared {} cached queries", removed);
        return removed;
    }

    public long clearAnomalies() {
        long removed = store.clear(ANOMALY_PREFIX + ":*");
        log.info("Cleared {} cached detection results", removed);
        return removed;
    }

    public long clearAll() {
        long removed = 0;
        for (String prefix : List.of(ANOMALY_PREFIX, QUERY_PREFIX, SQL_PREFIX)) {
            removed += store.clear(prefix + ":*");
        }
        log.info("Cleared {} cache entries", removed);
        return removed;
    }

    public CacheStats stats() {
        return store.stats();
    }

    public CacheStore getStore() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }

    static String detectionKey(Map<String, Object> parameters) {
        Object method = parameters.getOrDefault("method", "unknown");
        return CacheKeys.key(ANOMALY_PREFIX + ":" + method, parameters);
    }

    static String queryKey(String question, boolean execute) {
        return CacheKeys.key(QUERY_PREFIX, Map.of("q", question.trim(), "exec", execute));
    }

    private <T> Optional<T> read(String key, Class<T> type) {
        Optional<JsonNode> node = store.get(key);
        if (node.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.treeToValue(node.get(), type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Dropping unreadable cache entry {}: {}", key, e.getMessage());
            store.delete(key);
            return Optional.empty();
        }
    }

    private void write(String key, Object value, Duration ttl) {
        store.set(key, mapper.valueToTree(value), ttl);
    }
}
