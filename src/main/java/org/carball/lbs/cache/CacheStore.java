package org.carball.lbs.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Optional;

/**
 * Key/value store for JSON values with optional expiry.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * Returns the value stored under {@code key}, or empty when absent or expired.
     */
    Optional<JsonNode> get(String key);

    /**
     * Stores a value. A null, zero or negative {@code ttl} means the entry never expires.
     */
    void set(String key, JsonNode value, Duration ttl);

    boolean delete(String key);

    /**
     * Removes every key matching a Redis-style glob such as {@code query:*}, or every key of this
     * store when {@code pattern} is null. A pattern without wildcards only matches that exact key.
     *
     * @return number of removed keys
     */
    long clear(String pattern);

    CacheStats stats();

    String backend();

    @Override
    void close();
}
