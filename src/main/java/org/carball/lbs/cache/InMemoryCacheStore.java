package org.carball.lbs.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Process-local cache. Expired entries are evicted when read and during the cleanup that runs
 * once the store grows past its cap; the oldest entries go next if still over the cap. An
 * optional snapshot file is rewritten every {@code persistEvery} writes and on close.
 */
@Slf4j
public class InMemoryCacheStore implements CacheStore {

    public static final String BACKEND = "memory";

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Object snapshotMonitor = new Object();
    private final int maxEntries;
    private final Clock clock;
    private final Path snapshotPath;
    private final int persistEvery;
    private final ObjectMapper mapper;

    private long hits;
    private long misses;
    private long sets;
    private int writesSinceSnapshot;

    public InMemoryCacheStore(int maxEntries) {
        this(maxEntries, Clock.systemUTC(), null, 0, new ObjectMapper());
    }

    public InMemoryCacheStore(int maxEntries, Clock clock, Path snapshotPath, int persistEvery, ObjectMapper mapper) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("Cache size must be positive: " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.clock = clock;
        this.snapshotPath = snapshotPath;
        this.persistEvery = Math.max(1, persistEvery);
        this.mapper = mapper;
        if (snapshotPath != null) {
            loadSnapshot();
        }
    }

    @Override
    public Optional<JsonNode> get(String key) {
        lock.lock();
        try {
            Entry entry = entries.get(key);
            if (entry == null) {
                misses++;
                return Optional.empty();
            }
            if (entry.isExpired(clock.instant())) {
                entries.remove(key);
                misses++;
                return Optional.empty();
            }
            hits++;
            return Optional.of(entry.value());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        boolean snapshotDue;
        lock.lock();
        try {
            Instant expiresAt = ttl == null || ttl.isZero() || ttl.isNegative() ? null : clock.instant().plus(ttl);
            entries.remove(key);
            entries.put(key, new Entry(value, expiresAt));
            sets++;
            if (entries.size() > maxEntries) {
                cleanup();
            }
            writesSinceSnapshot++;
            snapshotDue = snapshotPath != null && writesSinceSnapshot >= persistEvery;
        } finally {
            lock.unlock();
        }
        if (snapshotDue) {
            snapshot();
        }
    }

    @Override
    public boolean delete(String key) {
        lock.lock();
        try {
            return entries.remove(key) != null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public long clear(String pattern) {
        lock.lock();
        try {
            if (pattern == null || pattern.equals("*")) {
                long count = entries.size();
                entries.clear();
                return count;
            }
            Predicate<String> matches = CacheKeys.globMatcher(pattern);
            long removed = 0;
            Iterator<String> keys = entries.keySet().iterator();
            while (keys.hasNext()) {
                if (matches.test(keys.next())) {
                    keys.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CacheStats stats() {
        lock.lock();
        try {
            return CacheStats.of(BACKEND, hits, misses, sets, (long) entries.size());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String backend() {
        return BACKEND;
    }

    @Override
    public void close() {
        if (snapshotPath != null) {
            snapshot();
        }
    }

    int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    // caller holds the lock
    private void cleanup() {
        Instant now = clock.instant();
        entries.values().removeIf(entry -> entry.isExpired(now));
        Iterator<String> oldest = entries.keySet().iterator();
        while (entries.size() > maxEntries && oldest.hasNext()) {
            oldest.next();
            oldest.remove();
        }
        log.debug("Cache cleanup left {} entries", entries.size());
    }

    /**
     * Writes the live entries to the snapshot file through a temporary file and an atomic move.
     * Snapshots run one at a time so an older state never replaces a newer one.
     */
    void snapshot() {
        synchronized (snapshotMonitor) {
            ObjectNode root = mapper.createObjectNode();
            lock.lock();
            try {
                Instant now = clock.instant();
                entries.forEach((key, entry) -> {
                    if (!entry.isExpired(now)) {
                        ObjectNode node = root.putObject(key);
                        node.set("value", entry.value());
                        if (entry.expiresAt() != null) {
                            node.put("expires_at", entry.expiresAt().toEpochMilli());
                        }
                    }
                });
                writesSinceSnapshot = 0;
            } finally {
                lock.unlock();
            }
            writeSnapshot(root);
        }
    }

    private void writeSnapshot(ObjectNode root) {
        Path temp = null;
        try {
            Path parent = snapshotPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, "cache", ".tmp");
            mapper.writeValue(temp.toFile(), root);
            Files.move(temp, snapshotPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Cache snapshot written with {} entries to {}", root.size(), snapshotPath);
        } catch (IOException e) {
            log.warn("Could not write cache snapshot {}: {}", snapshotPath, e.getMessage());
        } finally {
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException e) {
                    log.warn("Could not remove temporary snapshot {}: {}", temp, e.getMessage());
                }
            }
        }
    }

    private void loadSnapshot() {
        if (!Files.exists(snapshotPath)) {
            return;
        }
        try {
            JsonNode root = mapper.readTree(snapshotPath.toFile());
            Instant now = clock.instant();
            int loaded = 0;
            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                JsonNode expires = field.getValue().get("expires_at");
                Instant expiresAt = expires == null || expires.isNull() ? null : Instant.ofEpochMilli(expires.asLong());
                Entry entry = new Entry(field.getValue().get("value"), expiresAt);
                if (entry.value() != null && !entry.isExpired(now)) {
                    entries.put(field.getKey(), entry);
                    loaded++;
                }
            }
            log.info("Loaded {} cache entries from {}", loaded, snapshotPath);
        } catch (IOException e) {
            log.warn("Ignoring unreadable cache snapshot {}: {}", snapshotPath, e.getMessage());
        }
    }

    private record Entry(JsonNode value, Instant expiresAt) {

        boolean isExpired(Instant now) {
            return expiresAt != null && !now.isBefore(expiresAt);
        }
    }
}
