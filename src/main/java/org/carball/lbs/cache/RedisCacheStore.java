package org.carball.lbs.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import redis.clients.jedis.Jedis;
import redis.clients.jedis.JedisPool;
import redis.clients.jedis.params.ScanParams;
import redis.clients.jedis.resps.ScanResult;
import redis.clients.jedis.exceptions.JedisException;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cache backed by Redis through a Jedis connection pool. Redis errors are logged and treated
 * as misses so a flaky server never fails the caller.
 */
@Slf4j
public class RedisCacheStore implements CacheStore {

    public static final String BACKEND = "redis";

    private final JedisPool pool;
    private final ObjectMapper mapper;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();
    private final AtomicLong sets = new AtomicLong();

    public RedisCacheStore(String redisUrl, ObjectMapper mapper) {
        this(new JedisPool(URI.create(redisUrl)), mapper);
    }

    RedisCacheStore(JedisPool pool, ObjectMapper mapper) {
        this.pool = pool;
        this.mapper = mapper;
    }

    /**
     * @return true when the server answers PING
     */
    public boolean ping() {
        try (Jedis jedis = pool.getResource()) {
            return "PONG".equalsIgnoreCase(jedis.ping());
        } catch (JedisException e) {
            log.debug("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Optional<JsonNode> get(String key) {
        try (Jedis jedis = pool.getResource()) {
            String json = jedis.get(key);
            if (json == null) {
                misses.incrementAndGet();
                return Optional.empty();
            }
            hits.incrementAndGet();
            return Optional.of(mapper.readTree(json));
        } catch (JedisException | JsonProcessingException e) {
            log.warn("Redis get failed for {}: {}", key, e.getMessage());
            misses.incrementAndGet();
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, JsonNode value, Duration ttl) {
        try (Jedis jedis = pool.getResource()) {
            String json = mapper.writeValueAsString(value);
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                jedis.set(key, json);
            } else {
                jedis.setex(key, Math.max(1, ttl.toSeconds()), json);
            }
            sets.incrementAndGet();
        } catch (JedisException | JsonProcessingException e) {
            log.warn("Redis set failed for {}: {}", key, e.getMessage());
        }
    }

    @Override
    public boolean delete(String key) {
        try (Jedis jedis = pool.getResource()) {
            return jedis.del(key) > 0;
        } catch (JedisException e) {
            log.warn("Redis delete failed for {}: {}", key, e.getMessage());
            return false;
        }
    }

    @Override
    public long clear(String pattern) {
        try (Jedis jedis = pool.getResource()) {
            ScanParams params = new ScanParams().match(pattern == null ? "*" : pattern).count(500);
            String cursor = ScanParams.SCAN_POINTER_START;
            long removed = 0;
            do {
                ScanResult<String> page = jedis.scan(cursor, params);
                List<String> keys = page.getResult();
                if (!keys.isEmpty()) {
                    removed += jedis.del(keys.toArray(new String[0]));
                }
                cursor = page.getCursor();
            } while (!ScanParams.SCAN_POINTER_START.equals(cursor));
            return removed;
        } catch (JedisException e) {
            log.warn("Redis clear failed for {}: {}", pattern, e.getMessage());
            return 0;
        }
    }

    @Override
    public CacheStats stats() {
        Long keys = null;
        try (Jedis jedis = pool.getResource()) {
            keys = jedis.dbSize();
        } catch (JedisException e) {
            log.warn("Redis stats failed: {}", e.getMessage());
        }
        return CacheStats.of(BACKEND, hits.get(), misses.get(), sets.get(), keys);
    }

    @Override
    public String backend() {
        return BACKEND;
    }

    @Override
    public void close() {
        pool.close();
    }
}
