package org.carball.lbs.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.config.CacheConfig;
import redis.clients.jedis.exceptions.JedisException;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Chooses the cache backend once, at startup. An unreachable Redis falls back to the
 * in-memory store.
 */
@Slf4j
public final class CacheStoreFactory {

    private CacheStoreFactory() {
    }

    public static CacheStore create(CacheConfig config, ObjectMapper mapper) {
        if (config.isRedis()) {
            try {
                RedisCacheStore redis = new RedisCacheStore(config.getRedisUrl(), mapper);
                if (redis.ping()) {
                    log.info("Using Redis cache at {}", config.getRedisUrl());
                    return redis;
                }
                redis.close();
                log.warn("Redis at {} is not reachable, falling back to in-memory cache", config.getRedisUrl());
            } catch (JedisException | IllegalArgumentException e) {
                log.warn("Redis cache unavailable ({}), falling back to in-memory cache", e.getMessage());
            }
        }
        return memory(config, mapper);
    }

    static CacheStore memory(CacheConfig config, ObjectMapper mapper) {
        Path snapshot = config.getPersistPath() == null || config.getPersistPath().isBlank()
                ? null : Path.of(config.getPersistPath());
        log.info("Using in-memory cache (max {} entries{})", config.getMaxEntries(),
                snapshot == null ? "" : ", snapshot " + snapshot);
        return new InMemoryCacheStore(config.getMaxEntries(), Clock.systemUTC(), snapshot,
                config.getPersistEvery(), mapper);
    }
}
