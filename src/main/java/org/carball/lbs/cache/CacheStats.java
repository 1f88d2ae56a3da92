package org.carball.lbs.cache;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Counters of a cache backend since it was opened.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CacheStats(String backend, long hits, long misses, long sets, double hitRatePct, Long keys) {

    public static CacheStats of(String backend, long hits, long misses, long sets, Long keys) {
        long lookups = hits + misses;
        double hitRate = lookups == 0 ? 0.0 : Math.round(10000.0 * hits / lookups) / 100.0;
        return new CacheStats(backend, hits, misses, sets, hitRate, keys);
    }
}
