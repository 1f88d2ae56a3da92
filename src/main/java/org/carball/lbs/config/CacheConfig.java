package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class CacheConfig {

    /** {@code memory} or {@code redis}. */
    @JsonProperty("backend")
    private String backend = "memory";

    @JsonProperty("redis_url")
    private String redisUrl = "redis://localhost:6379/0";

    @JsonProperty("max_entries")
    private int maxEntries = 1000;

    /** Snapshot file for the in-memory backend; no persistence when unset. */
    @JsonProperty("persist_path")
    private String persistPath;

    @JsonProperty("persist_every")
    private int persistEvery = 50;

    @JsonProperty("anomaly_ttl_seconds")
    private long anomalyTtlSeconds = 3600;

    @JsonProperty("query_ttl_seconds")
    private long queryTtlSeconds = 3600;

    @JsonProperty("unexecuted_query_ttl_seconds")
    private long unexecutedQueryTtlSeconds = 7200;

    @JsonProperty("sql_ttl_seconds")
    private long sqlTtlSeconds = 3600;

    public boolean isRedis() {
        return "redis".equalsIgnoreCase(backend);
    }
}
