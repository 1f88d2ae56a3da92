package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Root of the YAML configuration file. Every section falls back to its built-in defaults.
 */
@Data
public class EngineConfig {

    @JsonProperty("detection")
    private DetectionConfig detection = DetectionConfig.defaults();

    @JsonProperty("cache")
    private CacheConfig cache = new CacheConfig();

    @JsonProperty("index")
    private IndexConfig index = new IndexConfig();

    @JsonProperty("llm")
    private LlmConfig llm = new LlmConfig();

    @JsonProperty("warehouse")
    private WarehouseConfig warehouse = new WarehouseConfig();
}
