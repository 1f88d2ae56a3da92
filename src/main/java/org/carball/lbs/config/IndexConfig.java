package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

@Data
public class IndexConfig {

    /** JSON file holding the examples; the index stays in memory when unset. */
    @JsonProperty("persist_path")
    private String persistPath = "data/query_examples.json";

    /** Number of mutations between writes to the persist file. */
    @JsonProperty("flush_every")
    private int flushEvery = 1;

    /**
     * {@code openai} sends questions to an OpenAI-compatible embeddings endpoint serving the pretrained
     * {@link #embeddingModel} sentence model ({@code all-minilm}). {@code hashing} is the offline
     * default: a deterministic feature-hashing embedder that needs no model server but only captures
     * word overlap.
     */
    @JsonProperty("embedding_provider")
    private String embeddingProvider = "hashing";

    @JsonProperty("embedding_model")
    private String embeddingModel = "all-minilm";

    @JsonProperty("dimension")
    private int dimension = 384;

    @JsonProperty("seed_when_empty")
    private boolean seedWhenEmpty = true;
}
