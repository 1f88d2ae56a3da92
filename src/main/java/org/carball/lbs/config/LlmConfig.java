package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Settings for the OpenAI-compatible chat and embeddings endpoint. The defaults target a local
 * Ollama server.
 */
@Data
public class LlmConfig {

    @JsonProperty("base_url")
    private String baseUrl = "http://localhost:11434/v1/";

    @JsonProperty("api_key")
    private String apiKey = "ollama";

    @JsonProperty("model")
    private String model = "llama3.1";

    @JsonProperty("temperature")
    private double temperature = 0.1;

    @JsonProperty("top_p")
    private double topP = 0.9;

    @JsonProperty("max_tokens")
    private int maxTokens = 1000;

    @JsonProperty("timeout_seconds")
    private int timeoutSeconds = 60;

    @JsonProperty("max_retries")
    private int maxRetries = 2;

    @JsonProperty("few_shot_examples")
    private int fewShotExamples = 5;

    @JsonProperty("auto_learn")
    private boolean autoLearn = true;

    /** Questions closer than this to an existing example are not learned again. */
    @JsonProperty("auto_learn_distance")
    private double autoLearnDistance = 0.1;

    @JsonProperty("row_limit")
    private int rowLimit = 100;
}
