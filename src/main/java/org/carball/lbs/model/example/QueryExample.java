package org.carball.lbs.model.example;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * A stored question/SQL pair with its embedding.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryExample {

    public static final String SOURCE_USER = "user";
    public static final String SOURCE_SEED = "seed";
    public static final String SOURCE_AUTO_LEARN = "auto_learn";

    String id;
    String question;
    String sql;
    String intent;

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    Instant addedAt;

    float[] embedding;

    public float[] getEmbedding() {
        return embedding == null ? null : embedding.clone();
    }

    public String getSource() {
        Object source = metadata == null ? null : metadata.get("source");
        return source == null ? SOURCE_USER : source.toString();
    }
}
