package org.carball.lbs.model.example;

import java.util.Map;

/**
 * An example submitted for indexing, before it has an id or an embedding.
 */
public record ExampleDraft(String question, String sql, String intent, Map<String, Object> metadata) {

    public ExampleDraft(String question, String sql, String intent) {
        this(question, sql, intent, Map.of());
    }

    public boolean isValid() {
        return question != null && !question.isBlank() && sql != null && !sql.isBlank();
    }
}
