package org.carball.lbs.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Answer to a natural-language question: the generated SQL and, when executed, its rows.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueryResult {

    String question;
    String sql;
    String intent;
    String explanation;
    boolean success;
    boolean executed;

    @Builder.Default
    List<String> columns = List.of();

    @Builder.Default
    List<Map<String, Object>> rows = List.of();

    String error;
    int retries;
    boolean cached;
    boolean learned;
    ChartSuggestion chart;

    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }
}
