package org.carball.lbs.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Rows of an executed query, or the error message when execution failed. A failed result
 * never carries partial rows.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class TabularResult {

    boolean success;

    @Builder.Default
    List<String> columns = List.of();

    @Builder.Default
    List<Map<String, Object>> rows = List.of();

    String error;

    public int getRowCount() {
        return rows == null ? 0 : rows.size();
    }

    public static TabularResult success(List<String> columns, List<Map<String, Object>> rows) {
        return TabularResult.builder().success(true).columns(columns).rows(rows).build();
    }

    public static TabularResult failure(String error) {
        return TabularResult.builder().success(false).error(error).build();
    }
}
