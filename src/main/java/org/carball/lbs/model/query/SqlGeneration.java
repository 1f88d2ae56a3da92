package org.carball.lbs.model.query;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * SQL produced for a question, before execution.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class SqlGeneration {

    String question;
    String sql;
    String intent;
    String explanation;
    int examplesUsed;
}
