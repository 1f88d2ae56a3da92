package org.carball.lbs.model.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChartSuggestion(@JsonProperty("type") String type,
                              @JsonProperty("x_axis") String xAxis,
                              @JsonProperty("y_axis") String yAxis,
                              @JsonProperty("title") String title) {
}
