package org.carball.lbs.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * How a dimension joins the fact table and which columns name and categorize its members.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class DimensionSpec {

    /** Human label used in descriptions, e.g. "Product". */
    @JsonProperty("label")
    private String label;

    @JsonProperty("table")
    private String table;

    @JsonProperty("alias")
    private String alias;

    /** Key column shared by the fact and the dimension table. */
    @JsonProperty("key")
    private String key;

    @JsonProperty("name_expression")
    private String nameExpression;

    @JsonProperty("category_expression")
    private String categoryExpression;

    /** Additional joins needed by the category expression. */
    @JsonProperty("extra_joins")
    private String extraJoins;
}
