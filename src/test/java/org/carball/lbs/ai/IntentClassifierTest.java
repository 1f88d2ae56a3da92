package org.carball.lbs.ai;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentClassifierTest {

    @Test
    void shouldClassifyByFirstMatchingKeywordGroup() {
        assertThat(IntentClassifier.classify("Top 10 customers by revenue")).isEqualTo("ranking");
        assertThat(IntentClassifier.classify("What were the total sales in 2013?")).isEqualTo("aggregation");
        assertThat(IntentClassifier.classify("Show the monthly sales trend")).isEqualTo("time_series");
        assertThat(IntentClassifier.classify("Average order value by customer education")).isEqualTo("customer_analysis");
        assertThat(IntentClassifier.classify("Which product sold the fewest units?")).isEqualTo("product_analysis");
        assertThat(IntentClassifier.classify("Sales by country")).isEqualTo("geographic");
        assertThat(IntentClassifier.classify("Revenue from each promotion")).isEqualTo("promotion");
    }

    @Test
    void shouldFallBackToGeneralQuery() {
        assertThat(IntentClassifier.classify("How many orders were placed in 2012?")).isEqualTo(IntentClassifier.GENERAL_QUERY);
    }

    @Test
    void shouldExplainIntent() {
        assertThat(IntentClassifier.explain("Sales by country", "geographic"))
                .isEqualTo("This query analyzes data by geographic location based on your question: 'Sales by country'");
        assertThat(IntentClassifier.explain("x", "unknown"))
                .isEqualTo("This query queries the database based on your question: 'x'");
    }
}
