package org.carball.lbs.ai;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-based intent of a question. The first matching intent wins.
 */
public final class IntentClassifier {

    public static final String GENERAL_QUERY = "general_query";

    private static final Map<String, List<String>> KEYWORDS = new LinkedHashMap<>();
    private static final Map<String, String> DESCRIPTIONS = Map.of(
            "ranking", "ranks and identifies top performers",
            "aggregation", "calculates aggregate metrics",
            "time_series", "analyzes trends over time",
            "customer_analysis", "analyzes customer behavior and demographics",
            "product_analysis", "examines product performance",
            "geographic", "analyzes data by geographic location",
            "promotion", "evaluates promotion effectiveness",
            GENERAL_QUERY, "queries the data warehouse");

    static {
        KEYWORDS.put("ranking", List.of("top", "best", "highest", "most", "largest"));
        KEYWORDS.put("aggregation", List.of("total", "sum", "aggregate"));
        KEYWORDS.put("time_series", List.of("trend", "over time", "monthly", "yearly", "growth"));
        KEYWORDS.put("customer_analysis", List.of("customer", "who", "buyer"));
        KEYWORDS.put("product_analysis", List.of("product", "item", "sold"));
        KEYWORDS.put("geographic", List.of("country", "territory", "region", "geographic"));
        KEYWORDS.put("promotion", List.of("promotion", "discount", "campaign"));
    }

    private IntentClassifier() {
    }

    public static String classify(String question) {
        String lower = question.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, List<String>> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return GENERAL_QUERY;
    }

    public static String explain(String question, String intent) {
        String description = DESCRIPTIONS.getOrDefault(intent, "queries the database");
        return "This query %s based on your question: '%s'".formatted(description, question);
    }
}
