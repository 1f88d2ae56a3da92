package org.carball.lbs.model.example;

import java.util.Map;

public record IndexStats(int totalExamples,
                         Map<String, Long> intents,
                         Map<String, Long> sources,
                         String embeddingModel,
                         int embeddingDimension,
                         String storage) {
}
