package org.carball.lbs.embedding;

import com.theokanning.openai.embedding.Embedding;
import com.theokanning.openai.embedding.EmbeddingRequest;
import com.theokanning.openai.embedding.EmbeddingResult;
import com.theokanning.openai.service.OpenAiService;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.exception.EmbeddingException;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Embeddings from an OpenAI-compatible {@code /embeddings} endpoint (OpenAI, Ollama, vLLM).
 */
@Slf4j
public class OpenAiEmbeddingProvider implements EmbeddingProvider {

    private final OpenAiService openAiService;
    private final String model;
    private final int dimension;

    public OpenAiEmbeddingProvider(OpenAiService openAiService, String model, int dimension) {
        this.openAiService = openAiService;
        this.model = model;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        return embedAll(List.of(text)).get(0);
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        EmbeddingRequest request = EmbeddingRequest.builder()
                .model(model)
                .input(texts)
                .build();
        EmbeddingResult result;
        try {
            result = openAiService.createEmbeddings(request);
        } catch (RuntimeException e) {
            log.error("Embedding request for {} texts failed: {}", texts.size(), e.getMessage());
            throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
        }

        List<Embedding> data = new ArrayList<>(result.getData());
        if (data.size() != texts.size()) {
            throw new EmbeddingException("Expected " + texts.size() + " embeddings, got " + data.size(), null);
        }
        data.sort(Comparator.comparingInt(Embedding::getIndex));

        List<float[]> vectors = new ArrayList<>(data.size());
        for (Embedding embedding : data) {
            List<Double> values = embedding.getEmbedding();
            if (values.size() != dimension) {
                throw new EmbeddingException(String.format("Model %s returned %d dimensions, expected %d",
                        model, values.size(), dimension), null);
            }
            float[] vector = new float[values.size()];
            for (int i = 0; i < vector.length; i++) {
                vector[i] = values.get(i).floatValue();
            }
            vectors.add(vector);
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return model;
    }
}
