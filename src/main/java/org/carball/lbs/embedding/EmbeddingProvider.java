package org.carball.lbs.embedding;

import org.carball.lbs.exception.EmbeddingException;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns text into fixed-length vectors.
 */
public interface EmbeddingProvider {

    /**
     * @throws EmbeddingException when the embedding cannot be computed
     */
    float[] embed(String text);

    default List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(embed(text));
        }
        return vectors;
    }

    int dimension();

    String modelName();
}
