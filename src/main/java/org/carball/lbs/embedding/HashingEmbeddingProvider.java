package org.carball.lbs.embedding;

import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Local embedder based on feature hashing of word unigrams, word bigrams and character
 * trigrams. Deterministic and dependency free; texts sharing vocabulary land close together.
 * Vectors are L2-normalized; blank text maps to the zero vector.
 */
public class HashingEmbeddingProvider implements EmbeddingProvider {

    private static final int FNV_OFFSET = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimension;

    public HashingEmbeddingProvider(int dimension) {
        if (dimension < 8) {
            throw new IllegalArgumentException("Embedding dimension must be at least 8: " + dimension);
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }
        String[] words = text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+");
        String previous = null;
        for (String word : words) {
            if (word.isEmpty()) {
                continue;
            }
            addFeature(vector, "w:" + word, 1.0f);
            if (previous != null) {
                addFeature(vector, "b:" + previous + " " + word, 0.5f);
            }
            String padded = "#" + word + "#";
            for (int i = 0; i + 3 <= padded.length(); i++) {
                addFeature(vector, "c:" + padded.substring(i, i + 3), 0.25f);
            }
            previous = word;
        }
        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return "hashing-" + dimension;
    }

    private void addFeature(float[] vector, String feature, float weight) {
        int hash = fnv1a(feature);
        int bucket = Math.floorMod(hash, dimension);
        float sign = ((hash >>> 31) == 0) ? 1.0f : -1.0f;
        vector[bucket] += sign * weight;
    }

    private static int fnv1a(String feature) {
        int hash = FNV_OFFSET;
        for (byte b : feature.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    private static void normalize(float[] vector) {
        double norm = 0.0;
        for (float v : vector) {
            norm += v * v;
        }
        if (norm == 0) {
            return;
        }
        float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
