package org.carball.lbs.embedding;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class HashingEmbeddingProviderTest {

    private final HashingEmbeddingProvider provider = new HashingEmbeddingProvider(384);

    @Test
    void shouldProduceUnitVectorsOfConfiguredDimension() {
        // When
        float[] vector = provider.embed("Total sales by country in 2013");

        // Then
        assertThat(vector).hasSize(384);
        double norm = 0;
        for (float v : vector) {
            norm += v * v;
        }
        assertThat(Math.sqrt(norm)).isCloseTo(1.0, within(1e-5));
    }

    @Test
    void shouldBeDeterministicAndCaseInsensitive() {
        assertThat(provider.embed("Top 10 Customers")).containsExactly(provider.embed("top 10 customers"));
    }

    @Test
    void shouldPlaceRelatedQuestionsCloser() {
        // Given
        float[] question = provider.embed("top customers by revenue");
        float[] related = provider.embed("top 10 customers by total revenue");
        float[] unrelated = provider.embed("monthly freight trend for bikes");

        // When / Then
        assertThat(QueryExampleIndex.cosine(question, related))
                .isGreaterThan(QueryExampleIndex.cosine(question, unrelated));
    }

    @Test
    void shouldMapBlankTextToZeroVector() {
        assertThat(provider.embed("   ")).containsOnly(0.0f);
        assertThat(provider.embed(null)).hasSize(384);
    }

    @Test
    void shouldRejectTinyDimension() {
        assertThatThrownBy(() -> new HashingEmbeddingProvider(4))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Embedding dimension must be at least 8: 4");
    }

    @Test
    void shouldNameModelAfterDimension() {
        assertThat(provider.modelName()).isEqualTo("hashing-384");
        assertThat(provider.dimension()).isEqualTo(384);
    }
}
