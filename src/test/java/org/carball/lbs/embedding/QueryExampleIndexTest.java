package org.carball.lbs.embedding;

import org.carball.lbs.exception.EmbeddingException;
import org.carball.lbs.model.example.ExampleDraft;
import org.carball.lbs.model.example.ExampleMatch;
import org.carball.lbs.model.example.IndexStats;
import org.carball.lbs.model.example.QueryExample;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QueryExampleIndexTest {

    private HashingEmbeddingProvider embeddings;
    private InMemoryExampleRepository repository;
    private QueryExampleIndex index;

    @BeforeEach
    void setUp() {
        embeddings = new HashingEmbeddingProvider(128);
        repository = new InMemoryExampleRepository();
        index = new QueryExampleIndex(embeddings, repository, 1);
    }

    @Test
    void shouldFindExactQuestionFirst() {
        // Given
        index.add("What were the total sales in 2013?", "SELECT SUM(SalesAmount) FROM FactInternetSales", "aggregation", null);
        index.add("Show the monthly sales trend", "SELECT MonthNumberOfYear FROM DimDate", "time_series", null);
        index.add("Top 10 customers by revenue", "SELECT TOP 10 CustomerKey FROM DimCustomer", "ranking", null);

        // When
        List<ExampleMatch> matches = index.search("Top 10 customers by revenue", 2, null);

        // Then
        assertThat(matches).hasSize(2);
        assertThat(matches.get(0).example().getIntent()).isEqualTo("ranking");
        assertThat(matches.get(0).distance()).isLessThan(1e-6);
        assertThat(matches.get(0).similarity()).isGreaterThan(0.999);
        assertThat(matches.get(1).distance()).isGreaterThanOrEqualTo(matches.get(0).distance());
    }

    @Test
    void shouldFilterByIntent() {
        // Given
        index.add("Sales by country", "SELECT 1", "geographic", null);
        index.add("Sales by territory", "SELECT 2", "geographic", null);
        index.add("Sales by month", "SELECT 3", "time_series", null);

        // When
        List<ExampleMatch> matches = index.search("Sales by month", 5, "geographic");

        // Then
        assertThat(matches).hasSize(2).allSatisfy(match ->
                assertThat(match.example().getIntent()).isEqualTo("geographic"));
    }

    @Test
    void shouldReturnNothingFromEmptyIndex() {
        assertThat(index.search("anything", 3, null)).isEmpty();
    }

    @Test
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> index.search("q", 0, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("k must be at least 1: 0");
        assertThatThrownBy(() -> index.add(" ", "SELECT 1", null, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> index.add("question", "", null, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldDefaultIntentAndSource() {
        // When
        String id = index.add("  Revenue per product  ", " SELECT 1 ", null, null);

        // Then
        QueryExample example = index.get(id).orElseThrow();
        assertThat(id).startsWith("query_");
        assertThat(example.getQuestion()).isEqualTo("Revenue per product");
        assertThat(example.getSql()).isEqualTo("SELECT 1");
        assertThat(example.getIntent()).isEqualTo(QueryExampleIndex.DEFAULT_INTENT);
        assertThat(example.getSource()).isEqualTo(QueryExample.SOURCE_USER);
        assertThat(example.getAddedAt()).isNotNull();
    }

    @Test
    void shouldSkipMalformedDraftsInBulkAdd() {
        // Given
        List<ExampleDraft> drafts = new ArrayList<>();
        drafts.add(new ExampleDraft("Sales in 2012", "SELECT 1", "aggregation"));
        drafts.add(new ExampleDraft("", "SELECT 2", "aggregation"));
        drafts.add(null);
        drafts.add(new ExampleDraft("Orders by day", "SELECT 3", null));

        // When
        int added = index.bulkAdd(drafts);

        // Then
        assertThat(added).isEqualTo(2);
        assertThat(index.size()).isEqualTo(2);
    }

    @Test
    void shouldFallBackToSingleEmbeddingsWhenBatchFails() {
        // Given
        QueryExampleIndex flaky = new QueryExampleIndex(new BatchFailingProvider(embeddings), repository, 1);

        // When
        int added = flaky.bulkAdd(List.of(
                new ExampleDraft("Sales in 2012", "SELECT 1", "aggregation"),
                new ExampleDraft("poison question", "SELECT 2", "aggregation")));

        // Then
        assertThat(added).isEqualTo(1);
        assertThat(flaky.list()).extracting(QueryExample::getQuestion).containsExactly("Sales in 2012");
    }

    @Test
    void shouldDeleteAndClear() {
        // Given
        String id = index.add("Sales in 2012", "SELECT 1", "aggregation", null);
        index.add("Sales in 2013", "SELECT 2", "aggregation", null);

        // When
        boolean deleted = index.delete(id);
        boolean deletedAgain = index.delete(id);
        boolean cleared = index.clear();

        // Then
        assertThat(deleted).isTrue();
        assertThat(deletedAgain).isFalse();
        assertThat(cleared).isTrue();
        assertThat(index.size()).isZero();
        assertThat(repository.load()).isEmpty();
    }

    @Test
    void shouldPersistAfterEveryMutationAndReload() {
        // Given
        index.add("Sales in 2012", "SELECT 1", "aggregation", Map.of("source", QueryExample.SOURCE_SEED));

        // When
        QueryExampleIndex reopened = new QueryExampleIndex(embeddings, repository, 1);

        // Then
        assertThat(repository.getSaveCount()).isEqualTo(1);
        assertThat(reopened.size()).isEqualTo(1);
        assertThat(reopened.list().get(0).getSource()).isEqualTo(QueryExample.SOURCE_SEED);
    }

    @Test
    void shouldBatchWritesAndFlushOnClose() {
        // Given
        QueryExampleIndex batched = new QueryExampleIndex(embeddings, repository, 10);
        batched.add("Sales in 2012", "SELECT 1", null, null);
        batched.add("Sales in 2013", "SELECT 2", null, null);

        // When
        int savesBeforeClose = repository.getSaveCount();
        batched.close();

        // Then
        assertThat(savesBeforeClose).isZero();
        assertThat(repository.getSaveCount()).isEqualTo(1);
        assertThat(repository.load()).hasSize(2);
    }

    @Test
    void shouldIgnoreStoredExamplesWithOtherDimension() {
        // Given
        index.add("Sales in 2012", "SELECT 1", null, null);

        // When
        QueryExampleIndex wider = new QueryExampleIndex(new HashingEmbeddingProvider(256), repository, 1);

        // Then
        assertThat(wider.size()).isZero();
    }

    @Test
    void shouldKeepWorkingWhenPersistenceFails() {
        // Given
        QueryExampleIndex unpersisted = new QueryExampleIndex(embeddings, new FailingRepository(), 1);

        // When
        unpersisted.add("Sales in 2012", "SELECT 1", null, null);

        // Then
        assertThat(unpersisted.size()).isEqualTo(1);
        assertThat(unpersisted.flush()).isFalse();
    }

    @Test
    void shouldSummarizeIntentsAndSources() {
        // Given
        index.add("Sales in 2012", "SELECT 1", "aggregation", Map.of("source", QueryExample.SOURCE_SEED));
        index.add("Sales in 2013", "SELECT 2", "aggregation", null);
        index.add("Sales by month", "SELECT 3", "time_series", Map.of("source", QueryExample.SOURCE_AUTO_LEARN));

        // When
        IndexStats stats = index.stats();

        // Then
        assertThat(stats.totalExamples()).isEqualTo(3);
        assertThat(stats.intents()).containsEntry("aggregation", 2L).containsEntry("time_series", 1L);
        assertThat(stats.sources()).containsEntry("seed", 1L).containsEntry("user", 1L).containsEntry("auto_learn", 1L);
        assertThat(stats.embeddingModel()).isEqualTo("hashing-128");
        assertThat(stats.storage()).isEqualTo("memory");
    }

    @Test
    void shouldKeepMutationsMadeWhileSaving() throws Exception {
        // Given
        BlockingRepository blocking = new BlockingRepository();
        QueryExampleIndex batched = new QueryExampleIndex(embeddings, blocking, 10);
        batched.add("Sales in 2012", "SELECT 1", null, null);
        ExecutorService executor = Executors.newSingleThreadExecutor();

        // When
        Future<Boolean> flushing = executor.submit(batched::flush);
        assertThat(blocking.saving.await(5, TimeUnit.SECONDS)).isTrue();
        batched.add("Sales in 2013", "SELECT 2", null, null);
        blocking.release.countDown();
        boolean flushed = flushing.get(5, TimeUnit.SECONDS);
        executor.shutdown();
        batched.close();

        // Then
        assertThat(flushed).isTrue();
        assertThat(blocking.load()).extracting(QueryExample::getSql).containsExactlyInAnyOrder("SELECT 1", "SELECT 2");
    }

    @Test
    void shouldKeepEveryExampleAddedConcurrently() throws Exception {
        // Given
        QueryExampleIndex batched = new QueryExampleIndex(embeddings, repository, 7);
        int threads = 8;
        int perThread = 25;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        for (int t = 0; t < threads; t++) {
            int thread = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < perThread; i++) {
                    batched.add("Sales question " + thread + "-" + i, "SELECT " + i, "aggregation", null);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        executor.shutdown();
        batched.close();

        // Then
        assertThat(batched.size()).isEqualTo(threads * perThread);
        assertThat(batched.stats().intents()).containsEntry("aggregation", (long) threads * perThread);
        assertThat(repository.load()).hasSize(threads * perThread);
    }

    @Test
    void shouldDefaultIntentOfStoredExamplesWithoutOne() {
        // Given
        repository.save(List.of(QueryExample.builder()
                .id("query_legacy")
                .question("Sales in 2011")
                .sql("SELECT 1")
                .embedding(embeddings.embed("Sales in 2011"))
                .build()));

        // When
        QueryExampleIndex reopened = new QueryExampleIndex(embeddings, repository, 1);
        IndexStats stats = reopened.stats();

        // Then
        assertThat(reopened.get("query_legacy")).get()
                .extracting(QueryExample::getIntent).isEqualTo(QueryExampleIndex.DEFAULT_INTENT);
        assertThat(stats.intents()).containsEntry(QueryExampleIndex.DEFAULT_INTENT, 1L);
        assertThat(reopened.search("Sales in 2011", 1, QueryExampleIndex.DEFAULT_INTENT)).hasSize(1);
    }

    @Test
    void shouldNotExposeStoredEmbedding() {
        // Given
        String id = index.add("Top 10 customers by revenue", "SELECT TOP 10 CustomerKey FROM DimCustomer", "ranking", null);
        float[] leaked = index.get(id).orElseThrow().getEmbedding();

        // When
        Arrays.fill(leaked, 0f);

        // Then
        assertThat(index.get(id).orElseThrow().getEmbedding()).containsExactly(embeddings.embed("Top 10 customers by revenue"));
        assertThat(index.search("Top 10 customers by revenue", 1, null).get(0).similarity()).isGreaterThan(0.999);
    }

    private static final class BatchFailingProvider implements EmbeddingProvider {

        private final EmbeddingProvider delegate;

        BatchFailingProvider(EmbeddingProvider delegate) {
            this.delegate = delegate;
        }

        @Override
        public float[] embed(String text) {
            if (text.contains("poison")) {
                throw new EmbeddingException("Refused to embed", null);
            }
            return delegate.embed(text);
        }

        @Override
        public List<float[]> embedAll(List<String> texts) {
            throw new EmbeddingException("Batch endpoint unavailable", null);
        }

        @Override
        public int dimension() {
            return delegate.dimension();
        }

        @Override
        public String modelName() {
            return "batch-failing";
        }
    }

    private static final class FailingRepository implements ExampleRepository {

        @Override
        public List<QueryExample> load() throws IOException {
            throw new IOException("Disk not mounted");
        }

        @Override
        public void save(List<QueryExample> examples) throws IOException {
            throw new IOException("Read-only file system");
        }

        @Override
        public String description() {
            return "broken";
        }
    }

    private static final class BlockingRepository implements ExampleRepository {

        private final InMemoryExampleRepository delegate = new InMemoryExampleRepository();
        private final CountDownLatch saving = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public List<QueryExample> load() {
            return delegate.load();
        }

        @Override
        public void save(List<QueryExample> examples) throws IOException {
            saving.countDown();
            try {
                if (!release.await(5, TimeUnit.SECONDS)) {
                    throw new IOException("Save was never released");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while saving", e);
            }
            delegate.save(examples);
        }

        @Override
        public String description() {
            return "blocking";
        }
    }
}
