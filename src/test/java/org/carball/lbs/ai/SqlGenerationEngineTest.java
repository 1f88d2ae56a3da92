package org.carball.lbs.ai;

import org.carball.lbs.cache.InMemoryCacheStore;
import org.carball.lbs.cache.ResultCache;
import org.carball.lbs.config.CacheConfig;
import org.carball.lbs.config.LlmConfig;
import org.carball.lbs.embedding.HashingEmbeddingProvider;
import org.carball.lbs.embedding.InMemoryExampleRepository;
import org.carball.lbs.embedding.QueryExampleIndex;
import org.carball.lbs.exception.TextGenerationException;
import org.carball.lbs.model.example.QueryExample;
import org.carball.lbs.model.query.QueryResult;
import org.carball.lbs.model.query.SqlGeneration;
import org.carball.lbs.model.query.TabularResult;
import org.carball.lbs.output.JsonSupport;
import org.carball.lbs.warehouse.SqlExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SqlGenerationEngineTest {

    private static final String SCHEMA = "SCHEMA: FactInternetSales sal, DimDate dt";
    private static final String TOTAL_SALES_SQL = "SELECT SUM(sal.SalesAmount) AS TotalSales FROM FactInternetSales sal";

    private LlmConfig config;
    private ScriptedGenerator generator;
    private RecordingExecutor executor;
    private QueryExampleIndex index;
    private ResultCache cache;

    @BeforeEach
    void setUp() {
        config = new LlmConfig();
        generator = new ScriptedGenerator();
        executor = new RecordingExecutor(sql -> TabularResult.success(List.of("TotalSales"),
                List.of(Map.of("TotalSales", 29358677.22))));
        index = new QueryExampleIndex(new HashingEmbeddingProvider(128), new InMemoryExampleRepository(), 1);
        cache = new ResultCache(new InMemoryCacheStore(100), new CacheConfig(), JsonSupport.newObjectMapper());
    }

    @Test
    void shouldPromptWithNearestExamples() {
        // Given
        index.add("What were the total sales in 2013?", TOTAL_SALES_SQL, "aggregation", null);
        index.add("Sales by country", "SELECT st.SalesTerritoryCountry FROM DimSalesTerritory st", "geographic", null);
        generator.respond("```sql\n" + TOTAL_SALES_SQL + ";\n```");

        // When
        SqlGeneration generation = engine(index, null).generateSql("What were the total sales in 2012?");

        // Then
        assertThat(generation.getSql()).isEqualTo(TOTAL_SALES_SQL);
        assertThat(generation.getIntent()).isEqualTo("aggregation");
        assertThat(generation.getExamplesUsed()).isEqualTo(2);
        assertThat(generator.systemPrompts.get(0))
                .contains(SCHEMA)
                .contains("Question: What were the total sales in 2013?")
                .contains("Intent: aggregation");
        assertThat(generator.userPrompts.get(0)).isEqualTo("Question: What were the total sales in 2012?\n\nSQL:");
    }

    @Test
    void shouldPromptWithSeedExamplesWithoutIndex() {
        // Given
        generator.respond(TOTAL_SALES_SQL);

        // When
        SqlGeneration generation = engine(null, null).generateSql("Total sales?");

        // Then
        assertThat(generation.getExamplesUsed()).isEqualTo(config.getFewShotExamples());
        assertThat(generator.systemPrompts.get(0)).contains("What were the total sales in 2013?");
    }

    @Test
    void shouldAnswerOnFirstAttemptWithRowLimit() {
        // Given
        generator.respond(TOTAL_SALES_SQL);

        // When
        QueryResult result = engine(null, null).query("What were the total sales?", true, 25);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.isExecuted()).isTrue();
        assertThat(result.getRetries()).isZero();
        assertThat(result.getRowCount()).isEqualTo(1);
        assertThat(result.getChart().type()).isEqualTo("metric");
        assertThat(executor.statements).containsExactly(
                "SELECT TOP 25 SUM(sal.SalesAmount) AS TotalSales FROM FactInternetSales sal");
    }

    @Test
    void shouldCorrectFailingSqlWithTheDatabaseError() {
        // Given
        generator.respond("SELECT SUM(x.SalesAmount) FROM FactInternetSales sal");
        generator.respond(TOTAL_SALES_SQL);
        executor = new RecordingExecutor(sql -> sql.contains("x.SalesAmount")
                ? TabularResult.failure("The multi-part identifier \"x.SalesAmount\" could not be bound.")
                : TabularResult.success(List.of("TotalSales"), List.of(Map.of("TotalSales", 1.0))));

        // When
        QueryResult result = engine(null, null).query("What were the total sales?", true, 100);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getRetries()).isEqualTo(1);
        assertThat(result.getSql()).isEqualTo(TOTAL_SALES_SQL);
        assertThat(result.getError()).isNull();
        assertThat(generator.userPrompts.get(1))
                .contains("could not be bound")
                .contains("Original question: What were the total sales?");
        assertThat(executor.statements).hasSize(2);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        // Given
        config.setMaxRetries(2);
        for (int i = 0; i < 3; i++) {
            generator.respond("SELECT broken" + i);
        }
        executor = new RecordingExecutor(sql -> TabularResult.failure("Invalid column name '" + sql + "'"));
        SqlGenerationEngine engine = engine(null, cache);

        // When
        QueryResult result = engine.query("What were the total sales?", true, 100);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRetries()).isEqualTo(2);
        assertThat(result.getError()).contains("broken2");
        assertThat(executor.statements).hasSize(3);
        assertThat(cache.getQuery("What were the total sales?", true)).isEmpty();
    }

    @Test
    void shouldStopRetryingWhenCorrectionFails() {
        // Given
        generator.respond("SELECT broken");
        executor = new RecordingExecutor(sql -> TabularResult.failure("Invalid column name 'broken'"));

        // When - the second call to the generator fails
        QueryResult result = engine(null, null).query("What were the total sales?", true, 100);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getRetries()).isZero();
        assertThat(executor.statements).hasSize(1);
    }

    @Test
    void shouldRefuseStatementsThatModifyData() {
        // Given
        config.setMaxRetries(0);
        generator.respond("DROP TABLE DimCustomer");

        // When
        QueryResult result = engine(null, null).query("Remove all customers", true, 100);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getError()).startsWith("Only SELECT statements can be executed");
        assertThat(executor.statements).isEmpty();
    }

    @Test
    void shouldReturnSqlWithoutExecuting() {
        // Given
        generator.respond(TOTAL_SALES_SQL);

        // When
        QueryResult result = engine(index, null).query("What were the total sales?", false, 100);

        // Then
        assertThat(result.isExecuted()).isFalse();
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getSql()).isEqualTo(TOTAL_SALES_SQL);
        assertThat(result.isLearned()).isFalse();
        assertThat(executor.statements).isEmpty();
    }

    @Test
    void shouldLearnNewSuccessfulQuestions() {
        // Given
        index.add("Sales by country", "SELECT 1", "geographic", null);
        generator.respond(TOTAL_SALES_SQL);

        // When
        QueryResult result = engine(index, null).query("What were the total sales in 2013?", true, 100);

        // Then
        assertThat(result.isLearned()).isTrue();
        assertThat(index.size()).isEqualTo(2);
        assertThat(index.list()).filteredOn(e -> e.getSource().equals(QueryExample.SOURCE_AUTO_LEARN))
                .singleElement()
                .satisfies(example -> {
                    assertThat(example.getQuestion()).isEqualTo("What were the total sales in 2013?");
                    assertThat(example.getSql()).isEqualTo(TOTAL_SALES_SQL);
                    assertThat(example.getIntent()).isEqualTo("aggregation");
                });
    }

    @Test
    void shouldNotLearnQuestionsAlreadyCovered() {
        // Given
        index.add("What were the total sales in 2013?", TOTAL_SALES_SQL, "aggregation", null);
        generator.respond(TOTAL_SALES_SQL);

        // When
        QueryResult result = engine(index, null).query("What were the total sales in 2013?", true, 100);

        // Then
        assertThat(result.isLearned()).isFalse();
        assertThat(index.size()).isEqualTo(1);
    }

    @Test
    void shouldNotLearnWhenDisabled() {
        // Given
        config.setAutoLearn(false);
        generator.respond(TOTAL_SALES_SQL);

        // When
        QueryResult result = engine(index, null).query("What were the total sales in 2013?", true, 100);

        // Then
        assertThat(result.isLearned()).isFalse();
        assertThat(index.size()).isZero();
    }

    @Test
    void shouldServeRepeatedQuestionFromCache() {
        // Given
        generator.respond(TOTAL_SALES_SQL);
        SqlGenerationEngine engine = engine(null, cache);

        // When
        QueryResult first = engine.query("What were the total sales?", true, 100);
        QueryResult second = engine.query("What were the total sales?", true, 100);

        // Then
        assertThat(first.isCached()).isFalse();
        assertThat(second.isCached()).isTrue();
        assertThat(second.getRows()).hasSize(1);
        assertThat(generator.userPrompts).hasSize(1);
        assertThat(executor.statements).hasSize(1);
    }

    @Test
    void shouldReuseCachedRowsForIdenticalSql() {
        // Given
        SqlGenerationEngine engine = engine(null, cache);

        // When
        engine.execute(TOTAL_SALES_SQL, 100);
        TabularResult second = engine.execute(TOTAL_SALES_SQL, 100);

        // Then
        assertThat(second.isSuccess()).isTrue();
        assertThat(executor.statements).hasSize(1);
    }

    @Test
    void shouldRejectInvalidArguments() {
        SqlGenerationEngine engine = engine(null, null);

        assertThatThrownBy(() -> engine.query(" ", true, 10))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Question must not be blank");
        assertThatThrownBy(() -> engine.query("Total sales?", true, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Row limit must be at least 1, got 0");
    }

    @Test
    void shouldApplyRowLimitOnlyToPlainSelect() {
        assertThat(SqlGenerationEngine.applyRowLimit("SELECT a FROM t", 50)).isEqualTo("SELECT TOP 50 a FROM t");
        assertThat(SqlGenerationEngine.applyRowLimit("select distinct a from t", 5)).isEqualTo("select distinct TOP 5 a from t");
        assertThat(SqlGenerationEngine.applyRowLimit("SELECT TOP 10 a FROM t ORDER BY a", 50))
                .isEqualTo("SELECT TOP 10 a FROM t ORDER BY a");
        assertThat(SqlGenerationEngine.applyRowLimit("SELECT a FROM t ORDER BY a OFFSET 0 ROWS FETCH NEXT 5 ROWS ONLY", 50))
                .doesNotContain("TOP");
        assertThat(SqlGenerationEngine.applyRowLimit("WITH x AS (SELECT 1 AS a) SELECT a FROM x", 50))
                .isEqualTo("WITH x AS (SELECT 1 AS a) SELECT a FROM x");
    }

    private SqlGenerationEngine engine(QueryExampleIndex exampleIndex, ResultCache resultCache) {
        return new SqlGenerationEngine(generator, exampleIndex, executor, resultCache, config, SCHEMA);
    }

    private static final class ScriptedGenerator implements TextGenerator {

        private final Deque<String> responses = new ArrayDeque<>();
        private final List<String> systemPrompts = new ArrayList<>();
        private final List<String> userPrompts = new ArrayList<>();

        void respond(String response) {
            responses.add(response);
        }

        @Override
        public String generate(String systemPrompt, String userPrompt) {
            systemPrompts.add(systemPrompt);
            userPrompts.add(userPrompt);
            if (responses.isEmpty()) {
                throw new TextGenerationException("Model endpoint unavailable", null);
            }
            return responses.poll();
        }

        @Override
        public String modelName() {
            return "scripted";
        }
    }

    private static final class RecordingExecutor implements SqlExecutor {

        private final Function<String, TabularResult> answer;
        private final List<String> statements = new ArrayList<>();

        RecordingExecutor(Function<String, TabularResult> answer) {
            this.answer = answer;
        }

        @Override
        public TabularResult execute(String sql) {
            statements.add(sql);
            return answer.apply(sql);
        }
    }
}
