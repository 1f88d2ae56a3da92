package org.carball.lbs.ai;

import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.cache.ResultCache;
import org.carball.lbs.config.LlmConfig;
import org.carball.lbs.embedding.QueryExampleIndex;
import org.carball.lbs.embedding.SeedExamples;
import org.carball.lbs.exception.EmbeddingException;
import org.carball.lbs.exception.TextGenerationException;
import org.carball.lbs.model.example.ExampleDraft;
import org.carball.lbs.model.example.ExampleMatch;
import org.carball.lbs.model.example.QueryExample;
import org.carball.lbs.model.query.QueryResult;
import org.carball.lbs.model.query.SqlGeneration;
import org.carball.lbs.model.query.TabularResult;
import org.carball.lbs.warehouse.SqlExecutor;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Answers natural-language questions with SQL: few-shot prompting from the example index,
 * execution with self-correcting retries, and learning from successful answers.
 */
@Slf4j
public class SqlGenerationEngine {

    private static final Pattern LIMITING_CLAUSE = Pattern.compile("\\b(TOP|FETCH|OFFSET)\\b");
    private static final Pattern SELECT_HEAD = Pattern.compile("^SELECT(\\s+DISTINCT)?\\s+", Pattern.CASE_INSENSITIVE);

    private static final String GENERATION_PROMPT = """
        You are an expert SQL Server query generator for a sales data warehouse.
        Convert natural language questions into accurate T-SQL queries.

        %s

        EXAMPLE QUERIES:
        %s

        RULES:
        1. Return ONLY the raw SQL query. No markdown, no explanations, no semicolons, no code fences.
        2. Use the table aliases listed in the schema description.
        3. INNER JOIN every table you reference. Using dt.CalendarYear requires
           "INNER JOIN DimDate dt ON dt.DateKey = sal.OrderDateKey".
        4. Never reference a table alias that is not in your FROM or JOIN clauses.
        5. TOP N queries always include ORDER BY.
        6. Filter years with DimDate.CalendarYear, not YEAR() on date columns.
        7. Use SUM() for money columns such as SalesAmount, not COUNT().
        8. Include GROUP BY for all non-aggregated columns in SELECT.
        9. "Last year" means the latest CalendarYear that has sales.
        """;

    private static final String CORRECTION_PROMPT = """
        You are an expert SQL Server query fixer. A query failed with an error.
        Fix the SQL query so it runs correctly. Return ONLY the corrected raw SQL.
        No markdown, no explanations, no semicolons.

        %s

        Every table alias you reference MUST appear in a FROM or JOIN clause.
        """;

    private final TextGenerator generator;
    private final QueryExampleIndex index;
    private final SqlExecutor executor;
    private final ResultCache cache;
    private final LlmConfig config;
    private final String schemaContext;

    /**
     * @param index example index, or null to prompt with the seed examples only
     * @param cache result cache, or null to disable caching
     */
    public SqlGenerationEngine(TextGenerator generator, QueryExampleIndex index, SqlExecutor executor,
                               ResultCache cache, LlmConfig config, String schemaContext) {
        this.generator = generator;
        this.index = index;
        this.executor = executor;
        this.cache = cache;
        this.config = config;
        this.schemaContext = schemaContext;
    }

    public SqlGeneration generateSql(String question) {
        requireQuestion(question);

        List<ExampleDraft> examples = fewShotExamples(question);
        String systemPrompt = GENERATION_PROMPT.formatted(schemaContext, formatExamples(examples));
        String userPrompt = "Question: %s\n\nSQL:".formatted(question);

        log.debug("Generating SQL for '{}' with {} examples", question, examples.size());
        String sql = SqlResponseParser.extractSql(generator.generate(systemPrompt, userPrompt));
        String intent = IntentClassifier.classify(question);

        return SqlGeneration.builder()
                .question(question)
                .sql(sql)
                .intent(intent)
                .explanation(IntentClassifier.explain(question, intent))
                .examplesUsed(examples.size())
                .build();
    }

    public QueryResult query(String question) {
        return query(question, true, config.getRowLimit());
    }

    /**
     * Generates SQL for the question and optionally executes it, asking the model to repair a
     * failing statement up to the configured number of retries.
     */
    public QueryResult query(String question, boolean execute, int limit) {
        requireQuestion(question);
        if (limit < 1) {
            throw new IllegalArgumentException("Row limit must be at least 1, got " + limit);
        }

        if (cache != null) {
            Optional<QueryResult> cached = cache.getQuery(question, execute);
            if (cached.isPresent()) {
                log.debug("Query cache hit for '{}'", question);
                return cached.get();
            }
        }

        SqlGeneration generation = generateSql(question);
        QueryResult.QueryResultBuilder result = QueryResult.builder()
                .question(question)
                .sql(generation.getSql())
                .intent(generation.getIntent())
                .explanation(generation.getExplanation())
                .executed(execute)
                .success(!execute);

        boolean succeeded = false;
        if (execute) {
            succeeded = executeWithRetries(question, generation, limit, result);
        }

        QueryResult built = result.build();
        if (succeeded && config.isAutoLearn() && index != null) {
            built = built.toBuilder().learned(autoLearn(question, built.getSql(), built.getIntent())).build();
        }

        if (cache != null && built.isSuccess()) {
            cache.putQuery(built, execute);
        }
        return built;
    }

    private boolean executeWithRetries(String question, SqlGeneration generation, int limit,
                                       QueryResult.QueryResultBuilder result) {
        String currentSql = generation.getSql();
        int maxRetries = config.getMaxRetries();

        for (int attempt = 0; attempt <= maxRetries; attempt++) {
            TabularResult execution = execute(currentSql, limit);
            result.sql(currentSql).retries(attempt);

            if (execution.isSuccess()) {
                result.success(true)
                        .columns(execution.getColumns())
                        .rows(execution.getRows())
                        .error(null)
                        .chart(ChartSuggester.suggest(generation.getIntent(), execution.getColumns(), execution.getRowCount()));
                log.info("Answered '{}' with {} rows after {} retries", question, execution.getRowCount(), attempt);
                return true;
            }

            result.success(false).error(execution.getError());
            if (attempt == maxRetries) {
                log.warn("Giving up on '{}' after {} retries: {}", question, attempt, execution.getError());
                break;
            }

            log.info("SQL failed (attempt {}), asking the model to fix it: {}", attempt + 1,
                    abbreviate(execution.getError()));
            try {
                currentSql = correct(question, currentSql, execution.getError());
            } catch (TextGenerationException e) {
                log.warn("Self-correction failed: {}", e.getMessage());
                break;
            }
        }
        return false;
    }

    /**
     * Runs a statement with the row limit applied, reusing cached results for identical SQL.
     */
    public TabularResult execute(String sql, int limit) {
        Optional<String> rejection = SqlSafetyValidator.check(sql);
        if (rejection.isPresent()) {
            log.warn("Refusing to execute generated SQL: {}", rejection.get());
            return TabularResult.failure(rejection.get());
        }

        String limited = applyRowLimit(sql, limit);
        if (cache != null) {
            Optional<TabularResult> cached = cache.getSqlResult(limited);
            if (cached.isPresent()) {
                log.debug("SQL cache hit");
                return cached.get();
            }
        }

        TabularResult result = executor.execute(limited);
        if (cache != null && result.isSuccess()) {
            cache.putSqlResult(limited, result);
        }
        return result;
    }

    /**
     * Adds {@code TOP n} to a plain SELECT that has no limiting clause of its own.
     */
    static String applyRowLimit(String sql, int limit) {
        String trimmed = sql.strip();
        if (LIMITING_CLAUSE.matcher(trimmed.toUpperCase(Locale.ROOT)).find()) {
            return trimmed;
        }
        Matcher head = SELECT_HEAD.matcher(trimmed);
        if (!head.find()) {
            return trimmed;
        }
        return trimmed.substring(0, head.end()) + "TOP " + limit + " " + trimmed.substring(head.end());
    }

    private String correct(String question, String failedSql, String error) {
        String userPrompt = """
            The following SQL query failed:

            %s

            Error message: %s

            Original question: %s

            Write the corrected SQL query:""".formatted(failedSql, error, question);
        return SqlResponseParser.extractSql(generator.generate(CORRECTION_PROMPT.formatted(schemaContext), userPrompt));
    }

    private List<ExampleDraft> fewShotExamples(String question) {
        int k = config.getFewShotExamples();
        if (index != null && index.size() > 0) {
            try {
                return index.search(question, k, null).stream()
                        .map(ExampleMatch::example)
                        .map(example -> new ExampleDraft(example.getQuestion(), example.getSql(), example.getIntent()))
                        .toList();
            } catch (EmbeddingException e) {
                log.warn("Example search failed, using seed examples: {}", e.getMessage());
            }
        }
        return SeedExamples.load().stream().limit(k).toList();
    }

    private boolean autoLearn(String question, String sql, String intent) {
        try {
            List<ExampleMatch> nearest = index.search(question, 1, null);
            if (!nearest.isEmpty() && nearest.get(0).distance() < config.getAutoLearnDistance()) {
                log.debug("'{}' is close to an existing example, not learning it", question);
                return false;
            }
            String id = index.add(question, sql, intent, Map.of("source", QueryExample.SOURCE_AUTO_LEARN));
            log.info("Learned new example {} from '{}'", id, question);
            return true;
        } catch (EmbeddingException e) {
            log.warn("Auto-learn failed: {}", e.getMessage());
            return false;
        }
    }

    private static String formatExamples(List<ExampleDraft> examples) {
        return examples.stream()
                .map(example -> "Question: %s\nIntent: %s\nSQL:\n%s".formatted(
                        example.question(),
                        example.intent() == null ? IntentClassifier.GENERAL_QUERY : example.intent(),
                        example.sql()))
                .collect(Collectors.joining("\n\n"));
    }

    private static void requireQuestion(String question) {
        if (question == null || question.isBlank()) {
            throw new IllegalArgumentException("Question must not be blank");
        }
    }

    private static String abbreviate(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= 100 ? text : text.substring(0, 100) + "...";
    }
}
