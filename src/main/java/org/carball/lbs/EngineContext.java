package org.carball.lbs;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.theokanning.openai.service.OpenAiService;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.ai.OpenAiClients;
import org.carball.lbs.ai.OpenAiTextGenerator;
import org.carball.lbs.ai.SchemaContext;
import org.carball.lbs.ai.SqlGenerationEngine;
import org.carball.lbs.ai.TextGenerator;
import org.carball.lbs.cache.CacheStoreFactory;
import org.carball.lbs.cache.ResultCache;
import org.carball.lbs.config.EngineConfig;
import org.carball.lbs.config.IndexConfig;
import org.carball.lbs.detector.AnomalyDetectionService;
import org.carball.lbs.embedding.EmbeddingProvider;
import org.carball.lbs.embedding.ExampleRepository;
import org.carball.lbs.embedding.HashingEmbeddingProvider;
import org.carball.lbs.embedding.InMemoryExampleRepository;
import org.carball.lbs.embedding.JsonFileExampleRepository;
import org.carball.lbs.embedding.OpenAiEmbeddingProvider;
import org.carball.lbs.embedding.QueryExampleIndex;
import org.carball.lbs.embedding.SeedExamples;
import org.carball.lbs.output.JsonSupport;
import org.carball.lbs.warehouse.JdbcWarehouseDataProvider;
import org.carball.lbs.warehouse.SqlExecutor;
import org.carball.lbs.warehouse.WarehouseDataProvider;

import java.nio.file.Path;

/**
 * Owns the long-lived components of the engine: one cache, one example index and the services
 * built on them. Create once per process and close on shutdown so the cache snapshot and the
 * index are flushed.
 */
@Slf4j
public class EngineContext implements AutoCloseable {

    @Getter
    private final EngineConfig config;
    @Getter
    private final ObjectMapper mapper;
    @Getter
    private final ResultCache resultCache;
    @Getter
    private final QueryExampleIndex exampleIndex;

    private final AnomalyDetectionService detectionService;
    private final SqlGenerationEngine sqlEngine;

    public static EngineContext create(EngineConfig config) {
        ObjectMapper mapper = JsonSupport.newObjectMapper();
        OpenAiService openAi = OpenAiClients.aiDisabled() ? null : OpenAiClients.create(config.getLlm());

        JdbcWarehouseDataProvider warehouse = null;
        if (config.getWarehouse().isConfigured()) {
            warehouse = new JdbcWarehouseDataProvider(config.getWarehouse());
        } else {
            log.info("No warehouse configured; detection and query commands are unavailable");
        }

        return new EngineContext(config, mapper,
                new ResultCache(CacheStoreFactory.create(config.getCache(), mapper), config.getCache(), mapper),
                createIndex(config.getIndex(), openAi, mapper),
                warehouse, warehouse,
                new OpenAiTextGenerator(openAi, config.getLlm()));
    }

    EngineContext(EngineConfig config, ObjectMapper mapper, ResultCache resultCache, QueryExampleIndex exampleIndex,
                  WarehouseDataProvider provider, SqlExecutor executor, TextGenerator generator) {
        this.config = config;
        this.mapper = mapper;
        this.resultCache = resultCache;
        this.exampleIndex = exampleIndex;

        config.getDetection().validate();
        this.detectionService = provider == null ? null
                : new AnomalyDetectionService(provider, config.getWarehouse(), config.getDetection(), resultCache);
        this.sqlEngine = executor == null ? null
                : new SqlGenerationEngine(generator, exampleIndex, executor, resultCache, config.getLlm(),
                        SchemaContext.load());
    }

    public AnomalyDetectionService getDetectionService() {
        if (detectionService == null) {
            throw new IllegalStateException("Warehouse is not configured (set warehouse.jdbc_url or LBS_DB_URL)");
        }
        return detectionService;
    }

    public SqlGenerationEngine getSqlEngine() {
        if (sqlEngine == null) {
            throw new IllegalStateException("Warehouse is not configured (set warehouse.jdbc_url or LBS_DB_URL)");
        }
        return sqlEngine;
    }

    static QueryExampleIndex createIndex(IndexConfig config, OpenAiService openAi, ObjectMapper mapper) {
        EmbeddingProvider embeddings;
        if ("openai".equalsIgnoreCase(config.getEmbeddingProvider()) && openAi != null) {
            embeddings = new OpenAiEmbeddingProvider(openAi, config.getEmbeddingModel(), config.getDimension());
        } else {
            if ("openai".equalsIgnoreCase(config.getEmbeddingProvider())) {
                log.warn("Remote embeddings are disabled (skip.ai=true), using the local hashing embedder");
            } else if (!"hashing".equalsIgnoreCase(config.getEmbeddingProvider())) {
                throw new IllegalArgumentException("Unknown embedding provider: " + config.getEmbeddingProvider()
                        + ". Available providers: hashing, openai");
            }
            embeddings = new HashingEmbeddingProvider(config.getDimension());
        }

        ExampleRepository repository = config.getPersistPath() == null || config.getPersistPath().isBlank()
                ? new InMemoryExampleRepository()
                : new JsonFileExampleRepository(Path.of(config.getPersistPath()), mapper);

        QueryExampleIndex index = new QueryExampleIndex(embeddings, repository, config.getFlushEvery());
        if (config.isSeedWhenEmpty()) {
            SeedExamples.seed(index);
        }
        return index;
    }

    @Override
    public void close() {
        exampleIndex.close();
        resultCache.close();
        log.debug("Engine context closed");
    }
}
