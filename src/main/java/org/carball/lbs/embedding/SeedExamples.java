package org.carball.lbs.embedding;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.model.example.ExampleDraft;
import org.carball.lbs.model.example.QueryExample;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Curated question/SQL examples shipped on the classpath.
 */
@Slf4j
public final class SeedExamples {

    public static final String RESOURCE = "/example-queries.json";

    private SeedExamples() {
    }

    public static List<ExampleDraft> load() {
        return load(RESOURCE);
    }

    static List<ExampleDraft> load(String resource) {
        try (InputStream in = SeedExamples.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Seed example resource not found: " + resource);
            }
            List<SeedExample> seeds = new ObjectMapper().readValue(in, new TypeReference<List<SeedExample>>() {});
            return seeds.stream().map(SeedExample::toDraft).toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read seed examples from " + resource, e);
        }
    }

    /**
     * Adds the seed examples to an empty index.
     *
     * @return number of examples added
     */
    public static int seed(QueryExampleIndex index) {
        if (index.size() > 0) {
            log.debug("Index already holds {} examples, not seeding", index.size());
            return 0;
        }
        int added = index.bulkAdd(load());
        log.info("Seeded example index with {} examples", added);
        return added;
    }

    record SeedExample(String question, String sql, String intent, String description) {

        ExampleDraft toDraft() {
            Map<String, Object> metadata = new HashMap<>();
            metadata.put("source", QueryExample.SOURCE_SEED);
            if (description != null) {
                metadata.put("description", description);
            }
            return new ExampleDraft(question, sql, intent, metadata);
        }
    }
}
