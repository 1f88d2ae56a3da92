package org.carball.lbs.ai;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Warehouse description given to the language model with every prompt.
 */
public final class SchemaContext {

    public static final String RESOURCE = "/schema-context.md";

    private SchemaContext() {
    }

    public static String load() {
        return load(RESOURCE);
    }

    static String load(String resource) {
        try (InputStream in = SchemaContext.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Schema context resource not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).strip();
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read schema context from " + resource, e);
        }
    }
}
