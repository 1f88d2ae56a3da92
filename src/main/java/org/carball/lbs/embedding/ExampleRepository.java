package org.carball.lbs.embedding;

import org.carball.lbs.model.example.QueryExample;

import java.io.IOException;
import java.util.List;

/**
 * Durable storage for the example index.
 */
public interface ExampleRepository {

    List<QueryExample> load() throws IOException;

    void save(List<QueryExample> examples) throws IOException;

    String description();
}
