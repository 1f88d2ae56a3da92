package org.carball.lbs.embedding;

import org.carball.lbs.model.example.QueryExample;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the last saved snapshot in memory; nothing survives the process.
 */
public class InMemoryExampleRepository implements ExampleRepository {

    private List<QueryExample> saved = List.of();
    private int saveCount;

    @Override
    public synchronized List<QueryExample> load() {
        return new ArrayList<>(saved);
    }

    @Override
    public synchronized void save(List<QueryExample> examples) {
        saved = List.copyOf(examples);
        saveCount++;
    }

    @Override
    public String description() {
        return "memory";
    }

    synchronized int getSaveCount() {
        return saveCount;
    }
}
