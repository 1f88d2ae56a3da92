package org.carball.lbs.embedding;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.lbs.model.example.QueryExample;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Stores examples as one JSON document with parallel {@code documents} and {@code embeddings}
 * arrays. Writes go to a temporary file that atomically replaces the previous version.
 */
@Slf4j
public class JsonFileExampleRepository implements ExampleRepository {

    private final Path file;
    private final ObjectMapper mapper;

    public JsonFileExampleRepository(Path file, ObjectMapper mapper) {
        this.file = file;
        this.mapper = mapper;
    }

    @Override
    public List<QueryExample> load() throws IOException {
        if (!Files.exists(file)) {
            log.debug("No example file at {}, starting empty", file);
            return new ArrayList<>();
        }
        JsonNode root = mapper.readTree(file.toFile());
        JsonNode documents = root.path("documents");
        JsonNode embeddings = root.path("embeddings");
        if (!documents.isArray() || !embeddings.isArray() || documents.size() != embeddings.size()) {
            throw new IOException("Malformed example file " + file + ": documents and embeddings do not line up");
        }

        List<QueryExample> examples = new ArrayList<>(documents.size());
        for (int i = 0; i < documents.size(); i++) {
            QueryExample document = mapper.treeToValue(documents.get(i), QueryExample.class);
            JsonNode vectorNode = embeddings.get(i);
            float[] vector = new float[vectorNode.size()];
            for (int j = 0; j < vector.length; j++) {
                vector[j] = (float) vectorNode.get(j).asDouble();
            }
            examples.add(document.toBuilder().embedding(vector).build());
        }
        log.info("Loaded {} examples from {}", examples.size(), file);
        return examples;
    }

    @Override
    public void save(List<QueryExample> examples) throws IOException {
        ObjectNode root = mapper.createObjectNode();
        ArrayNode documents = root.putArray("documents");
        ArrayNode embeddings = root.putArray("embeddings");
        for (QueryExample example : examples) {
            ObjectNode document = mapper.valueToTree(example.toBuilder().embedding(null).build());
            document.remove("embedding");
            document.remove("source");
            documents.add(document);
            ArrayNode vector = embeddings.addArray();
            for (float v : example.getEmbedding()) {
                vector.add(v);
            }
        }

        Path absolute = file.toAbsolutePath();
        Files.createDirectories(absolute.getParent());
        Path temp = Files.createTempFile(absolute.getParent(), absolute.getFileName().toString(), ".tmp");
        try {
            mapper.writeValue(temp.toFile(), root);
            Files.move(temp, absolute, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
        log.debug("Saved {} examples to {}", examples.size(), file);
    }

    @Override
    public String description() {
        return file.toString();
    }
}
