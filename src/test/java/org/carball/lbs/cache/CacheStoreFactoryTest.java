package org.carball.lbs.cache;

import com.fasterxml.jackson.databind.node.IntNode;
import org.carball.lbs.config.CacheConfig;
import org.carball.lbs.output.JsonSupport;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CacheStoreFactoryTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldUseMemoryByDefault() {
        // When
        try (CacheStore store = CacheStoreFactory.create(new CacheConfig(), JsonSupport.newObjectMapper())) {
            // Then
            assertThat(store).isInstanceOf(InMemoryCacheStore.class);
            assertThat(store.backend()).isEqualTo("memory");
        }
    }

    @Test
    void shouldFallBackToMemoryWhenRedisIsUnreachable() {
        // Given
        CacheConfig config = new CacheConfig();
        config.setBackend("redis");
        config.setRedisUrl("redis://127.0.0.1:1/0");

        // When
        try (CacheStore store = CacheStoreFactory.create(config, JsonSupport.newObjectMapper())) {
            // Then
            assertThat(store.backend()).isEqualTo(InMemoryCacheStore.BACKEND);
        }
    }

    @Test
    void shouldPassSnapshotPathToMemoryStore() {
        // Given
        CacheConfig config = new CacheConfig();
        config.setPersistPath(tempDir.resolve("cache.json").toString());
        config.setPersistEvery(1);

        // When
        try (CacheStore store = CacheStoreFactory.create(config, JsonSupport.newObjectMapper())) {
            store.set("k", IntNode.valueOf(1), null);
        }

        // Then
        assertThat(tempDir.resolve("cache.json")).exists();
    }
}
