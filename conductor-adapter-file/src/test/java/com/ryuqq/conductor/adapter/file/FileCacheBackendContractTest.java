package com.ryuqq.conductor.adapter.file;

import com.ryuqq.conductor.core.cache.CacheEntry;
import com.ryuqq.conductor.core.spi.CacheBackend;
import com.ryuqq.conductor.testkit.contract.AbstractCacheBackendContractTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract Tests for {@link FileCacheBackend}.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FileCacheBackendContractTest extends AbstractCacheBackendContractTest {

    @TempDir
    Path directory;

    @Override
    protected CacheBackend createBackend(Clock clock) {
        return new FileCacheBackend(directory, clock);
    }

    @Override
    protected CacheBackend reopen() {
        return new FileCacheBackend(directory, clock);
    }

    @Test
    void put_writesOneFilePerKey() throws Exception {
        // given
        CacheEntry entry = entry("file layout", SCOPE, "text");

        // when
        backend.put(entry, Duration.ofHours(1));

        // then
        Path file = directory.resolve(entry.key().getValue() + ".json");
        assertThat(file).exists();
        try (var files = Files.list(directory)) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    void get_unreadableFile_isMissAndDeleted() throws Exception {
        // given
        CacheEntry entry = entry("corrupt", SCOPE, "text");
        Path file = directory.resolve(entry.key().getValue() + ".json");
        Files.write(file, "{\"key\":".getBytes(StandardCharsets.UTF_8));

        // when & then
        assertThat(backend.get(entry.key())).isEmpty();
        assertThat(file).doesNotExist();
    }
}
