package com.ryuqq.conductor.adapter.file;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.conductor.adapter.file.json.ConductorJson;
import com.ryuqq.conductor.core.cache.CacheEntry;
import com.ryuqq.conductor.core.cache.CacheKey;
import com.ryuqq.conductor.core.exception.CacheBackendException;
import com.ryuqq.conductor.core.model.ScopeId;
import com.ryuqq.conductor.core.spi.CacheBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * File-backed {@link CacheBackend}: one JSON document per cache key.
 *
 * <p>Entries live at {@code <directory>/<key>.json}. A put writes a temporary
 * sibling and moves it into place atomically, so readers see either the old or the
 * new entry, never a partial one.</p>
 *
 * <p>Scope invalidation scans the directory; it is linear in the number of entries.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class FileCacheBackend implements CacheBackend {

    private static final Logger log = LoggerFactory.getLogger(FileCacheBackend.class);
    private static final String SUFFIX = ".json";

    private final Path directory;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public FileCacheBackend(Path directory) {
        this(directory, ConductorJson.createObjectMapper(), Clock.systemUTC());
    }

    public FileCacheBackend(Path directory, Clock clock) {
        this(directory, ConductorJson.createObjectMapper(), clock);
    }

    public FileCacheBackend(Path directory, ObjectMapper objectMapper, Clock clock) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new CacheBackendException("Cannot create cache directory " + directory, e);
        }
        this.directory = directory;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * {@inheritDoc}
     *
     * <p>Expired and unreadable files are deleted and reported as a miss.</p>
     */
    @Override
    public Optional<CacheEntry> get(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Path path = pathOf(key);
        Optional<CacheEntry> entry = read(path);
        if (entry.isPresent() && entry.get().isExpiredAt(clock.instant())) {
            delete(path);
            return Optional.empty();
        }
        return entry;
    }

    @Override
    public void put(CacheEntry entry, Duration ttl) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        CacheEntry stored = entry.expiringAt(clock.instant().plus(ttl));
        Path target = pathOf(entry.key());
        Path tmp = target.resolveSibling(target.getFileName() + "." + UUID.randomUUID() + ".tmp");
        try {
            Files.write(tmp, objectMapper.writeValueAsBytes(stored));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            delete(tmp);
            throw new CacheBackendException("Failed to store cache entry " + entry.key(), e);
        }
    }

    @Override
    public void invalidate(CacheKey key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        delete(pathOf(key));
    }

    @Override
    public void invalidateScope(ScopeId scope) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        int removed = 0;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + SUFFIX)) {
            for (Path path : stream) {
                Optional<CacheEntry> entry = read(path);
                if (entry.isPresent() && scope.equals(entry.get().scope())) {
                    delete(path);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new CacheBackendException("Failed to scan cache directory " + directory, e);
        }
        log.debug("Invalidated {} cache entries of {}", removed, scope);
    }

    private Optional<CacheEntry> read(Path path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(path);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new CacheBackendException("Failed to read cache file " + path, e);
        }
        try {
            return Optional.of(objectMapper.readValue(bytes, CacheEntry.class));
        } catch (IOException e) {
            log.warn("Discarding unreadable cache file {}", path, e);
            delete(path);
            return Optional.empty();
        }
    }

    private static void delete(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            throw new CacheBackendException("Failed to delete cache file " + path, e);
        }
    }

    private Path pathOf(CacheKey key) {
        return directory.resolve(key.getValue() + SUFFIX);
    }
}
