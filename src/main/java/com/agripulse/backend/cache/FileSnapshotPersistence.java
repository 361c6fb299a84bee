package com.agripulse.backend.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Keeps the cache in a single JSON file. Every write goes to a temp file next to
 * the target and is then moved over it, so a crash mid-write leaves either the
 * previous file or the new one, never a truncated one.
 */
@Slf4j
public class FileSnapshotPersistence implements SnapshotPersistence {

    private final Path file;
    private final ObjectMapper mapper;

    public FileSnapshotPersistence(Path file) {
        this.file = file.toAbsolutePath();
        this.mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    public Path file() {
        return file;
    }

    @Override
    public CacheSnapshot restore() {
        if (!Files.isRegularFile(file)) {
            log.info("📂 No cache file at {}, starting cold", file);
            return CacheSnapshot.empty();
        }
        try {
            CacheSnapshot snapshot = mapper.readValue(file.toFile(), CacheSnapshot.class);
            if (snapshot == null) {
                log.warn("⚠️ Cache file {} is empty, starting cold", file);
                return CacheSnapshot.empty();
            }
            if (snapshot.version() != CacheSnapshot.CURRENT_VERSION) {
                log.warn("⚠️ Cache file {} has version {} (expected {}), ignoring it",
                        file, snapshot.version(), CacheSnapshot.CURRENT_VERSION);
                return CacheSnapshot.empty();
            }
            log.info("✅ Cache loaded from {} ({} entries)", file, snapshot.entries().size());
            return snapshot;
        } catch (IOException | RuntimeException e) {
            log.warn("⚠️ Failed to load cache file {}: {}", file, e.getMessage());
            return CacheSnapshot.empty();
        }
    }

    @Override
    public synchronized void persist(CacheSnapshot snapshot) {
        Path tmp = null;
        try {
            Path dir = file.getParent();
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            move(tmp);
            log.debug("💾 Cache persisted to {} ({} entries)", file, snapshot.entries().size());
        } catch (IOException | RuntimeException e) {
            log.warn("⚠️ Failed to persist cache to {}: {}", file, e.getMessage());
        } finally {
            if (tmp != null) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException e) {
                    log.debug("Could not remove temp file {}", tmp, e);
                }
            }
        }
    }

    private void move(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
