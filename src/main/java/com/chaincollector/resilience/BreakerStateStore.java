package com.chaincollector.resilience;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Persists breaker state as one JSON file per breaker so that an OPEN circuit survives a
 * process restart.
 *
 * <p>Writes go to a temporary sibling file first and are then moved over the target, so a
 * reader never sees a half-written file. Persistence failures are logged and otherwise
 * ignored: the in-memory breaker stays authoritative.
 */
public class BreakerStateStore {

    private static final Logger log = LoggerFactory.getLogger(BreakerStateStore.class);

    private final Path directory;
    private final ObjectMapper objectMapper;

    public BreakerStateStore(Path directory, ObjectMapper objectMapper) {
        this.directory = directory;
        this.objectMapper = objectMapper;
    }

    public void save(BreakerSnapshot snapshot) {
        Path target = fileFor(snapshot.getName());
        try {
            Files.createDirectories(directory);
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), snapshot);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            log.warn("Failed to persist breaker state for '{}' to {}: {}", snapshot.getName(), target, e.getMessage());
        }
    }

    public Optional<BreakerSnapshot> load(String breakerName) {
        Path file = fileFor(breakerName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(file.toFile(), BreakerSnapshot.class));
        } catch (IOException e) {
            log.warn("Ignoring unreadable breaker state file {}: {}", file, e.getMessage());
            return Optional.empty();
        }
    }

    Path fileFor(String breakerName) {
        return directory.resolve(breakerName.replaceAll("[^A-Za-z0-9._-]", "_") + ".json");
    }
}
