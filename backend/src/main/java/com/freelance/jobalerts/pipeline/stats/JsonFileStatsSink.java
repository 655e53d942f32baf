package com.freelance.jobalerts.pipeline.stats;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.freelance.jobalerts.config.AlertsProperties;
import com.freelance.jobalerts.pipeline.model.CycleStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes the last cycle snapshot to a JSON file through a temp file and a rename, so readers
 * never observe a half-written document. Disabled when no path is configured.
 */
@Component
public class JsonFileStatsSink implements StatsSink {
    private static final Logger log = LoggerFactory.getLogger(JsonFileStatsSink.class);

    private final ObjectMapper objectMapper;
    private final AlertsProperties properties;

    public JsonFileStatsSink(ObjectMapper objectMapper, AlertsProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    @Override
    public void publish(CycleStats stats) {
        String filePath = properties.getStats().getFilePath();
        if (filePath.isEmpty()) {
            return;
        }
        Path target = Path.of(filePath).toAbsolutePath();
        try {
            Path directory = target.getParent();
            if (directory != null) {
                Files.createDirectories(directory);
            }
            Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
            try {
                objectMapper.writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), stats);
                move(temp, target);
            } finally {
                Files.deleteIfExists(temp);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write stats file " + target, e);
        }
        log.debug("Wrote cycle stats to {}", target);
    }

    private void move(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
