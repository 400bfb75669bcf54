package com.example.procloner.service;

import com.example.procloner.model.CrawlState;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Reads and writes {@code session-state.json} inside a session's output root.
 */
@Component
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    public static final String FILE_NAME = "session-state.json";

    private final ObjectMapper objectMapper;

    public CheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Path outputRoot, CrawlState state) throws IOException {
        Files.createDirectories(outputRoot);
        Path target = outputRoot.resolve(FILE_NAME);
        Path tmp = outputRoot.resolve(FILE_NAME + ".tmp");
        // one writer per session at a time
        synchronized (state) {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), state);
            try {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        }
        log.debug("[SESSION] checkpoint written to {}", target);
    }

    /**
     * @return the stored state, or {@code null} when no checkpoint exists
     */
    public CrawlState read(Path outputRoot) throws IOException {
        Path file = outputRoot.resolve(FILE_NAME);
        if (!Files.isRegularFile(file)) {
            return null;
        }
        return objectMapper.readValue(file.toFile(), CrawlState.class);
    }
}
