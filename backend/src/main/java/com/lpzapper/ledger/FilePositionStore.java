package com.lpzapper.ledger;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * JSON array file store. Writes go to a temp file in the same directory which is then moved over the target,
 * so a crash mid-write leaves the previous file intact. A missing or blank file is an empty ledger; unparseable
 * content is an error and is never overwritten implicitly.
 */
@Slf4j
public class FilePositionStore implements PositionStore {

    private static final TypeReference<List<Position>> POSITIONS = new TypeReference<>() {};

    private final Path file;
    private final ObjectMapper objectMapper;

    public FilePositionStore(Path file, ObjectMapper objectMapper) {
        this.file = file.toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy()
                .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<Position> load() {
        if (!Files.exists(file)) {
            return List.of();
        }
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new LedgerPersistenceException("Cannot read ledger file " + file, e);
        }
        if (content.isBlank()) {
            return List.of();
        }
        try {
            List<Position> positions = objectMapper.readValue(content, POSITIONS);
            return positions != null ? positions : List.of();
        } catch (JsonProcessingException e) {
            throw new LedgerPersistenceException("Ledger file " + file + " is not valid JSON", e);
        }
    }

    @Override
    public void save(List<Position> positions) {
        Path tmp = null;
        try {
            Path dir = file.getParent();
            if (dir != null) {
                Files.createDirectories(dir);
            }
            tmp = Files.createTempFile(dir, file.getFileName().toString(), ".tmp");
            Files.writeString(tmp, objectMapper.writeValueAsString(positions), StandardCharsets.UTF_8);
            try {
                Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved {} positions to {}", positions.size(), file);
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new LedgerPersistenceException("Cannot write ledger file " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not delete temp ledger file {}: {}", tmp, e.getMessage());
        }
    }
}
