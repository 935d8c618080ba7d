package com.kakeibo.ledger.store;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kakeibo.ledger.exception.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Stores each collection as an indented UTF-8 JSON array in its own file under a data directory.
 *
 * Writes go to a sibling temp file first and are moved over the target, so a failed save
 * never leaves a half-written document behind.
 */
public class JsonFileLedgerRepository implements LedgerRepository {

    private static final Logger logger = LoggerFactory.getLogger(JsonFileLedgerRepository.class);

    private final Path dataDir;
    private final ObjectMapper objectMapper;

    public JsonFileLedgerRepository(Path dataDir) {
        this(dataDir, new ObjectMapper());
    }

    public JsonFileLedgerRepository(Path dataDir, ObjectMapper objectMapper) {
        this.dataDir = dataDir;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        logger.info("Using JSON ledger storage at: {}", dataDir.toAbsolutePath());
    }

    @Override
    public <T> List<T> load(LedgerCollection<T> collection) {
        Path path = pathOf(collection);
        if (!Files.exists(path)) {
            logger.debug("No stored document for {} at {}, starting empty", collection, path);
            return new ArrayList<>();
        }

        JavaType listType = objectMapper.getTypeFactory()
                .constructCollectionType(List.class, collection.getRecordType());
        try {
            List<T> records = objectMapper.readValue(path.toFile(), listType);
            if (records == null) {
                return new ArrayList<>();
            }
            List<T> loaded = records.stream()
                    .filter(Objects::nonNull)
                    .collect(Collectors.toCollection(ArrayList::new));
            logger.debug("Loaded {} records for {}", loaded.size(), collection);
            return loaded;
        } catch (IOException e) {
            logger.warn("Stored document for {} at {} is unreadable, falling back to empty: {}",
                    collection, path, e.getMessage());
            return new ArrayList<>();
        }
    }

    @Override
    public <T> void save(LedgerCollection<T> collection, List<T> records) {
        Path path = pathOf(collection);
        Path tempPath = path.resolveSibling(collection.getFileName() + ".tmp");
        try {
            Files.createDirectories(dataDir);
            byte[] json = objectMapper.writeValueAsBytes(records);
            Files.write(tempPath, json);
            Files.move(tempPath, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            logger.debug("Saved {} records for {} ({} bytes)", records.size(), collection, json.length);
        } catch (IOException e) {
            logger.error("Failed to save {} to {}", collection, path, e);
            throw new PersistenceException("Failed to save " + collection + " to " + path, e);
        }
    }

    public Path pathOf(LedgerCollection<?> collection) {
        return dataDir.resolve(collection.getFileName());
    }
}
