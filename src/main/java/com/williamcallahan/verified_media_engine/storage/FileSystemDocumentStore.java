package com.williamcallahan.verified_media_engine.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores each document as {@code <key>.json} under a base directory
 * - Writes go to a temp file first and are moved into place
 * - Keys are restricted to letters, digits, dash, underscore and dot
 */
public class FileSystemDocumentStore implements DocumentStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemDocumentStore.class);
    private static final String SUFFIX = ".json";
    private static final Pattern VALID_KEY = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path baseDir;

    public FileSystemDocumentStore(Path baseDir) {
        this.baseDir = baseDir;
        try {
            Files.createDirectories(baseDir);
        } catch (IOException e) {
            throw new DocumentStoreException("Cannot create document directory " + baseDir, e);
        }
        logger.info("Filesystem document store ready at {}", baseDir.toAbsolutePath());
    }

    @Override
    public Optional<String> get(String key) {
        Path file = resolve(key);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to read document " + key, e);
        }
    }

    @Override
    public void set(String key, String json) {
        Path target = resolve(key);
        Path temp = null;
        try {
            temp = Files.createTempFile(baseDir, key + "-", ".tmp");
            Files.writeString(temp, json, StandardCharsets.UTF_8);
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new DocumentStoreException("Failed to write document " + key, e);
        }
    }

    @Override
    public List<String> list() {
        List<String> keys = new ArrayList<>();
        try (Stream<Path> files = Files.list(baseDir)) {
            files.map(path -> path.getFileName().toString())
                .filter(name -> name.endsWith(SUFFIX))
                .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                .forEach(keys::add);
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to list documents in " + baseDir, e);
        }
        return keys;
    }

    @Override
    public void delete(String key) {
        try {
            Files.deleteIfExists(resolve(key));
        } catch (IOException e) {
            throw new DocumentStoreException("Failed to delete document " + key, e);
        }
    }

    private Path resolve(String key) {
        if (key == null || !VALID_KEY.matcher(key).matches()) {
            throw new DocumentStoreException("Invalid document key: " + key);
        }
        return baseDir.resolve(key + SUFFIX);
    }

    private void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException cleanupFailure) {
            logger.warn("Could not remove temp file {}: {}", temp, cleanupFailure.getMessage());
        }
    }
}
