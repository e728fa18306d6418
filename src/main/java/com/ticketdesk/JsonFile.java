package com.ticketdesk;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A JSON document on local disk with one writer at a time. Writes go to a
 * temp file in the same directory and are renamed over the target, so a
 * concurrent reader sees either the old document or the new one.
 */
final class JsonFile {

    private final Path path;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    JsonFile(Path path, ObjectMapper mapper) {
        this.path = path.toAbsolutePath();
        this.mapper = mapper.copy().disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    Path path() {
        return path;
    }

    ObjectMapper mapper() {
        return mapper;
    }

    Optional<String> readRaw() throws IOException {
        try {
            return Optional.of(Files.readString(path));
        } catch (NoSuchFileException e) {
            return Optional.empty();
        }
    }

    <T> Optional<T> read(JavaType type) throws IOException {
        Optional<String> raw = readRaw();
        if (raw.isEmpty() || raw.get().isBlank()) return Optional.empty();
        return Optional.of(mapper.readValue(raw.get(), type));
    }

    void write(Object document) throws IOException {
        Path dir = path.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), document);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /** Runs a read-merge-write sequence while holding the writer lock. */
    <T> T locked(IoAction<T> body) throws IOException {
        lock.lock();
        try {
            return body.run();
        } finally {
            lock.unlock();
        }
    }

    @FunctionalInterface
    interface IoAction<T> {
        T run() throws IOException;
    }
}
