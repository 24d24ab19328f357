package com.labsweep.sequence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes UTF-8 sequence files. Relative names resolve against the sequence directory;
 * absolute paths are used as given.
 */
public final class SequenceFileLoader {

    private static final Logger log = LoggerFactory.getLogger(SequenceFileLoader.class);

    private final SequenceSerializer serializer;
    private final Path sequenceDir;

    /**
     * @param serializer  format and parameter validation; must not be null
     * @param sequenceDir directory for relative file names (e.g. sequences/); null = working directory
     */
    public SequenceFileLoader(SequenceSerializer serializer, Path sequenceDir) {
        this.serializer = Objects.requireNonNull(serializer, "serializer");
        this.sequenceDir = sequenceDir;
    }

    public Path resolve(String fileName) {
        Path path = Path.of(fileName);
        if (path.isAbsolute() || sequenceDir == null) {
            return path;
        }
        return sequenceDir.resolve(path);
    }

    public void load(SequenceStore store, String fileName, boolean append) {
        load(store, resolve(fileName), append);
    }

    /**
     * Loads {@code file} into {@code store}; on any failure, including a read error, the store is unchanged.
     *
     * @throws UncheckedIOException when the file cannot be read
     */
    public void load(SequenceStore store, Path file, boolean append) {
        String text;
        try {
            text = Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to read sequence file {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to read sequence file " + file, e);
        }
        serializer.load(store, text, append);
        log.info("Sequence file loaded | file={} | nodes={} | append={}", file, store.size(), append);
    }

    public Path save(SequenceStore store, String fileName) {
        Path file = resolve(fileName);
        save(store, file);
        return file;
    }

    /**
     * Writes {@code store} to {@code file}, creating parent directories as needed.
     *
     * @throws UncheckedIOException when the file cannot be written
     */
    public void save(SequenceStore store, Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, serializer.save(store), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Failed to write sequence file {}: {}", file, e.getMessage());
            throw new UncheckedIOException("Failed to write sequence file " + file, e);
        }
        log.info("Sequence file saved | file={} | nodes={}", file, store.size());
    }
}
