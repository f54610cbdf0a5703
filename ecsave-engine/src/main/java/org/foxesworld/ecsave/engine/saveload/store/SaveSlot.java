package org.foxesworld.ecsave.engine.saveload.store;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.foxesworld.ecsave.core.io.ByteCodec;
import org.foxesworld.ecsave.engine.saveload.SaveDocument;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A single save file on disk.
 */
public final class SaveSlot {
    private static final Logger log = LogManager.getLogger(SaveSlot.class);

    private final Path file;
    private final ByteCodec<SaveDocument> format;

    public SaveSlot(Path file, ByteCodec<SaveDocument> format) {
        this.file = Objects.requireNonNull(file, "file");
        this.format = Objects.requireNonNull(format, "format");
    }

    public Path file() {
        return file;
    }

    public boolean exists() {
        return Files.isRegularFile(file);
    }

    /** Replaces the previous save; a crash mid-write leaves the old file intact. */
    public void write(SaveDocument document) throws IOException {
        format.encode(document, file);
        log.info("Saved {} records to {}", document.recordCount(), file);
    }

    public SaveDocument read() throws IOException {
        SaveDocument doc = format.decode(file);
        log.info("Read {} records from {}", doc.recordCount(), file);
        return doc;
    }

    /** @return true if a file was removed */
    public boolean delete() throws IOException {
        boolean removed = Files.deleteIfExists(file);
        if (removed) log.info("Deleted save {}", file);
        return removed;
    }
}
