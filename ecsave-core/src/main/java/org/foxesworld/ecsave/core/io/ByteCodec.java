package org.foxesworld.ecsave.core.io;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Abstract base for converting objects of type T to bytes and back.
 * Provides overloads for byte arrays, streams and paths.
 * <p>
 * - All external inputs are checked for null.
 * - Exceptions are logged and rethrown.
 * - Streams opened here are closed here.
 * - Path writes go through a sibling temp file and a move, so a reader never sees half a file.
 */
public abstract class ByteCodec<T> {
    private static final Logger logger = LoggerFactory.getLogger(ByteCodec.class);

    /**
     * Decode the given byte array into an object of type T.
     * @param data never null
     * @return decoded object
     * @throws IOException on malformed input
     */
    protected abstract T decodeBytes(byte[] data) throws IOException;

    /**
     * Encode the value into a byte array.
     * @param value never null
     * @throws IOException when the value cannot be represented
     */
    protected abstract byte[] encodeBytes(T value) throws IOException;

    /**
     * Decode from byte array.
     */
    public T decode(byte[] data) throws IOException {
        Objects.requireNonNull(data, "Data byte array cannot be null");
        try {
            return decodeBytes(data);
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to decode from byte array ({} bytes): {}", data.length, ex.getMessage(), ex);
            throw ex;
        }
    }

    /**
     * Decode from InputStream. Stream will be closed automatically.
     */
    public T decode(InputStream input) throws IOException {
        Objects.requireNonNull(input, "InputStream cannot be null");
        byte[] data;
        try (InputStream in = input) {
            data = in.readAllBytes();
        } catch (IOException ex) {
            logger.error("Failed to read InputStream: {}", ex.getMessage(), ex);
            throw ex;
        }
        return decode(data);
    }

    /**
     * Decode from Path. Path must exist and be readable.
     */
    public T decode(Path path) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        if (!Files.exists(path)) {
            logger.error("Path does not exist: {}", path);
            throw new FileNotFoundException("Path does not exist: " + path);
        }
        if (!Files.isReadable(path)) {
            logger.error("Path is not readable: {}", path);
            throw new IOException("Path is not readable: " + path);
        }
        return decode(Files.newInputStream(path));
    }

    /**
     * Encode to byte array.
     */
    public byte[] encode(T value) throws IOException {
        Objects.requireNonNull(value, "Value cannot be null");
        try {
            return encodeBytes(value);
        } catch (IOException | RuntimeException ex) {
            logger.error("Failed to encode {}: {}", value.getClass().getSimpleName(), ex.getMessage(), ex);
            throw ex;
        }
    }

    /**
     * Encode to OutputStream. The stream is flushed but left open.
     */
    public void encode(T value, OutputStream output) throws IOException {
        Objects.requireNonNull(output, "OutputStream cannot be null");
        byte[] data = encode(value);
        output.write(data);
        output.flush();
    }

    /**
     * Encode to Path, replacing any existing file. Parent directories are created.
     */
    public void encode(T value, Path path) throws IOException {
        Objects.requireNonNull(path, "Path cannot be null");
        byte[] data = encode(value);

        Path abs = path.toAbsolutePath();
        Path dir = abs.getParent();
        if (dir != null) Files.createDirectories(dir);

        Path tmp = abs.resolveSibling(abs.getFileName() + ".tmp");
        try {
            Files.write(tmp, data);
            Files.move(tmp, abs, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            logger.error("Failed to write {} ({} bytes): {}", abs, data.length, ex.getMessage(), ex);
            Files.deleteIfExists(tmp);
            throw ex;
        }
    }
}
