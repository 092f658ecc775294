package com.libragraph.squash.chksum.engine;

import com.libragraph.squash.util.InvalidStateException;

import java.io.ByteArrayInputStream;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bytes to checksum. Files and byte arrays can be read by several tasks at once,
 * each through its own cursor; a plain stream can only be read once.
 */
public abstract class ChecksumSource {

    /**
     * Opens a fresh cursor at the start of the data.
     */
    public abstract InputStream open() throws IOException;

    /** True if {@link #open()} may be called more than once. */
    public abstract boolean reopenable();

    public static ChecksumSource of(Path file) {
        Objects.requireNonNull(file, "file cannot be null");
        return new ChecksumSource() {
            @Override
            public InputStream open() throws IOException {
                return Files.newInputStream(file);
            }

            @Override
            public boolean reopenable() {
                return true;
            }

            @Override
            public String toString() {
                return file.toString();
            }
        };
    }

    public static ChecksumSource of(byte[] data) {
        Objects.requireNonNull(data, "data cannot be null");
        return new ChecksumSource() {
            @Override
            public InputStream open() {
                return new ByteArrayInputStream(data);
            }

            @Override
            public boolean reopenable() {
                return true;
            }

            @Override
            public String toString() {
                return data.length + " bytes";
            }
        };
    }

    /**
     * Wraps a stream the caller owns. The engine reads it once and does not close it.
     */
    public static ChecksumSource of(InputStream stream) {
        Objects.requireNonNull(stream, "stream cannot be null");
        AtomicBoolean opened = new AtomicBoolean();
        return new ChecksumSource() {
            @Override
            public InputStream open() {
                if (!opened.compareAndSet(false, true)) {
                    throw new InvalidStateException("Stream source has already been read");
                }
                return new FilterInputStream(stream) {
                    @Override
                    public void close() {
                        // stream belongs to the caller
                    }
                };
            }

            @Override
            public boolean reopenable() {
                return false;
            }

            @Override
            public String toString() {
                return "stream";
            }
        };
    }
}
