package com.libragraph.squash.codecs.api;

import java.io.Closeable;
import java.io.IOException;

/**
 * A compression or decompression stream bound to one backend.
 *
 * <p>Implementations are also an {@link java.io.OutputStream} (compress) or
 * {@link java.io.InputStream} (decompress). Handles are single-use and owned by
 * one caller; {@link #close()} always waits for and reaps the backend, even after
 * an earlier read or write error.
 */
public interface StreamHandle extends Closeable {

    StreamDirection direction();

    CodecDescriptor backend();

    StreamState state();

    /**
     * Finishes the stream and releases the backend.
     *
     * @throws BackendProcessFailedException if the backend exited with a failure status
     */
    @Override
    void close() throws IOException;
}
