package com.libragraph.squash.codecs.stream;

import com.libragraph.squash.codecs.api.BackendProcessFailedException;
import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.api.StreamDirection;
import com.libragraph.squash.codecs.api.StreamHandle;
import com.libragraph.squash.codecs.api.StreamState;
import com.libragraph.squash.util.InvalidStateException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.InputStream;

/**
 * Decompression handle: reads return the plain bytes of a compressed source.
 *
 * <p>Reads block until the backend produces data. Closing after end of stream
 * waits for the backend and checks its exit status. Closing earlier abandons the
 * stream: the tool is killed and reaped and no error is raised.
 */
public final class DecompressingInputStream extends InputStream implements StreamHandle {

    private static final Logger log = Logger.getLogger(DecompressingInputStream.class);

    private final CodecDescriptor backend;
    private final InputStream output;
    private final ToolProcess process;
    private StreamState state = StreamState.OPEN;
    private boolean eof;

    /**
     * @param output  where plain bytes come from: the tool's stdout or an in-process decoder
     * @param process the running tool, or null for in-process backends
     */
    DecompressingInputStream(CodecDescriptor backend, InputStream output, ToolProcess process) {
        this.backend = backend;
        this.output = output;
        this.process = process;
    }

    @Override
    public StreamDirection direction() {
        return StreamDirection.DECOMPRESS;
    }

    @Override
    public CodecDescriptor backend() {
        return backend;
    }

    @Override
    public StreamState state() {
        return state;
    }

    @Override
    public int read() throws IOException {
        requireOpen();
        int b = output.read();
        if (b == -1) eof = true;
        return b;
    }

    @Override
    public int read(byte[] b, int off, int len) throws IOException {
        requireOpen();
        int n = output.read(b, off, len);
        if (n == -1) eof = true;
        return n;
    }

    @Override
    public int available() throws IOException {
        requireOpen();
        return output.available();
    }

    @Override
    public void close() throws IOException {
        if (state != StreamState.OPEN) {
            return;
        }
        if (process == null) {
            state = StreamState.CLOSED;
            output.close();
            return;
        }

        if (!eof) {
            eof = reachedEnd();
        }
        if (!eof) {
            log.debugf("Abandoning %s before end of stream", backend.toolName());
            state = StreamState.CLOSED;
            try {
                output.close();
            } finally {
                process.destroy();
            }
            return;
        }

        output.close();
        int status;
        try {
            status = process.awaitExit();
        } catch (IOException e) {
            state = StreamState.FAILED;
            throw e;
        }
        if (status != 0) {
            state = StreamState.FAILED;
            log.warnf("%s exited with status %d while decompressing", backend.toolName(), status);
            throw new BackendProcessFailedException(backend, StreamDirection.DECOMPRESS, status,
                    process.stderr(), process.copyError());
        }
        if (process.copyError() != null) {
            state = StreamState.FAILED;
            throw process.copyError();
        }
        state = StreamState.CLOSED;
    }

    /**
     * The caller may have consumed every byte without seeing -1; one more read tells.
     * Only read when it cannot block: the tool has exited or output is already waiting.
     * A live tool with nothing buffered may be stalled on its own input.
     */
    private boolean reachedEnd() {
        try {
            if (process.isAlive() && output.available() == 0) {
                return false;
            }
            return output.read() == -1;
        } catch (IOException e) {
            log.debugf("End-of-stream check on %s failed: %s", backend.toolName(), e.getMessage());
            return false;
        }
    }

    private void requireOpen() {
        if (state != StreamState.OPEN) {
            throw new InvalidStateException("Decompression stream via " + backend.toolName() + " is " + state);
        }
    }
}
