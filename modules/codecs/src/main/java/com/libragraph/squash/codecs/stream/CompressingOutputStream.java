package com.libragraph.squash.codecs.stream;

import com.libragraph.squash.codecs.api.BackendProcessFailedException;
import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.api.StreamDirection;
import com.libragraph.squash.codecs.api.StreamHandle;
import com.libragraph.squash.codecs.api.StreamState;
import com.libragraph.squash.util.AtomicWriteFile;
import com.libragraph.squash.util.InvalidStateException;
import org.jboss.logging.Logger;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Optional;

/**
 * Compression handle: plain bytes written here come out compressed at the sink.
 *
 * <p>Writes block until the backend accepts them; bytes bound for a tool are
 * flushed into its pipe on every write. {@link #close()} flushes the backend,
 * waits for it to exit and checks its status; when the sink is an
 * {@link AtomicWriteFile} the file is committed only after a clean exit and
 * discarded on every failure path. {@link #abort()} gives up on the stream
 * instead, and so does closing after the artifact was discarded by hand.
 *
 * <pre>{@code
 * CompressingOutputStream out = service.openCompressedFile(kind, parallelism, target);
 * try {
 *     source.transferTo(out);
 *     out.close();
 * } catch (IOException | RuntimeException e) {
 *     out.abort();
 *     throw e;
 * }
 * }</pre>
 */
public final class CompressingOutputStream extends OutputStream implements StreamHandle {

    private static final Logger log = Logger.getLogger(CompressingOutputStream.class);

    private final CodecDescriptor backend;
    private final OutputStream input;
    private final ToolProcess process;
    private final AtomicWriteFile artifact;
    private StreamState state = StreamState.OPEN;
    private IOException writeError;

    /**
     * @param input    where plain bytes go: the tool's stdin or an in-process encoder
     * @param process  the running tool, or null for in-process backends
     * @param artifact file to commit on success, or null when writing to a caller's stream
     */
    CompressingOutputStream(CodecDescriptor backend, OutputStream input, ToolProcess process,
                            AtomicWriteFile artifact) {
        this.backend = backend;
        this.input = input;
        this.process = process;
        this.artifact = artifact;
    }

    @Override
    public StreamDirection direction() {
        return StreamDirection.COMPRESS;
    }

    @Override
    public CodecDescriptor backend() {
        return backend;
    }

    @Override
    public StreamState state() {
        return state;
    }

    /** The atomic file behind this stream, when it writes a file artifact. */
    public Optional<AtomicWriteFile> artifact() {
        return Optional.ofNullable(artifact);
    }

    @Override
    public void write(int b) throws IOException {
        requireOpen();
        try {
            input.write(b);
            flushToTool();
        } catch (IOException e) {
            writeError = e;
            throw e;
        }
    }

    @Override
    public void write(byte[] b, int off, int len) throws IOException {
        requireOpen();
        try {
            input.write(b, off, len);
            flushToTool();
        } catch (IOException e) {
            writeError = e;
            throw e;
        }
    }

    @Override
    public void flush() throws IOException {
        requireOpen();
        input.flush();
    }

    @Override
    public void close() throws IOException {
        if (state != StreamState.OPEN) {
            return;
        }
        if (artifact != null && artifact.state() != AtomicWriteFile.State.ACTIVE) {
            log.debugf("Artifact %s already %s, abandoning %s", artifact.targetPath(), artifact.state(),
                    backend.toolName());
            abort();
            return;
        }
        if (process == null) {
            closeInProcess();
        } else {
            closeProcess();
        }
    }

    /**
     * Abandons the stream: the tool is killed and reaped and the artifact, if any,
     * is discarded. Ends in {@link StreamState#FAILED}. A caller's sink may hold a
     * partial stream afterwards. No-op once the stream is no longer open.
     */
    public void abort() throws IOException {
        if (state != StreamState.OPEN) {
            return;
        }
        state = StreamState.FAILED;
        log.debugf("Aborting compression via %s", backend.toolName());
        try {
            if (process != null) {
                process.destroy();
            }
            try {
                input.close();
            } catch (IOException | RuntimeException e) {
                // expected once the tool is gone or the artifact was discarded
                log.debugf("Closing input of aborted %s: %s", backend.toolName(), e.getMessage());
            }
        } finally {
            if (artifact != null) {
                artifact.close();
            }
        }
    }

    private void closeProcess() throws IOException {
        IOException closeError = null;
        try {
            input.close();
        } catch (IOException e) {
            closeError = e;
        }

        int status;
        try {
            status = process.awaitExit();
        } catch (IOException e) {
            fail();
            throw e;
        }

        IOException ioError = firstNonNull(writeError, closeError, process.copyError());
        if (status != 0) {
            fail();
            log.warnf("%s exited with status %d while compressing", backend.toolName(), status);
            throw new BackendProcessFailedException(backend, StreamDirection.COMPRESS, status,
                    process.stderr(), ioError);
        }
        if (ioError != null) {
            fail();
            throw ioError;
        }
        finish();
    }

    private void closeInProcess() throws IOException {
        try {
            input.close();
        } catch (IOException | RuntimeException e) {
            fail();
            throw e;
        }
        if (writeError != null) {
            fail();
            throw writeError;
        }
        finish();
    }

    private void finish() throws IOException {
        if (artifact != null) {
            try {
                artifact.commit();
            } catch (IOException | RuntimeException e) {
                state = StreamState.FAILED;
                throw e;
            }
        }
        state = StreamState.CLOSED;
    }

    private void fail() throws IOException {
        state = StreamState.FAILED;
        if (artifact != null) {
            artifact.close();
        }
    }

    private void flushToTool() throws IOException {
        if (process != null) {
            input.flush();
        }
    }

    private void requireOpen() {
        if (state != StreamState.OPEN) {
            throw new InvalidStateException("Compression stream via " + backend.toolName() + " is " + state);
        }
    }

    private static IOException firstNonNull(IOException... errors) {
        for (IOException e : errors) {
            if (e != null) return e;
        }
        return null;
    }
}
