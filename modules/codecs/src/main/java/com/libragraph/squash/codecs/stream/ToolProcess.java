package com.libragraph.squash.codecs.stream;

import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.api.StreamDirection;
import org.jboss.logging.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One running compressor process plus the helper threads that keep its pipes moving.
 *
 * <p>stderr is always drained (and the first few KB kept for error messages) so
 * the tool can never block on a full stderr pipe. When the caller's endpoint is a
 * stream rather than a file, a copy thread moves bytes between that stream and the
 * process; the caller's thread only ever touches the other pipe.
 */
final class ToolProcess {

    private static final Logger log = Logger.getLogger(ToolProcess.class);

    private static final int STDERR_LIMIT = 8 * 1024;
    private static final int COPY_BUFFER = 8 * 1024;
    private static final AtomicInteger THREAD_IDS = new AtomicInteger();

    private final CodecDescriptor backend;
    private final StreamDirection direction;
    private final Process process;
    private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
    private final Thread stderrDrain;
    private Thread copier;
    private volatile IOException copyError;

    private ToolProcess(CodecDescriptor backend, StreamDirection direction, Process process) {
        this.backend = backend;
        this.direction = direction;
        this.process = process;
        this.stderrDrain = daemon("stderr", this::drainStderr);
        this.stderrDrain.start();
    }

    static ToolProcess start(CodecDescriptor backend, StreamDirection direction, List<String> command,
                             ProcessBuilder.Redirect input, ProcessBuilder.Redirect output) throws IOException {
        log.debugf("Launching %s", command);
        Process process = new ProcessBuilder(command)
                .redirectInput(input)
                .redirectOutput(output)
                .redirectError(ProcessBuilder.Redirect.PIPE)
                .start();
        return new ToolProcess(backend, direction, process);
    }

    CodecDescriptor backend() {
        return backend;
    }

    StreamDirection direction() {
        return direction;
    }

    OutputStream stdin() {
        return process.getOutputStream();
    }

    InputStream stdout() {
        return process.getInputStream();
    }

    boolean isAlive() {
        return process.isAlive();
    }

    /**
     * Copies the process's stdout into {@code sink} on a helper thread, flushing
     * the sink after each chunk.
     * If the sink fails the process is killed so it cannot block on a full pipe.
     */
    void copyStdoutTo(OutputStream sink) {
        copier = daemon("stdout", () -> {
            try (InputStream in = process.getInputStream()) {
                pump(in, sink);
            } catch (IOException e) {
                copyError = e;
                process.destroyForcibly();
            }
        });
        copier.start();
    }

    /**
     * Feeds {@code source} into the process's stdin on a helper thread, then closes stdin.
     * Each chunk is flushed into the pipe as soon as it is read, so a trickling
     * source reaches the tool without waiting for a full buffer.
     */
    void copyIntoStdin(InputStream source) {
        copier = daemon("stdin", () -> {
            try (OutputStream out = process.getOutputStream()) {
                pump(source, out);
            } catch (IOException e) {
                // also raised when the tool quits early; the exit status decides what is reported
                copyError = e;
            }
        });
        copier.start();
    }

    /**
     * Error raised by the copy thread, if any. Only meaningful after {@link #awaitExit()}.
     */
    IOException copyError() {
        return copyError;
    }

    /**
     * Waits for the copy thread and the process, and returns the exit status.
     * On interrupt the process is killed and reaped before the exception is thrown.
     */
    int awaitExit() throws IOException {
        try {
            if (copier != null) {
                copier.join();
            }
            int status = process.waitFor();
            stderrDrain.join();
            log.debugf("%s exited with status %d", backend.toolName(), status);
            return status;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroy();
            InterruptedIOException ioe = new InterruptedIOException(
                    "Interrupted waiting for " + backend.toolName());
            ioe.initCause(e);
            throw ioe;
        }
    }

    /**
     * Kills the process and waits until it is reaped.
     */
    void destroy() {
        process.destroyForcibly();
        boolean interrupted = false;
        while (true) {
            try {
                process.waitFor();
                break;
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        log.debugf("%s killed", backend.toolName());
    }

    private static void pump(InputStream in, OutputStream out) throws IOException {
        byte[] buf = new byte[COPY_BUFFER];
        int n;
        while ((n = in.read(buf)) != -1) {
            out.write(buf, 0, n);
            out.flush();
        }
    }

    String stderr() {
        synchronized (stderr) {
            return stderr.toString(StandardCharsets.UTF_8);
        }
    }

    private void drainStderr() {
        byte[] buf = new byte[1024];
        try (InputStream err = process.getErrorStream()) {
            int n;
            while ((n = err.read(buf)) != -1) {
                synchronized (stderr) {
                    int room = STDERR_LIMIT - stderr.size();
                    if (room > 0) {
                        stderr.write(buf, 0, Math.min(room, n));
                    }
                }
            }
        } catch (IOException e) {
            log.debugf("stderr of %s closed: %s", backend.toolName(), e.getMessage());
        }
    }

    private Thread daemon(String pipe, Runnable body) {
        Thread t = new Thread(body, "squash-" + backend.toolName() + "-" + pipe + "-" + THREAD_IDS.getAndIncrement());
        t.setDaemon(true);
        return t;
    }
}
