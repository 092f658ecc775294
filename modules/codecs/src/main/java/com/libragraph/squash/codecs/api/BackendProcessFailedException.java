package com.libragraph.squash.codecs.api;

import java.util.Locale;

/**
 * Thrown when a compression backend exits with a failure status, or when the
 * bytes could not be moved to or from it. Not retried automatically.
 */
public class BackendProcessFailedException extends RuntimeException {

    private final CodecDescriptor backend;
    private final StreamDirection direction;
    private final int exitStatus;

    public BackendProcessFailedException(CodecDescriptor backend, StreamDirection direction,
                                         int exitStatus, String stderr) {
        this(backend, direction, exitStatus, stderr, null);
    }

    public BackendProcessFailedException(CodecDescriptor backend, StreamDirection direction,
                                         int exitStatus, String stderr, Throwable cause) {
        super(message(backend, direction, exitStatus, stderr), cause);
        this.backend = backend;
        this.direction = direction;
        this.exitStatus = exitStatus;
    }

    public CodecDescriptor backend() {
        return backend;
    }

    public StreamDirection direction() {
        return direction;
    }

    /** Process exit status, or -1 when the failure happened without an exit status (in-process). */
    public int exitStatus() {
        return exitStatus;
    }

    private static String message(CodecDescriptor backend, StreamDirection direction, int exitStatus, String stderr) {
        String msg = backend.toolName() + " failed to " + direction.name().toLowerCase(Locale.ROOT)
                + " " + backend.codecKind().label() + " (exit status " + exitStatus + ")";
        if (stderr != null && !stderr.isBlank()) {
            msg += ": " + stderr.strip();
        }
        return msg;
    }
}
