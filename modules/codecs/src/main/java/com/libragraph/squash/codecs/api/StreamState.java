package com.libragraph.squash.codecs.api;

/**
 * Lifecycle of a {@link StreamHandle}. A handle leaves OPEN exactly once.
 */
public enum StreamState {
    OPEN,
    /** Backend finished cleanly, or the caller abandoned a decompressor early. */
    CLOSED,
    /** Backend exited non-zero or the pipe copy failed. */
    FAILED
}
