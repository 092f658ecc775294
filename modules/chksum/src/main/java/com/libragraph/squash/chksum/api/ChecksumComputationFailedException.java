package com.libragraph.squash.chksum.api;

import com.libragraph.squash.types.DigestKind;

/**
 * Thrown when any digest of a multi-digest computation fails. No partial result
 * is returned; {@link #digestKind()} names the first kind that failed.
 */
public class ChecksumComputationFailedException extends RuntimeException {

    private final DigestKind digestKind;

    public ChecksumComputationFailedException(DigestKind digestKind, Throwable cause) {
        super("Checksum computation failed for " + digestKind.label()
                + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.digestKind = digestKind;
    }

    public DigestKind digestKind() {
        return digestKind;
    }
}
