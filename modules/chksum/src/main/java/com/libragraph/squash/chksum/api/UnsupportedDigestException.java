package com.libragraph.squash.chksum.api;

import com.libragraph.squash.types.DigestKind;

/**
 * Thrown when no implementation of a digest kind is available in this JVM.
 */
public class UnsupportedDigestException extends RuntimeException {

    private final DigestKind digestKind;

    public UnsupportedDigestException(DigestKind digestKind) {
        this(digestKind, null);
    }

    public UnsupportedDigestException(DigestKind digestKind, Throwable cause) {
        super("No implementation available for digest: " + digestKind.label(), cause);
        this.digestKind = digestKind;
    }

    public DigestKind digestKind() {
        return digestKind;
    }
}
