package com.libragraph.squash.codecs.api;

import com.libragraph.squash.types.CodecKind;

/**
 * Thrown when no backend exists on this host for the requested codec.
 */
public class BackendUnavailableException extends RuntimeException {

    private final CodecKind codecKind;

    public BackendUnavailableException(CodecKind codecKind) {
        super("No backend available for codec: " + codecKind.label());
        this.codecKind = codecKind;
    }

    public CodecKind codecKind() {
        return codecKind;
    }
}
