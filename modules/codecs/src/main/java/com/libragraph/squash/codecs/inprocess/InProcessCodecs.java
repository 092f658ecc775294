package com.libragraph.squash.codecs.inprocess;

import java.util.List;

public final class InProcessCodecs {

    private InProcessCodecs() {
    }

    /** Every in-process codec shipped with the library. */
    public static List<InProcessCodec> defaults() {
        return List.of(new GzipCodec(), new Bzip2Codec());
    }
}
