package com.libragraph.squash.codecs.api;

/**
 * How well a backend spreads decompression over several threads.
 */
public enum ParallelDecode {
    /** Always decodes on one thread. */
    NONE,
    /** Parallel only for archives that were themselves written in parallel blocks. */
    OWN_ARCHIVES,
    /** Parallel for any archive of its codec, including ones written serially. */
    ANY_ARCHIVE
}
