package com.libragraph.squash.chksum.api;

/**
 * Where a digest implementation comes from, best first.
 */
public enum ImplementationSource {
    /** JDK implementation backed by CPU intrinsics. */
    NATIVE_ACCELERATED,
    /** JDK or installed JCA provider, no intrinsics. */
    NATIVE_STANDARD,
    /** Bundled pure-Java implementation. */
    PURE_FALLBACK;

    /** True if this source should be picked over {@code other}. */
    public boolean preferredOver(ImplementationSource other) {
        return ordinal() < other.ordinal();
    }
}
