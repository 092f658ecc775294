package com.libragraph.squash.chksum.api;

import com.libragraph.squash.util.DigestValue;

/**
 * Incremental digest state. Thread-confined: one digester per task.
 */
public interface Digester {

    void update(byte[] buf, int off, int len);

    /**
     * Finishes the computation. The digester must not be updated afterwards.
     */
    DigestValue digest();
}
