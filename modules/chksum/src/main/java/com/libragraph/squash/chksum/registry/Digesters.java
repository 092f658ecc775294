package com.libragraph.squash.chksum.registry;

import com.libragraph.squash.chksum.api.Digester;
import com.libragraph.squash.chksum.api.UnsupportedDigestException;
import com.libragraph.squash.types.DigestKind;
import com.libragraph.squash.util.DigestValue;
import org.apache.commons.codec.digest.Blake3;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.function.Supplier;
import java.util.zip.Checksum;

/**
 * Adapters from the various digest APIs to {@link Digester}.
 */
final class Digesters {

    private Digesters() {
    }

    /**
     * JCA digest from whichever installed provider offers {@code algorithm}.
     *
     * @throws UnsupportedDigestException if no provider does
     */
    static Digester messageDigest(DigestKind kind, String algorithm) {
        MessageDigest md;
        try {
            md = MessageDigest.getInstance(algorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new UnsupportedDigestException(kind, e);
        }
        return new Digester() {
            @Override
            public void update(byte[] buf, int off, int len) {
                md.update(buf, off, len);
            }

            @Override
            public DigestValue digest() {
                return new DigestValue(md.digest());
            }
        };
    }

    /** 32-bit checksum, reported big-endian. */
    static Digester checksum(Supplier<Checksum> factory) {
        Checksum checksum = factory.get();
        return new Digester() {
            @Override
            public void update(byte[] buf, int off, int len) {
                checksum.update(buf, off, len);
            }

            @Override
            public DigestValue digest() {
                return DigestValue.ofChecksum(checksum.getValue());
            }
        };
    }

    static Digester blake3() {
        Blake3 hasher = Blake3.initHash();
        return new Digester() {
            @Override
            public void update(byte[] buf, int off, int len) {
                hasher.update(buf, off, len);
            }

            @Override
            public DigestValue digest() {
                return new DigestValue(hasher.doFinalize(DigestKind.BLAKE3.length()));
            }
        };
    }
}
