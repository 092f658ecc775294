package com.libragraph.squash.util;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Computed digest bytes of any length.
 * Immutable value object that can be used as a map key.
 */
public record DigestValue(byte[] bytes) {
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public DigestValue {
        Objects.requireNonNull(bytes, "Digest bytes cannot be null");
        if (bytes.length == 0) {
            throw new IllegalArgumentException("Digest must not be empty");
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates a DigestValue from an even-length hex string.
     */
    public static DigestValue fromHex(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        try {
            return new DigestValue(HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    /**
     * Big-endian encoding of a 32-bit checksum value (CRC32, xxHash32).
     */
    public static DigestValue ofChecksum(long value) {
        return new DigestValue(new byte[]{
                (byte) (value >>> 24),
                (byte) (value >>> 16),
                (byte) (value >>> 8),
                (byte) value
        });
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    public int length() {
        return bytes.length;
    }

    /**
     * Returns lowercase hex representation.
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DigestValue)) return false;
        return Arrays.equals(bytes, ((DigestValue) obj).bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }
}
