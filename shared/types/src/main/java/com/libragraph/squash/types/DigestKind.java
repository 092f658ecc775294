package com.libragraph.squash.types;

public enum DigestKind {
    MD5("md5", 16),
    SHA1("sha1", 20),
    SHA256("sha256", 32),
    SHA512("sha512", 64),
    SHA3_256("sha3_256", 32),
    SHA3_512("sha3_512", 64),
    BLAKE3("blake3", 32),
    WHIRLPOOL("whirlpool", 64),
    CRC32("crc32", 4),
    CRC32C("crc32c", 4),
    XXHASH32("xxhash32", 4);

    private final String label;
    private final int length;

    DigestKind(String label, int length) {
        this.label = label;
        this.length = length;
    }

    public String label() {
        return label;
    }

    /** Digest length in bytes. */
    public int length() {
        return length;
    }

    public static DigestKind fromLabel(String label) {
        for (DigestKind k : values()) {
            if (k.label.equalsIgnoreCase(label)) return k;
        }
        throw new IllegalArgumentException("Unknown digest kind: " + label);
    }
}
