package com.libragraph.squash.types;

import java.util.Locale;

/**
 * Compression formats the library can route to a backend.
 * Each kind knows its on-disk magic bytes, extension, and valid level range.
 */
public enum CodecKind {
    BZIP2("bzip2", ".bz2", new byte[]{'B', 'Z', 'h'}, 1, 9, 9),
    GZIP("gzip", ".gz", new byte[]{0x1f, (byte) 0x8b}, 1, 9, 6),
    XZ("xz", ".xz", new byte[]{(byte) 0xfd, '7', 'z', 'X', 'Z', 0x00}, 0, 9, 6),
    ZSTD("zstd", ".zst", new byte[]{0x28, (byte) 0xb5, 0x2f, (byte) 0xfd}, 1, 19, 3);

    private final String label;
    private final String extension;
    private final byte[] magic;
    private final int minLevel;
    private final int maxLevel;
    private final int defaultLevel;

    CodecKind(String label, String extension, byte[] magic, int minLevel, int maxLevel, int defaultLevel) {
        this.label = label;
        this.extension = extension;
        this.magic = magic;
        this.minLevel = minLevel;
        this.maxLevel = maxLevel;
        this.defaultLevel = defaultLevel;
    }

    public String label() {
        return label;
    }

    public String extension() {
        return extension;
    }

    public int defaultLevel() {
        return defaultLevel;
    }

    /**
     * Returns the level unchanged if valid for this codec.
     *
     * @throws IllegalArgumentException if outside the codec's range
     */
    public int checkLevel(int level) {
        if (level < minLevel || level > maxLevel) {
            throw new IllegalArgumentException(
                    label + " compression level must be " + minLevel + "-" + maxLevel + ", got: " + level);
        }
        return level;
    }

    /** True if {@code header} starts with this codec's magic bytes. */
    public boolean matchesHeader(byte[] header) {
        if (header == null || header.length < magic.length) {
            return false;
        }
        for (int i = 0; i < magic.length; i++) {
            if (header[i] != magic[i]) {
                return false;
            }
        }
        return true;
    }

    /** True if {@code filename} carries this codec's extension (case-insensitive). */
    public boolean matchesFilename(String filename) {
        return filename != null && filename.toLowerCase(Locale.ROOT).endsWith(extension);
    }

    public static CodecKind fromLabel(String label) {
        for (CodecKind k : values()) {
            if (k.label.equalsIgnoreCase(label)) return k;
        }
        throw new IllegalArgumentException("Unknown codec: " + label);
    }
}
