package com.libragraph.squash.chksum.api;

import com.libragraph.squash.types.DigestKind;
import com.libragraph.squash.util.DigestValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;

/**
 * Digests of one byte stream, exactly one per requested kind.
 */
public final class ChecksumResult {

    private final Map<DigestKind, DigestValue> values;

    public ChecksumResult(Map<DigestKind, DigestValue> values) {
        Map<DigestKind, DigestValue> copy = new EnumMap<>(DigestKind.class);
        copy.putAll(values);
        this.values = Collections.unmodifiableMap(copy);
    }

    /**
     * @throws NoSuchElementException if {@code kind} was not requested
     */
    public DigestValue get(DigestKind kind) {
        DigestValue value = values.get(kind);
        if (value == null) {
            throw new NoSuchElementException("Digest not computed: " + kind.label());
        }
        return value;
    }

    public String hex(DigestKind kind) {
        return get(kind).toHex();
    }

    public Set<DigestKind> kinds() {
        return values.keySet();
    }

    public Map<DigestKind, DigestValue> asMap() {
        return values;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ChecksumResult)) return false;
        return values.equals(((ChecksumResult) obj).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
