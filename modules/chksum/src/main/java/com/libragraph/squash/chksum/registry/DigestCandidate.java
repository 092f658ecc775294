package com.libragraph.squash.chksum.registry;

import com.libragraph.squash.chksum.api.DigestDescriptor;
import com.libragraph.squash.chksum.api.Digester;
import com.libragraph.squash.chksum.api.ImplementationSource;
import com.libragraph.squash.types.DigestKind;
import org.apache.commons.codec.digest.PureJavaCrc32;
import org.apache.commons.codec.digest.PureJavaCrc32C;
import org.apache.commons.codec.digest.XXHash32;

import java.util.List;
import java.util.function.Supplier;
import java.util.zip.CRC32;
import java.util.zip.CRC32C;

/**
 * One possible implementation of a digest kind. It is usable if its factory
 * produces a digester without throwing.
 */
public record DigestCandidate(
        DigestKind digestKind,
        ImplementationSource source,
        String implementationName,
        Supplier<Digester> factory
) {

    /**
     * Native implementations run in parallel freely; pure fallbacks share one thread.
     */
    public DigestDescriptor toDescriptor() {
        return new DigestDescriptor(digestKind, source, source != ImplementationSource.PURE_FALLBACK,
                implementationName, factory);
    }

    /**
     * Every implementation known to the library, in no particular order.
     */
    public static List<DigestCandidate> defaults() {
        return List.of(
                jca(DigestKind.MD5, ImplementationSource.NATIVE_ACCELERATED, "MD5"),
                jca(DigestKind.SHA1, ImplementationSource.NATIVE_ACCELERATED, "SHA-1"),
                jca(DigestKind.SHA256, ImplementationSource.NATIVE_ACCELERATED, "SHA-256"),
                jca(DigestKind.SHA512, ImplementationSource.NATIVE_ACCELERATED, "SHA-512"),
                jca(DigestKind.SHA3_256, ImplementationSource.NATIVE_STANDARD, "SHA3-256"),
                jca(DigestKind.SHA3_512, ImplementationSource.NATIVE_STANDARD, "SHA3-512"),
                jca(DigestKind.WHIRLPOOL, ImplementationSource.NATIVE_STANDARD, "WHIRLPOOL"),
                new DigestCandidate(DigestKind.BLAKE3, ImplementationSource.PURE_FALLBACK,
                        "commons-codec Blake3", Digesters::blake3),
                new DigestCandidate(DigestKind.CRC32, ImplementationSource.NATIVE_ACCELERATED,
                        "java.util.zip.CRC32", () -> Digesters.checksum(CRC32::new)),
                new DigestCandidate(DigestKind.CRC32, ImplementationSource.PURE_FALLBACK,
                        "commons-codec PureJavaCrc32", () -> Digesters.checksum(PureJavaCrc32::new)),
                new DigestCandidate(DigestKind.CRC32C, ImplementationSource.NATIVE_ACCELERATED,
                        "java.util.zip.CRC32C", () -> Digesters.checksum(CRC32C::new)),
                new DigestCandidate(DigestKind.CRC32C, ImplementationSource.PURE_FALLBACK,
                        "commons-codec PureJavaCrc32C", () -> Digesters.checksum(PureJavaCrc32C::new)),
                new DigestCandidate(DigestKind.XXHASH32, ImplementationSource.PURE_FALLBACK,
                        "commons-codec XXHash32", () -> Digesters.checksum(XXHash32::new))
        );
    }

    private static DigestCandidate jca(DigestKind kind, ImplementationSource source, String algorithm) {
        return new DigestCandidate(kind, source, "JCA " + algorithm, () -> Digesters.messageDigest(kind, algorithm));
    }
}
