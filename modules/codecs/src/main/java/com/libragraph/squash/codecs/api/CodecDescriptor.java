package com.libragraph.squash.codecs.api;

import com.libragraph.squash.types.CodecKind;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * A probed compression backend: either an external tool found on the host or an
 * in-process implementation.
 *
 * @param codecKind              codec this backend reads and writes
 * @param toolName               executable name, or an {@code in-process:*} label
 * @param toolPath               resolved executable; null for in-process backends
 * @param parallelDecode         parallel decompression capability
 * @param supportsParallelEncode whether the backend can compress on several threads
 * @param canonical              whether this is the codec's reference single-threaded tool
 * @param priority               selection rank when parallelism is wanted, higher wins
 */
public record CodecDescriptor(
        CodecKind codecKind,
        String toolName,
        Path toolPath,
        ParallelDecode parallelDecode,
        boolean supportsParallelEncode,
        boolean canonical,
        int priority
) {
    public static final int PRIORITY_IN_PROCESS = 0;
    public static final int PRIORITY_SINGLE_THREADED = 10;
    public static final int PRIORITY_PARALLEL_ENCODE = 15;
    public static final int PRIORITY_PARALLEL_DECODE_OWN = 20;
    public static final int PRIORITY_PARALLEL_DECODE_ANY = 30;

    public CodecDescriptor {
        Objects.requireNonNull(codecKind, "codecKind cannot be null");
        Objects.requireNonNull(toolName, "toolName cannot be null");
        Objects.requireNonNull(parallelDecode, "parallelDecode cannot be null");
    }

    /**
     * Priority implied by a backend's capabilities.
     */
    public static int priorityFor(ParallelDecode decode, boolean parallelEncode) {
        return switch (decode) {
            case ANY_ARCHIVE -> PRIORITY_PARALLEL_DECODE_ANY;
            case OWN_ARCHIVES -> PRIORITY_PARALLEL_DECODE_OWN;
            case NONE -> parallelEncode ? PRIORITY_PARALLEL_ENCODE : PRIORITY_SINGLE_THREADED;
        };
    }

    public boolean supportsParallelDecode() {
        return parallelDecode != ParallelDecode.NONE;
    }

    public boolean isInProcess() {
        return toolPath == null;
    }

    /** True if neither direction can use more than one thread. */
    public boolean isSingleThreaded() {
        return !supportsParallelEncode && !supportsParallelDecode();
    }

    /** Whether a worker-count flag makes sense for the given direction. */
    public boolean supportsParallel(StreamDirection direction) {
        return direction == StreamDirection.COMPRESS ? supportsParallelEncode : supportsParallelDecode();
    }

    public Optional<Path> tool() {
        return Optional.ofNullable(toolPath);
    }

    @Override
    public String toString() {
        return isInProcess()
                ? codecKind.label() + "/" + toolName
                : codecKind.label() + "/" + toolName + " (" + toolPath + ")";
    }
}
