package com.libragraph.squash.codecs.registry;

import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.api.ParallelDecode;
import com.libragraph.squash.codecs.api.StreamDirection;
import com.libragraph.squash.types.CodecKind;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.IntFunction;

/**
 * External compressors the registry knows how to drive, with their declared
 * capabilities and command-line conventions.
 *
 * <p>All tools read stdin and write stdout when given {@code -c} and no file operand.
 */
public enum KnownTool {
    LBZIP2("lbzip2", CodecKind.BZIP2, ParallelDecode.ANY_ARCHIVE, true, false,
            n -> List.of("-n", Integer.toString(n))),
    PBZIP2("pbzip2", CodecKind.BZIP2, ParallelDecode.OWN_ARCHIVES, true, false,
            n -> List.of("-p" + n)),
    BZIP2("bzip2", CodecKind.BZIP2, ParallelDecode.NONE, false, true, null),

    PIGZ("pigz", CodecKind.GZIP, ParallelDecode.NONE, true, false,
            n -> List.of("-p", Integer.toString(n))),
    GZIP("gzip", CodecKind.GZIP, ParallelDecode.NONE, false, true, null),

    XZ("xz", CodecKind.XZ, ParallelDecode.OWN_ARCHIVES, true, true,
            n -> List.of("-T" + n)),

    PZSTD("pzstd", CodecKind.ZSTD, ParallelDecode.OWN_ARCHIVES, true, false,
            n -> List.of("-p", Integer.toString(n))),
    ZSTD("zstd", CodecKind.ZSTD, ParallelDecode.NONE, true, true,
            n -> List.of("-T" + n));

    private final String executable;
    private final CodecKind codecKind;
    private final ParallelDecode parallelDecode;
    private final boolean parallelEncode;
    private final boolean canonical;
    private final IntFunction<List<String>> workerFlag;

    KnownTool(String executable, CodecKind codecKind, ParallelDecode parallelDecode,
              boolean parallelEncode, boolean canonical, IntFunction<List<String>> workerFlag) {
        this.executable = executable;
        this.codecKind = codecKind;
        this.parallelDecode = parallelDecode;
        this.parallelEncode = parallelEncode;
        this.canonical = canonical;
        this.workerFlag = workerFlag;
    }

    public String executable() {
        return executable;
    }

    public CodecKind codecKind() {
        return codecKind;
    }

    /** Builds the descriptor for this tool found at {@code path}. */
    public CodecDescriptor describe(Path path) {
        return new CodecDescriptor(codecKind, executable, path, parallelDecode, parallelEncode, canonical,
                CodecDescriptor.priorityFor(parallelDecode, parallelEncode));
    }

    /**
     * Full command line for one stream.
     *
     * @param level   compression level, ignored when decompressing
     * @param workers worker count, passed only when the tool can parallelize this direction
     */
    public List<String> command(Path path, StreamDirection direction, int level, int workers) {
        List<String> cmd = new ArrayList<>();
        cmd.add(path.toString());
        if (direction == StreamDirection.COMPRESS) {
            cmd.add("-c");
            cmd.add("-" + level);
        } else {
            cmd.add("-d");
            cmd.add("-c");
        }
        if (codecKind == CodecKind.ZSTD) {
            cmd.add("-q");
        }
        boolean parallel = direction == StreamDirection.COMPRESS
                ? parallelEncode
                : parallelDecode != ParallelDecode.NONE;
        if (parallel && workerFlag != null) {
            cmd.addAll(workerFlag.apply(workers));
        }
        return cmd;
    }

    public static List<KnownTool> forCodec(CodecKind kind) {
        List<KnownTool> tools = new ArrayList<>();
        for (KnownTool t : values()) {
            if (t.codecKind == kind) tools.add(t);
        }
        return tools;
    }

    public static Optional<KnownTool> forExecutable(String name) {
        for (KnownTool t : values()) {
            if (t.executable.equals(name)) return Optional.of(t);
        }
        return Optional.empty();
    }
}
