package com.libragraph.squash.codecs.stream;

import com.libragraph.squash.codecs.api.BackendUnavailableException;
import com.libragraph.squash.codecs.api.CodecDescriptor;
import com.libragraph.squash.codecs.api.Parallelism;
import com.libragraph.squash.codecs.api.StreamDirection;
import com.libragraph.squash.codecs.inprocess.InProcessCodec;
import com.libragraph.squash.codecs.registry.BackendRegistry;
import com.libragraph.squash.codecs.registry.KnownTool;
import com.libragraph.squash.types.CodecKind;
import com.libragraph.squash.util.AtomicWriteFile;
import com.libragraph.squash.util.CpuTopology;
import org.jboss.logging.Logger;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Opens compression and decompression streams over whichever backend the
 * {@link BackendRegistry} picks.
 *
 * <p>External tools run as child processes with their stdin/stdout wired to the
 * returned stream; their own threading does the parallel work, sized from
 * {@link CpuTopology} and never above the core count. Streams are single-use and
 * must be closed, which reaps the tool on every path.
 */
public class CompressionService {

    private static final Logger log = Logger.getLogger(CompressionService.class);

    private final BackendRegistry registry;
    private final int maxWorkers;

    public CompressionService(BackendRegistry registry) {
        this(registry, CpuTopology.availableParallelism());
    }

    /**
     * @param maxWorkers upper bound on tool worker threads; capped again at the physical core count
     */
    public CompressionService(BackendRegistry registry, int maxWorkers) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1, got: " + maxWorkers);
        }
        this.maxWorkers = Math.min(maxWorkers, CpuTopology.availableParallelism());
    }

    public BackendRegistry registry() {
        return registry;
    }

    /** Upper bound on worker threads requested from any tool. */
    public int maxWorkers() {
        return maxWorkers;
    }

    public CompressingOutputStream openCompressor(CodecKind kind, Parallelism parallelism,
                                                  OutputStream sink) throws IOException {
        return openCompressor(kind, parallelism, kind.defaultLevel(), sink);
    }

    /**
     * Compression stream whose output goes to {@code sink}. The sink is flushed but
     * not closed when the returned stream closes.
     */
    public CompressingOutputStream openCompressor(CodecKind kind, Parallelism parallelism, int level,
                                                  OutputStream sink) throws IOException {
        Objects.requireNonNull(sink, "sink cannot be null");
        kind.checkLevel(level);
        CodecDescriptor backend = registry.resolve(kind, parallelism.wantParallel());

        if (backend.isInProcess()) {
            OutputStream encoder = inProcess(backend).encoder(Shields.noClose(sink), level);
            return new CompressingOutputStream(backend, encoder, null, null);
        }
        ToolProcess process = launch(backend, StreamDirection.COMPRESS, level, parallelism,
                ProcessBuilder.Redirect.PIPE, ProcessBuilder.Redirect.PIPE);
        process.copyStdoutTo(sink);
        return new CompressingOutputStream(backend, process.stdin(), process, null);
    }

    public CompressingOutputStream openCompressedFile(CodecKind kind, Parallelism parallelism,
                                                      Path target) throws IOException {
        return openCompressedFile(kind, parallelism, kind.defaultLevel(), target);
    }

    /**
     * Compression stream that writes a file artifact atomically: {@code target}
     * appears only once the stream is closed and the backend exited cleanly.
     * Any failure leaves {@code target} untouched.
     *
     * @throws BackendUnavailableException before anything is created on disk
     */
    public CompressingOutputStream openCompressedFile(CodecKind kind, Parallelism parallelism, int level,
                                                      Path target) throws IOException {
        Objects.requireNonNull(target, "target cannot be null");
        kind.checkLevel(level);
        CodecDescriptor backend = registry.resolve(kind, parallelism.wantParallel());

        AtomicWriteFile artifact = AtomicWriteFile.open(target);
        try {
            if (backend.isInProcess()) {
                OutputStream encoder = inProcess(backend).encoder(Shields.noClose(artifact), level);
                return new CompressingOutputStream(backend, encoder, null, artifact);
            }
            ToolProcess process = launch(backend, StreamDirection.COMPRESS, level, parallelism,
                    ProcessBuilder.Redirect.PIPE, ProcessBuilder.Redirect.to(artifact.tempPath().toFile()));
            return new CompressingOutputStream(backend, process.stdin(), process, artifact);
        } catch (IOException | RuntimeException e) {
            artifact.close();
            throw e;
        }
    }

    /**
     * Decompression stream over {@code source}. The source is not closed.
     */
    public DecompressingInputStream openDecompressor(CodecKind kind, Parallelism parallelism,
                                                     InputStream source) throws IOException {
        Objects.requireNonNull(source, "source cannot be null");
        CodecDescriptor backend = registry.resolve(kind, parallelism.wantParallel());

        if (backend.isInProcess()) {
            return new DecompressingInputStream(backend, inProcess(backend).decoder(Shields.noClose(source)), null);
        }
        ToolProcess process = launch(backend, StreamDirection.DECOMPRESS, 0, parallelism,
                ProcessBuilder.Redirect.PIPE, ProcessBuilder.Redirect.PIPE);
        process.copyIntoStdin(source);
        return new DecompressingInputStream(backend, process.stdout(), process);
    }

    /**
     * Decompression stream reading the compressed file at {@code source}.
     */
    public DecompressingInputStream openDecompressedFile(CodecKind kind, Parallelism parallelism,
                                                         Path source) throws IOException {
        Objects.requireNonNull(source, "source cannot be null");
        CodecDescriptor backend = registry.resolve(kind, parallelism.wantParallel());
        if (!Files.isRegularFile(source)) {
            throw new NoSuchFileException(source.toString());
        }

        if (backend.isInProcess()) {
            InputStream file = Files.newInputStream(source);
            try {
                return new DecompressingInputStream(backend, inProcess(backend).decoder(file), null);
            } catch (IOException | RuntimeException e) {
                file.close();
                throw e;
            }
        }
        ToolProcess process = launch(backend, StreamDirection.DECOMPRESS, 0, parallelism,
                ProcessBuilder.Redirect.from(source.toFile()), ProcessBuilder.Redirect.PIPE);
        return new DecompressingInputStream(backend, process.stdout(), process);
    }

    /**
     * Compresses a whole buffer at the codec's default level.
     */
    public byte[] compress(CodecKind kind, byte[] data, Parallelism parallelism) throws IOException {
        ByteArrayOutputStream sink = new ByteArrayOutputStream(Math.max(data.length / 3, 64));
        try (CompressingOutputStream out = openCompressor(kind, parallelism, sink)) {
            out.write(data);
        }
        return sink.toByteArray();
    }

    public byte[] decompress(CodecKind kind, byte[] data, Parallelism parallelism) throws IOException {
        try (DecompressingInputStream in = openDecompressor(kind, parallelism, new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    /**
     * Identifies a codec from leading bytes, falling back to the file extension.
     */
    public Optional<CodecKind> detect(byte[] header, String filename) {
        for (CodecKind kind : CodecKind.values()) {
            if (kind.matchesHeader(header)) return Optional.of(kind);
        }
        for (CodecKind kind : CodecKind.values()) {
            if (kind.matchesFilename(filename)) return Optional.of(kind);
        }
        return Optional.empty();
    }

    private ToolProcess launch(CodecDescriptor backend, StreamDirection direction, int level,
                               Parallelism parallelism, ProcessBuilder.Redirect input,
                               ProcessBuilder.Redirect output) throws IOException {
        KnownTool tool = KnownTool.forExecutable(backend.toolName())
                .orElseThrow(() -> new IllegalStateException("Unknown tool: " + backend.toolName()));
        int workers = parallelism.effectiveWorkers(maxWorkers);
        List<String> command = tool.command(backend.toolPath(), direction, level, workers);
        if (backend.supportsParallel(direction)) {
            log.debugf("%s %s with %d workers", backend.toolName(), direction, workers);
        }
        return ToolProcess.start(backend, direction, command, input, output);
    }

    private InProcessCodec inProcess(CodecDescriptor backend) {
        return registry.inProcessCodec(backend.codecKind())
                .orElseThrow(() -> new BackendUnavailableException(backend.codecKind()));
    }
}
