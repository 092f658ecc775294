package com.libragraph.squash.chksum.engine;

import com.libragraph.squash.chksum.api.ChecksumComputationFailedException;
import com.libragraph.squash.chksum.api.ChecksumResult;
import com.libragraph.squash.chksum.api.Digester;
import com.libragraph.squash.chksum.api.ImplementationSource;
import com.libragraph.squash.chksum.api.UnsupportedDigestException;
import com.libragraph.squash.chksum.registry.DigestCandidate;
import com.libragraph.squash.chksum.registry.DigestRegistry;
import com.libragraph.squash.types.DigestKind;
import com.libragraph.squash.util.DigestValue;
import com.libragraph.squash.util.InvalidStateException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChecksumEngineTest {

    @TempDir
    static Path tmp;

    private static Path tenMegabytes;
    private static byte[] smallData;

    private final Map<DigestKind, Set<String>> threads = new ConcurrentHashMap<>();
    private final List<ChecksumEngine> engines = new ArrayList<>();

    @BeforeAll
    static void createData() throws IOException {
        byte[] data = new byte[10 * 1024 * 1024];
        new Random(42).nextBytes(data);
        tenMegabytes = Files.write(tmp.resolve("ten-mb.bin"), data);
        smallData = "The quick brown fox jumps over the lazy dog".getBytes();
    }

    @AfterEach
    void closeEngines() {
        engines.forEach(ChecksumEngine::close);
    }

    private ChecksumEngine engine(DigestRegistry registry, int cores) {
        ChecksumEngine engine = new ChecksumEngine(registry, cores, 8192);
        engines.add(engine);
        return engine;
    }

    /** Default candidates, with every digester recording the threads it runs on. */
    private DigestRegistry recordingRegistry() {
        List<DigestCandidate> candidates = new ArrayList<>();
        for (DigestCandidate c : DigestCandidate.defaults()) {
            candidates.add(new DigestCandidate(c.digestKind(), c.source(), c.implementationName(),
                    () -> recording(c.digestKind(), c.factory().get())));
        }
        return new DigestRegistry(candidates);
    }

    private Digester recording(DigestKind kind, Digester delegate) {
        return new Digester() {
            @Override
            public void update(byte[] buf, int off, int len) {
                threads.computeIfAbsent(kind, k -> ConcurrentHashMap.newKeySet()).add(Thread.currentThread().getName());
                delegate.update(buf, off, len);
            }

            @Override
            public DigestValue digest() {
                return delegate.digest();
            }
        };
    }

    private static DigestCandidate failingAfter(DigestKind kind, int bytes) {
        return new DigestCandidate(kind, ImplementationSource.NATIVE_ACCELERATED, "failing", () -> new Digester() {
            private int seen;

            @Override
            public void update(byte[] buf, int off, int len) {
                seen += len;
                if (seen > bytes) {
                    throw new IllegalStateException("digester blew up");
                }
            }

            @Override
            public DigestValue digest() {
                return DigestValue.ofChecksum(seen);
            }
        });
    }

    @Test
    void shouldGiveSameResultInParallelAndSequentially() {
        ChecksumEngine parallel = engine(recordingRegistry(), 4);
        ChecksumEngine sequential = engine(new DigestRegistry(), 1);

        ChecksumResult fast = parallel.compute(tenMegabytes, DigestKind.SHA256, DigestKind.MD5);
        ChecksumResult slow = sequential.compute(tenMegabytes, DigestKind.SHA256, DigestKind.MD5);

        assertThat(fast).isEqualTo(slow);
        assertThat(fast.kinds()).containsExactlyInAnyOrder(DigestKind.SHA256, DigestKind.MD5);
        assertThat(threads.get(DigestKind.SHA256)).allMatch(name -> name.startsWith("chksum-worker-"));
        assertThat(threads.get(DigestKind.MD5)).allMatch(name -> name.startsWith("chksum-worker-"));
    }

    @Test
    void shouldRunOnCallerThreadWithOneCore() {
        ChecksumEngine engine = engine(recordingRegistry(), 1);

        engine.compute(ChecksumSource.of(smallData), EnumSet.of(DigestKind.SHA1, DigestKind.CRC32));

        String caller = Thread.currentThread().getName();
        assertThat(threads.get(DigestKind.SHA1)).containsExactly(caller);
        assertThat(threads.get(DigestKind.CRC32)).containsExactly(caller);
    }

    @Test
    void shouldNotDependOnOtherRequestedKinds() {
        ChecksumEngine engine = engine(new DigestRegistry(), 4);
        ChecksumSource source = ChecksumSource.of(tenMegabytes);

        ChecksumResult both = engine.compute(source, EnumSet.of(DigestKind.SHA512, DigestKind.CRC32C));
        ChecksumResult alone = engine.compute(source, EnumSet.of(DigestKind.SHA512));

        assertThat(both.get(DigestKind.SHA512)).isEqualTo(alone.get(DigestKind.SHA512));
        assertThat(alone.kinds()).containsExactly(DigestKind.SHA512);
    }

    @Test
    void shouldRunPureJavaDigestsOnSeparateWorkers() {
        ChecksumEngine engine = engine(recordingRegistry(), 4);

        ChecksumResult result = engine.compute(ChecksumSource.of(tenMegabytes),
                EnumSet.of(DigestKind.BLAKE3, DigestKind.XXHASH32, DigestKind.SHA256));

        assertThat(result.kinds()).hasSize(3);
        for (DigestKind kind : List.of(DigestKind.BLAKE3, DigestKind.XXHASH32, DigestKind.SHA256)) {
            assertThat(threads.get(kind)).as(kind.name()).hasSize(1)
                    .allMatch(name -> name.startsWith("chksum-worker-"));
        }
        assertThat(threads.get(DigestKind.XXHASH32)).doesNotContainAnyElementsOf(threads.get(DigestKind.BLAKE3));
        assertThat(threads.get(DigestKind.SHA256)).doesNotContainAnyElementsOf(threads.get(DigestKind.BLAKE3));
    }

    @Test
    void shouldParallelizeTwoPureJavaDigests() {
        ChecksumEngine engine = engine(recordingRegistry(), 4);

        ChecksumResult result = engine.compute(ChecksumSource.of(tenMegabytes),
                EnumSet.of(DigestKind.BLAKE3, DigestKind.XXHASH32));

        assertThat(result.kinds()).containsExactlyInAnyOrder(DigestKind.BLAKE3, DigestKind.XXHASH32);
        assertThat(threads.get(DigestKind.BLAKE3)).noneMatch(Thread.currentThread().getName()::equals);
        assertThat(threads.get(DigestKind.XXHASH32)).noneMatch(Thread.currentThread().getName()::equals);
    }

    @Test
    void shouldReadStreamSourceOnceWithoutClosingIt() throws IOException {
        AtomicBoolean closed = new AtomicBoolean();
        InputStream stream = new ByteArrayInputStream(smallData) {
            @Override
            public void close() {
                closed.set(true);
            }
        };
        ChecksumEngine engine = engine(recordingRegistry(), 4);
        ChecksumSource source = ChecksumSource.of(stream);

        ChecksumResult fromStream = engine.compute(source, EnumSet.of(DigestKind.MD5, DigestKind.SHA256));

        assertThat(threads.get(DigestKind.MD5)).containsExactly(Thread.currentThread().getName());
        assertThat(fromStream).isEqualTo(engine.compute(ChecksumSource.of(smallData),
                EnumSet.of(DigestKind.MD5, DigestKind.SHA256)));
        assertThat(closed).isFalse();
        assertThat(source.reopenable()).isFalse();
        assertThatThrownBy(source::open).isInstanceOf(InvalidStateException.class);
    }

    @Test
    void shouldFailBeforeReadingWhenKindIsUnsupported() {
        AtomicBoolean read = new AtomicBoolean();
        InputStream stream = new ByteArrayInputStream(smallData) {
            @Override
            public synchronized int read(byte[] b, int off, int len) {
                read.set(true);
                return super.read(b, off, len);
            }
        };
        DigestRegistry md5Only = new DigestRegistry(DigestCandidate.defaults().stream()
                .filter(c -> c.digestKind() == DigestKind.MD5)
                .toList());
        ChecksumEngine engine = engine(md5Only, 4);

        assertThatThrownBy(() -> engine.compute(ChecksumSource.of(stream), EnumSet.of(DigestKind.MD5, DigestKind.WHIRLPOOL)))
                .isInstanceOf(UnsupportedDigestException.class);
        assertThat(read).isFalse();
    }

    @Test
    void shouldNameFailingKindInParallel() {
        List<DigestCandidate> candidates = new ArrayList<>(DigestCandidate.defaults());
        candidates.removeIf(c -> c.digestKind() == DigestKind.SHA1);
        candidates.add(failingAfter(DigestKind.SHA1, 1024 * 1024));
        ChecksumEngine engine = engine(new DigestRegistry(candidates), 4);

        assertThatThrownBy(() -> engine.compute(tenMegabytes, DigestKind.SHA1, DigestKind.SHA256, DigestKind.MD5))
                .isInstanceOf(ChecksumComputationFailedException.class)
                .hasMessageContaining("sha1")
                .hasRootCauseMessage("digester blew up")
                .satisfies(e -> assertThat(((ChecksumComputationFailedException) e).digestKind())
                        .isEqualTo(DigestKind.SHA1));
    }

    @Test
    void shouldNameFailingKindSequentially() {
        List<DigestCandidate> candidates = new ArrayList<>(DigestCandidate.defaults());
        candidates.removeIf(c -> c.digestKind() == DigestKind.CRC32);
        candidates.add(failingAfter(DigestKind.CRC32, 0));
        ChecksumEngine engine = engine(new DigestRegistry(candidates), 1);

        assertThatThrownBy(() -> engine.compute(ChecksumSource.of(smallData), EnumSet.of(DigestKind.MD5, DigestKind.CRC32)))
                .isInstanceOf(ChecksumComputationFailedException.class)
                .satisfies(e -> assertThat(((ChecksumComputationFailedException) e).digestKind())
                        .isEqualTo(DigestKind.CRC32));
    }

    @Test
    void shouldWrapReadFailures() {
        ChecksumEngine engine = engine(new DigestRegistry(), 4);

        assertThatThrownBy(() -> engine.compute(tmp.resolve("missing.bin"), DigestKind.MD5, DigestKind.SHA1))
                .isInstanceOf(ChecksumComputationFailedException.class)
                .hasCauseInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldDigestEmptyInput() {
        ChecksumEngine engine = engine(new DigestRegistry(), 2);

        ChecksumResult result = engine.compute(ChecksumSource.of(new byte[0]), EnumSet.of(DigestKind.SHA256, DigestKind.CRC32));

        assertThat(result.hex(DigestKind.SHA256))
                .isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
        assertThat(result.hex(DigestKind.CRC32)).isEqualTo("00000000");
    }

    @Test
    void shouldRejectEmptyRequest() {
        ChecksumEngine engine = engine(new DigestRegistry(), 2);

        assertThatIllegalArgumentException().isThrownBy(() -> engine.compute(tenMegabytes));
        assertThatIllegalArgumentException()
                .isThrownBy(() -> engine.compute(ChecksumSource.of(smallData), EnumSet.noneOf(DigestKind.class)));
    }

    @Test
    void shouldRefuseWorkAfterClose() {
        ChecksumEngine engine = engine(new DigestRegistry(), 2);
        engine.compute(tenMegabytes, DigestKind.MD5, DigestKind.SHA1);
        engine.close();

        assertThatThrownBy(() -> engine.compute(tenMegabytes, DigestKind.MD5))
                .isInstanceOf(InvalidStateException.class);
    }

    @Test
    void shouldValidateConstructorArguments() {
        assertThatIllegalArgumentException().isThrownBy(() -> new ChecksumEngine(new DigestRegistry(), 0, 1024));
        assertThatIllegalArgumentException().isThrownBy(() -> new ChecksumEngine(new DigestRegistry(), 2, 0));
    }
}
