package com.libragraph.squash.compression;

import com.libragraph.squash.codecs.api.Parallelism;
import com.libragraph.squash.codecs.registry.BackendRegistry;
import com.libragraph.squash.codecs.stream.CompressionService;
import com.libragraph.squash.types.CodecKind;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class CompressionProducerTest {

    @Inject
    BackendRegistry registry;

    @Inject
    CompressionService compression;

    @Test
    void shouldShareRegistryWithService() {
        assertThat(compression.registry()).isSameAs(registry);
    }

    @Test
    void shouldAlwaysHandleGzipWithFallbackEnabled() throws Exception {
        byte[] data = "hello world".repeat(1000).getBytes(StandardCharsets.UTF_8);

        byte[] compressed = compression.compress(CodecKind.GZIP, data, Parallelism.AUTO);

        assertThat(registry.availableKinds()).contains(CodecKind.GZIP, CodecKind.BZIP2);
        assertThat(compression.decompress(CodecKind.GZIP, compressed, Parallelism.SERIAL)).isEqualTo(data);
    }
}
