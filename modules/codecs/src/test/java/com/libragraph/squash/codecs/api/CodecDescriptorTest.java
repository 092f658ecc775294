package com.libragraph.squash.codecs.api;

import com.libragraph.squash.types.CodecKind;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class CodecDescriptorTest {

    @Test
    void shouldRankByCapability() {
        assertThat(CodecDescriptor.priorityFor(ParallelDecode.ANY_ARCHIVE, true))
                .isGreaterThan(CodecDescriptor.priorityFor(ParallelDecode.OWN_ARCHIVES, true));
        assertThat(CodecDescriptor.priorityFor(ParallelDecode.OWN_ARCHIVES, false))
                .isGreaterThan(CodecDescriptor.priorityFor(ParallelDecode.NONE, true));
        assertThat(CodecDescriptor.priorityFor(ParallelDecode.NONE, true))
                .isGreaterThan(CodecDescriptor.priorityFor(ParallelDecode.NONE, false));
        assertThat(CodecDescriptor.priorityFor(ParallelDecode.NONE, false))
                .isGreaterThan(CodecDescriptor.PRIORITY_IN_PROCESS);
    }

    @Test
    void shouldReportDirectionalParallelism() {
        CodecDescriptor pigz = new CodecDescriptor(CodecKind.GZIP, "pigz", Path.of("/usr/bin/pigz"),
                ParallelDecode.NONE, true, false, CodecDescriptor.PRIORITY_PARALLEL_ENCODE);

        assertThat(pigz.supportsParallel(StreamDirection.COMPRESS)).isTrue();
        assertThat(pigz.supportsParallel(StreamDirection.DECOMPRESS)).isFalse();
        assertThat(pigz.isSingleThreaded()).isFalse();
        assertThat(pigz.isInProcess()).isFalse();
        assertThat(pigz.toString()).contains("gzip/pigz");
    }
}
