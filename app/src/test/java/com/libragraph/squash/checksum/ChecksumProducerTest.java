package com.libragraph.squash.checksum;

import com.libragraph.squash.chksum.api.ChecksumResult;
import com.libragraph.squash.chksum.engine.ChecksumEngine;
import com.libragraph.squash.chksum.engine.ChecksumSource;
import com.libragraph.squash.types.DigestKind;
import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

@QuarkusTest
class ChecksumProducerTest {

    @Inject
    ChecksumEngine engine;

    @Test
    void shouldComputeMultipleDigests() {
        ChecksumResult result = engine.compute(ChecksumSource.of("123456789".getBytes(StandardCharsets.US_ASCII)),
                EnumSet.of(DigestKind.CRC32, DigestKind.MD5));

        assertThat(result.hex(DigestKind.CRC32)).isEqualTo("cbf43926");
        assertThat(result.hex(DigestKind.MD5)).isEqualTo("25f9e794323b453885f5181f1b624d0b");
    }

    @Test
    void shouldNeverExceedCoreCount() {
        assertThat(engine.cores()).isBetween(1, Runtime.getRuntime().availableProcessors());
    }
}
