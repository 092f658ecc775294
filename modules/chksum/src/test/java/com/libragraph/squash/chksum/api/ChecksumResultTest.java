package com.libragraph.squash.chksum.api;

import com.libragraph.squash.types.DigestKind;
import com.libragraph.squash.util.DigestValue;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;
import java.util.NoSuchElementException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChecksumResultTest {

    @Test
    void shouldExposeRequestedKindsOnly() {
        Map<DigestKind, DigestValue> values = new HashMap<>();
        values.put(DigestKind.CRC32, DigestValue.fromHex("cbf43926"));
        ChecksumResult result = new ChecksumResult(values);

        assertThat(result.hex(DigestKind.CRC32)).isEqualTo("cbf43926");
        assertThat(result.kinds()).containsExactly(DigestKind.CRC32);
        assertThatThrownBy(() -> result.get(DigestKind.MD5))
                .isInstanceOf(NoSuchElementException.class)
                .hasMessageContaining("md5");
    }

    @Test
    void shouldNotReflectLaterChangesToSourceMap() {
        Map<DigestKind, DigestValue> values = new HashMap<>();
        values.put(DigestKind.CRC32, DigestValue.fromHex("cbf43926"));
        ChecksumResult result = new ChecksumResult(values);

        values.put(DigestKind.CRC32C, DigestValue.fromHex("e3069283"));

        assertThat(result.kinds()).containsExactly(DigestKind.CRC32);
        assertThatThrownBy(() -> result.asMap().clear()).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void shouldAllowEmptyResult() {
        assertThat(new ChecksumResult(Map.of()).kinds()).isEmpty();
    }
}
