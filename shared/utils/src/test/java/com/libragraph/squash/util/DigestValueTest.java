package com.libragraph.squash.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DigestValueTest {

    @Test
    void shouldDefensiveCopyOnConstruction() {
        byte[] bytes = {0x01, 0x02};
        DigestValue value = new DigestValue(bytes);

        // Mutating the original must not affect the value
        bytes[0] = (byte) 0xFF;
        assertThat(value.bytes()[0]).isEqualTo((byte) 0x01);
    }

    @Test
    void shouldNotExposeInternalArray() {
        DigestValue value = DigestValue.fromHex("abcd");
        value.bytes()[0] = 0;

        assertThat(value.toHex()).isEqualTo("abcd");
    }

    @Test
    void shouldRejectNullAndEmpty() {
        assertThatNullPointerException().isThrownBy(() -> new DigestValue(null));
        assertThatIllegalArgumentException().isThrownBy(() -> new DigestValue(new byte[0]));
    }

    @Test
    void shouldRoundTripHex() {
        String hex = "d41d8cd98f00b204e9800998ecf8427e";
        assertThat(DigestValue.fromHex(hex).toHex()).isEqualTo(hex);
        assertThat(DigestValue.fromHex(hex).length()).isEqualTo(16);
    }

    @Test
    void shouldRejectInvalidHex() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> DigestValue.fromHex("zz"))
                .withMessageContaining("Invalid hex");
    }

    @Test
    void shouldEncodeChecksumBigEndian() {
        assertThat(DigestValue.ofChecksum(0xCBF43926L).toHex()).isEqualTo("cbf43926");
        assertThat(DigestValue.ofChecksum(0x1L).toHex()).isEqualTo("00000001");
    }

    @Test
    void shouldImplementEqualsAndHashCode() {
        DigestValue a = DigestValue.fromHex("0123456789abcdef");
        DigestValue b = DigestValue.fromHex("0123456789abcdef");
        DigestValue c = DigestValue.fromHex("fedcba9876543210");

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(c);
        assertThat(a.toString()).isEqualTo("0123456789abcdef");
    }
}
