package io.github.genie.snowflake.core.codec;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdCodecTest {

    private static final long[] SAMPLES = {
            0L, 1L, 31L, 32L, 57L, 58L, 1_234_567_890_123L, Long.MAX_VALUE, -1L
    };

    @Test
    void knownRenderings() {
        assertThat(IdCodec.toDecimal(1_234_567_890_123L)).isEqualTo("1234567890123");
        assertThat(IdCodec.toBase2(5)).isEqualTo("101");
        assertThat(IdCodec.toBase32(0)).isEqualTo("y");
        assertThat(IdCodec.toBase32(32)).isEqualTo("by");
        assertThat(IdCodec.toBase36(35)).isEqualTo("z");
        assertThat(IdCodec.toBase36(36)).isEqualTo("10");
        assertThat(IdCodec.toBase58(0)).isEqualTo("1");
        assertThat(IdCodec.toBase58(58)).isEqualTo("21");
        assertThat(IdCodec.toBase64(1)).isEqualTo("AAAAAAAAAAE=");
        assertThat(IdCodec.toByteArray(0x0102030405060708L))
                .containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(IdCodec.toBytes(42)).isEqualTo("42".getBytes(StandardCharsets.US_ASCII));
    }

    @Test
    void everyEncodingReadsBack() {
        for (long id : SAMPLES) {
            assertThat(IdCodec.fromDecimal(IdCodec.toDecimal(id))).isEqualTo(id);
            assertThat(IdCodec.fromBase2(IdCodec.toBase2(id))).isEqualTo(id);
            assertThat(IdCodec.fromBase32(IdCodec.toBase32(id))).isEqualTo(id);
            assertThat(IdCodec.fromBase36(IdCodec.toBase36(id))).isEqualTo(id);
            assertThat(IdCodec.fromBase58(IdCodec.toBase58(id))).isEqualTo(id);
            assertThat(IdCodec.fromBase64(IdCodec.toBase64(id))).isEqualTo(id);
            assertThat(IdCodec.fromBytes(IdCodec.toBytes(id))).isEqualTo(id);
            assertThat(IdCodec.fromByteArray(IdCodec.toByteArray(id))).isEqualTo(id);
        }
    }

    @Test
    void topBitIsTreatedAsUnsigned() {
        assertThat(IdCodec.toDecimal(-1L)).isEqualTo("18446744073709551615");
        assertThat(IdCodec.toBase2(Long.MIN_VALUE)).hasSize(64);
    }

    @Test
    void rejectsForeignCharacters() {
        assertThatThrownBy(() -> IdCodec.fromBase58("0OIl"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IdCodec.fromBase32("Y"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IdCodec.fromBase32(""))
                .isInstanceOf(NumberFormatException.class);
    }

    @Test
    void rejectsValuesWiderThan64Bits() {
        String max = IdCodec.toBase58(-1L);

        assertThatThrownBy(() -> IdCodec.fromBase58(max + "1"))
                .isInstanceOf(NumberFormatException.class);
        assertThatThrownBy(() -> IdCodec.fromByteArray(new byte[9]))
                .isInstanceOf(IllegalArgumentException.class);
    }

}
