package io.github.genie.snowflake.core.support;

import io.github.genie.snowflake.core.exception.InvalidBitLengthException;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DecomposedIdTest {

    @Test
    void decomposesWithTheGivenWidths() {
        // time=500, sequence=3, data center=5, machine=10
        long id = (500L << 22) | (3L << 10) | (5L << 5) | 10L;

        DecomposedId parts = DecomposedId.decompose(id, 41, 12, 5, 5);

        assertThat(parts).isEqualTo(new DecomposedId(id, 500, 3, 5, 10));
    }

    @Test
    void sameIdReadsDifferentlyUnderAnotherLayout() {
        long id = Layout.DEFAULT.pack(500, 3, 5, 10);

        DecomposedId parts = DecomposedId.decompose(id, Layout.DEFAULT_NO_DATA_CENTER);

        assertThat(parts.getTime()).isEqualTo(500);
        assertThat(parts.getSequence()).isEqualTo(3);
        assertThat(parts.getDataCenterId()).isZero();
        assertThat(parts.getMachineId()).isEqualTo((5 << 5) | 10);
    }

    @Test
    void rejectsWidthsNotAddingUpTo63() {
        assertThatThrownBy(() -> DecomposedId.decompose(1L, 41, 12, 5, 4))
                .isInstanceOf(InvalidBitLengthException.class);
    }

    @Test
    void nanosTimeScalesByTickUnit() {
        DecomposedId parts = new DecomposedId(0, 7, 0, 0, 0);

        assertThat(parts.nanosTime(Duration.ofMillis(1))).isEqualTo(7_000_000L);
        assertThat(parts.nanosTime(Duration.ofMillis(10))).isEqualTo(70_000_000L);
    }

}
