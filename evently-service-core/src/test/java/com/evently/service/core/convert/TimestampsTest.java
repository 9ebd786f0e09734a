package com.evently.service.core.convert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TimestampsTest {

    private static final Instant EXPECTED = Instant.parse("2013-08-08T21:05:37Z");

    @Test
    void separatorIsTOrSingleSpace() {
        assertThat(Timestamps.parse("2013-08-08T21:05:37")).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse("2013-08-08 21:05:37")).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse("2013-08-08 21:05:37.803826"))
                .isEqualTo(Instant.parse("2013-08-08T21:05:37.803826Z"));
    }

    @Test
    void missingOrDoubledSeparatorIsRejected() {
        assertThatThrownBy(() -> Timestamps.parse("2013-08-0821:05:37")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.parse("2013-08-08  21:05:37"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.parse("2013-08-08T 21:05:37"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void offsetForms() {
        assertThat(Timestamps.parse("2013-08-08T21:05:37Z")).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse("2013-08-08T23:05:37+02:00")).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse("2013-08-08T23:05:37+0200")).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse("2013-08-08T23:05:37+02")).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse("2013-08-08 19:05:37.000-0200")).isEqualTo(EXPECTED);
    }

    @Test
    void malformedOffsetIsRejected() {
        assertThatThrownBy(() -> Timestamps.parse("2013-08-08T23:05:37+2"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.parse("2013-08-08T23:05:37+02:00x"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void temporalValuesPassThrough() {
        assertThat(Timestamps.parse(EXPECTED)).isEqualTo(EXPECTED);
        assertThat(Timestamps.parse(OffsetDateTime.of(2013, 8, 8, 23, 5, 37, 0, ZoneOffset.ofHours(2))))
                .isEqualTo(EXPECTED);
        assertThat(Timestamps.parse(LocalDateTime.of(2013, 8, 8, 21, 5, 37))).isEqualTo(EXPECTED);
    }

    @Test
    void nonTimestampsAreRejected() {
        assertThatThrownBy(() -> Timestamps.parse("not-a-date")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.parse(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.parse("2013-08-08")).isInstanceOf(IllegalArgumentException.class);
    }
}
