package com.factryl.backend.util;

import java.time.Instant;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampParserTest {

    @Test
    void parsesOffsetAndZuluTimestamps() {
        assertThat(TimestampParser.parse("2024-05-01T10:00:00Z").getInstant())
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(TimestampParser.parse("2024-05-01T10:00:00+02:00").getInstant())
                .isEqualTo(Instant.parse("2024-05-01T08:00:00Z"));
    }

    @Test
    void parsesRfc1123() {
        ParsedTimestamp parsed = TimestampParser.parse("Wed, 1 May 2024 10:00:00 GMT");

        assertThat(parsed.isValid()).isTrue();
        assertThat(parsed.getInstant()).isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
    }

    @Test
    void zoneLessValuesAreUtc() {
        assertThat(TimestampParser.parse("2024-05-01T10:00:00").getInstant())
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(TimestampParser.parse("2024-05-01 10:00:00").getInstant())
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(TimestampParser.parse("01/05/2024 10:00:00").getInstant())
                .isEqualTo(Instant.parse("2024-05-01T10:00:00Z"));
        assertThat(TimestampParser.parse("2024-05-01").getInstant())
                .isEqualTo(Instant.parse("2024-05-01T00:00:00Z"));
    }

    @Test
    void unparsableValuesAreInvalidNotErrors() {
        assertThat(TimestampParser.parse("yesterday").isValid()).isFalse();
        assertThat(TimestampParser.parse("").isValid()).isFalse();
        assertThat(TimestampParser.parse(null).isValid()).isFalse();
        assertThat(TimestampParser.parse("2024-13-45").getInstant()).isEqualTo(Instant.MIN);
    }

    @Test
    void formatWritesIsoInstant() {
        assertThat(TimestampParser.format(Instant.parse("2024-06-01T00:00:00Z"))).isEqualTo("2024-06-01T00:00:00Z");
    }
}
