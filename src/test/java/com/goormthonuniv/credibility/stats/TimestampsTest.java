package com.goormthonuniv.credibility.stats;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link Timestamps}.
 */
class TimestampsTest {

    private static final Instant NEW_YEAR = Instant.parse("2026-01-01T00:00:00Z");

    @Test
    void toInstant_acceptsCommonRepresentations() {
        assertThat(Timestamps.toInstant("2026-01-01")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01T00:00:00Z")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01T09:00:00+09:00")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01T00:00:00")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant(NEW_YEAR.toEpochMilli())).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant(LocalDateTime.of(2026, 1, 1, 0, 0))).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant(OffsetDateTime.of(2026, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC))).isEqualTo(NEW_YEAR);
    }

    @Test
    void toInstant_acceptsSqlStyleAndCompactOffsets() {
        assertThat(Timestamps.toInstant("2026-01-01 00:00:00")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01 09:00:00+09:00")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01T09:00:00+0900")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2025-12-31T19:00:00-0500")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01T00:00:00.000Z")).isEqualTo(NEW_YEAR);
        assertThat(Timestamps.toInstant("2026-01-01 00:00")).isEqualTo(NEW_YEAR);
    }

    @Test
    void toInstant_garbage_throws() {
        assertThatThrownBy(() -> Timestamps.toInstant("yesterday-ish"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.toInstant(null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.toInstant(new Object()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
