package com.goormthonuniv.credibility.stats;

import java.time.Instant;
import java.util.Objects;

/** 시점이 붙은 truth score 한 건 */
public record TimedScore(
        Instant createdAt,
        double truthScore
) {
    public TimedScore {
        Objects.requireNonNull(createdAt, "createdAt");
    }

    /** Instant, Date, ISO 문자열, epoch millis 등 아무 표현이나 받는다. */
    public static TimedScore of(Object createdAt, double truthScore) {
        return new TimedScore(Timestamps.toInstant(createdAt), truthScore);
    }
}
