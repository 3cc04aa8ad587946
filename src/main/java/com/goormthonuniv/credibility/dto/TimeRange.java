package com.goormthonuniv.credibility.dto;

import com.goormthonuniv.credibility.exception.InvalidQueryParameterException;

import java.time.Duration;
import java.util.Locale;

public enum TimeRange {
    ALL("all", null),
    LAST_30_DAYS("30d", Duration.ofDays(30)),
    LAST_90_DAYS("90d", Duration.ofDays(90)),
    LAST_YEAR("1y", Duration.ofDays(365));

    private final String param;
    private final Duration window;

    TimeRange(String param, Duration window) {
        this.param = param;
        this.window = window;
    }

    public String param() {
        return param;
    }

    /** ALL 이면 null */
    public Duration window() {
        return window;
    }

    public static TimeRange fromParam(String raw) {
        if (raw == null || raw.isBlank()) return ALL;
        String key = raw.trim().toLowerCase(Locale.ROOT);
        for (TimeRange r : values()) {
            if (r.param.equals(key)) return r;
        }
        throw new InvalidQueryParameterException("timeRange must be one of all, 30d, 90d, 1y: " + raw);
    }
}
