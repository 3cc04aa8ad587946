package com.goormthonuniv.credibility.scoring;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum TrendDirection {
    IMPROVING,
    STABLE,
    DECLINING;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
