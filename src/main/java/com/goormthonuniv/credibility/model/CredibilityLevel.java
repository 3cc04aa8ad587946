package com.goormthonuniv.credibility.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 기사 단위 신뢰도 등급. 업스트림 분석이 등급을 주지 않았으면 truth score로 정한다.
 * - 80 이상: high
 * - 60 이상: moderate
 * - 40 이상: low
 * - 그 외: very_low
 */
public enum CredibilityLevel {
    HIGH("high"),
    MODERATE("moderate"),
    LOW("low"),
    VERY_LOW("very_low");

    private final String value;

    CredibilityLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static CredibilityLevel fromScore(double truthScore) {
        if (truthScore >= 80) return HIGH;
        if (truthScore >= 60) return MODERATE;
        if (truthScore >= 40) return LOW;
        return VERY_LOW;
    }

    /** @return 인식할 수 없으면 null */
    public static CredibilityLevel fromValue(String raw) {
        if (raw == null) return null;
        String key = raw.trim().toLowerCase(Locale.ROOT).replace("-", "_");
        if (key.equals("verylow")) return VERY_LOW;
        for (CredibilityLevel l : values()) {
            if (l.value.equals(key)) return l;
        }
        return null;
    }
}
