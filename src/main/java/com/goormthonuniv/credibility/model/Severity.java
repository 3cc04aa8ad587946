package com.goormthonuniv.credibility.model;

import java.util.Locale;

/** 오류/기만 심각도. 논리 점수에서 가중치로 쓰인다. */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(3);

    private final int weight;

    Severity(int weight) {
        this.weight = weight;
    }

    public int weight() {
        return weight;
    }

    /** 알 수 없는 값은 LOW(가중치 1)로 본다. */
    public static Severity fromValue(String raw) {
        if (raw == null) return LOW;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "high" -> HIGH;
            case "medium" -> MEDIUM;
            default -> LOW;
        };
    }
}
