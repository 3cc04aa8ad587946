package com.goormthonuniv.credibility.model;

import java.util.Locale;

public enum EvidenceHierarchy {
    PRIMARY,
    SECONDARY,
    TERTIARY,
    UNKNOWN;

    public static EvidenceHierarchy fromValue(String raw) {
        if (raw == null) return UNKNOWN;
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "primary" -> PRIMARY;
            case "secondary" -> SECONDARY;
            case "tertiary" -> TERTIARY;
            default -> UNKNOWN;
        };
    }
}
