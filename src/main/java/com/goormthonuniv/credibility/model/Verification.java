package com.goormthonuniv.credibility.model;

import java.util.Locale;

public enum Verification {
    SUPPORTED,
    PARTIALLY_SUPPORTED,
    NOT_SUPPORTED,
    REFUTED,
    INCONCLUSIVE;

    public boolean isVerified() {
        return this == SUPPORTED || this == PARTIALLY_SUPPORTED;
    }

    public static Verification fromValue(String raw) {
        if (raw == null) return INCONCLUSIVE;
        String key = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (Verification v : values()) {
            if (v.name().equals(key)) return v;
        }
        return INCONCLUSIVE;
    }
}
