package com.goormthonuniv.credibility.dto;

import com.goormthonuniv.credibility.exception.InvalidQueryParameterException;

import java.util.Locale;

public enum SortOrder {
    ASC,
    DESC;

    public static SortOrder fromParam(String raw) {
        if (raw == null || raw.isBlank()) return DESC;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryParameterException("sortOrder must be asc or desc: " + raw, e);
        }
    }
}
