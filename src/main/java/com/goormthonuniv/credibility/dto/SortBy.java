package com.goormthonuniv.credibility.dto;

import com.goormthonuniv.credibility.exception.InvalidQueryParameterException;

import java.util.Locale;

public enum SortBy {
    GRADE,
    ARTICLES,
    RECENT;

    public static SortBy fromParam(String raw) {
        if (raw == null || raw.isBlank()) return GRADE;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidQueryParameterException("sortBy must be one of grade, articles, recent: " + raw, e);
        }
    }
}
