package com.goormthonuniv.credibility.model;

public record FallacyInstance(
        String type,          // 예: straw_man, ad_hominem ...
        Severity severity
) {}
