package com.goormthonuniv.credibility.dto;

public record FactCheckPerformance(
        long supported,
        long partiallySupported,
        long refuted,
        double successRate       // 0~100, (supported + partially) / 전체
) {}
