package com.goormthonuniv.credibility.scoring;

import java.util.List;

public record Trend(
        TrendDirection direction,
        Double change30Days,         // 비교 구간이 비어 있으면 null
        Double change90Days,
        List<Double> sparklineData   // 시간순
) {}
