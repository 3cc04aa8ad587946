package com.goormthonuniv.credibility.dto;

import java.util.List;

public record SourceStatsPage(
        List<SourceStats> sources,
        int total,               // 페이지네이션 이전 매칭 매체 수
        double globalMean
) {}
