package com.goormthonuniv.credibility.dto;

import com.goormthonuniv.credibility.scoring.ComponentScores;
import com.goormthonuniv.credibility.scoring.Trend;
import com.goormthonuniv.credibility.stats.BayesianSourceScore;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * 매체 한 곳의 신뢰도 통계. 조회마다 새로 계산하고 저장하지 않는다.
 */
public record SourceStats(
        String id,                                   // publication slug
        String publication,
        int articleCount,

        BayesianSourceScore bayesianScore,

        String grade,
        String gradeDisplay,                         // 신뢰도 표기 포함 (예: "~B", "N/R")
        double numericScore,

        ComponentScores components,

        double penalty,
        String penaltyReason,

        Map<String, Long> credibilityDistribution,
        Map<String, Long> articleTypeDistribution,

        Map<String, Long> manipulationBreakdown,
        List<TypeCount> topDeceptionTypes,
        List<TypeCount> topFallacies,
        FactCheckPerformance factCheckPerformance,

        Trend trend,

        Instant firstAnalysis,
        Instant lastAnalysis,
        long timeSpanDays
) {}
