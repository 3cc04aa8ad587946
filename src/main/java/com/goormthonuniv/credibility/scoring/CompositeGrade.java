package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.stats.BayesianSourceScore;

public record CompositeGrade(
        BayesianSourceScore bayesianScore,
        ComponentScores components,
        double numericScore,
        double penalty,
        String penaltyReason,        // 패널티 없으면 null
        String grade,
        String gradeDisplay
) {}
