package com.goormthonuniv.credibility.scoring;

/**
 * 종합 점수를 이루는 다섯 요소 (각 0~100).
 */
public record ComponentScores(
        double logicalStructure,     // 30%
        double methodologyRigor,     // 20%
        double factualReliability,   // 25%
        double manipulationAbsence,  // 15%
        double consistency           // 10%
) {
    static final double LOGICAL_STRUCTURE_WEIGHT = 0.30;
    static final double METHODOLOGY_RIGOR_WEIGHT = 0.20;
    static final double FACTUAL_RELIABILITY_WEIGHT = 0.25;
    static final double MANIPULATION_ABSENCE_WEIGHT = 0.15;
    static final double CONSISTENCY_WEIGHT = 0.10;

    public double weightedScore() {
        return logicalStructure * LOGICAL_STRUCTURE_WEIGHT
                + methodologyRigor * METHODOLOGY_RIGOR_WEIGHT
                + factualReliability * FACTUAL_RELIABILITY_WEIGHT
                + manipulationAbsence * MANIPULATION_ABSENCE_WEIGHT
                + consistency * CONSISTENCY_WEIGHT;
    }
}
