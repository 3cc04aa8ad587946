package com.goormthonuniv.credibility.model;

/**
 * 기사 한 건의 truth score 세부 배점. 범위를 벗어나면 생성 시점에 실패한다.
 */
public record ScoreBreakdown(
        double evidenceQuality,      // 0~40
        double methodologyRigor,     // 0~25
        double logicalStructure,     // 0~20
        double manipulationAbsence   // 0~15
) {
    public static final double MAX_EVIDENCE_QUALITY = 40;
    public static final double MAX_METHODOLOGY_RIGOR = 25;
    public static final double MAX_LOGICAL_STRUCTURE = 20;
    public static final double MAX_MANIPULATION_ABSENCE = 15;

    /** 레거시 데이터에 값이 없을 때 쓰는 중간값 */
    public static final ScoreBreakdown MIDPOINT = new ScoreBreakdown(
            MAX_EVIDENCE_QUALITY / 2,
            MAX_METHODOLOGY_RIGOR / 2,
            MAX_LOGICAL_STRUCTURE / 2,
            MAX_MANIPULATION_ABSENCE / 2
    );

    public ScoreBreakdown {
        requireRange("evidenceQuality", evidenceQuality, MAX_EVIDENCE_QUALITY);
        requireRange("methodologyRigor", methodologyRigor, MAX_METHODOLOGY_RIGOR);
        requireRange("logicalStructure", logicalStructure, MAX_LOGICAL_STRUCTURE);
        requireRange("manipulationAbsence", manipulationAbsence, MAX_MANIPULATION_ABSENCE);
    }

    static void requireRange(String name, double v, double max) {
        if (Double.isNaN(v) || v < 0 || v > max) {
            throw new IllegalArgumentException(name + " must be within [0, " + max + "]: " + v);
        }
    }
}
