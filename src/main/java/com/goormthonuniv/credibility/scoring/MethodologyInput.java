package com.goormthonuniv.credibility.scoring;

/**
 * 방법론 점수 입력. 범위를 벗어난 값은 생성 시점에 거부한다.
 */
public record MethodologyInput(
        double avgEvidenceQuality,   // 0~40
        double avgMethodologyRigor,  // 0~25
        double primarySourceRate,    // 0~1
        double verifiedClaimRate     // 0~1
) {
    /** 팩트체크 결과가 없을 때의 비율 추정치 */
    public static final double DEFAULT_RATE = 0.5;

    public MethodologyInput {
        requireRange("avgEvidenceQuality", avgEvidenceQuality, 40);
        requireRange("avgMethodologyRigor", avgMethodologyRigor, 25);
        requireRange("primarySourceRate", primarySourceRate, 1);
        requireRange("verifiedClaimRate", verifiedClaimRate, 1);
    }

    private static void requireRange(String name, double v, double max) {
        if (Double.isNaN(v) || v < 0 || v > max) {
            throw new IllegalArgumentException(name + " must be within [0, " + max + "]: " + v);
        }
    }
}
