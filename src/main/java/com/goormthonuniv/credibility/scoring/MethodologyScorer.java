package com.goormthonuniv.credibility.scoring;

import static com.goormthonuniv.credibility.stats.StatisticsUtils.round1;

/**
 * 방법론 점수 (0~100).
 * <pre>
 *   (evidence/40)·40 + (rigor/25)·30 + primarySourceRate·15 + verifiedClaimRate·15
 * </pre>
 * 각 항은 자기 입력에만 단조 증가한다.
 */
public final class MethodologyScorer {

    static final double EVIDENCE_WEIGHT = 40;
    static final double RIGOR_WEIGHT = 30;
    static final double PRIMARY_SOURCE_WEIGHT = 15;
    static final double VERIFIED_CLAIM_WEIGHT = 15;

    private MethodologyScorer() {}

    public static double score(MethodologyInput in) {
        double raw = (in.avgEvidenceQuality() / 40) * EVIDENCE_WEIGHT
                + (in.avgMethodologyRigor() / 25) * RIGOR_WEIGHT
                + in.primarySourceRate() * PRIMARY_SOURCE_WEIGHT
                + in.verifiedClaimRate() * VERIFIED_CLAIM_WEIGHT;
        return round1(raw);
    }
}
