package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.model.FallacyInstance;
import com.goormthonuniv.credibility.model.Severity;

import java.util.List;

import static com.goormthonuniv.credibility.stats.StatisticsUtils.round1;

/**
 * 논리 점수 (0~100). 100에서 기사당 가중 오류 수 × 20 을 뺀다.
 * 가중치는 심각도 high 3, medium 2, low 1.
 */
public final class LogicScorer {

    static final double DEDUCTION_PER_WEIGHTED_FALLACY = 20;
    /** 기사 수가 0일 때의 중립값 */
    static final double NEUTRAL = 50;

    private LogicScorer() {}

    public static double score(List<FallacyInstance> fallacies, int totalArticles) {
        if (totalArticles <= 0) return NEUTRAL;

        int weighted = 0;
        if (fallacies != null) {
            for (FallacyInstance f : fallacies) {
                weighted += (f.severity() == null ? Severity.LOW : f.severity()).weight();
            }
        }
        double perArticle = (double) weighted / totalArticles;
        return round1(Math.max(0, 100 - perArticle * DEDUCTION_PER_WEIGHTED_FALLACY));
    }
}
