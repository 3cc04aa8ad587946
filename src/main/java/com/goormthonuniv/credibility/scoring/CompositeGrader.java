package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.model.AnalysisRecord;
import com.goormthonuniv.credibility.model.EvidenceHierarchy;
import com.goormthonuniv.credibility.model.FactCheckResult;
import com.goormthonuniv.credibility.model.FallacyInstance;
import com.goormthonuniv.credibility.model.ScoreBreakdown;
import com.goormthonuniv.credibility.stats.BayesianCredibilityEstimator;
import com.goormthonuniv.credibility.stats.BayesianSourceScore;
import com.goormthonuniv.credibility.stats.GlobalPrior;
import com.goormthonuniv.credibility.stats.StatisticsUtils;
import com.goormthonuniv.credibility.stats.TimedScore;
import org.springframework.stereotype.Component;

import java.util.List;

import static com.goormthonuniv.credibility.stats.StatisticsUtils.round1;

/**
 * 매체 한 곳의 분석 이력으로 종합 점수/학점을 매긴다.
 *
 * <pre>
 *   base    = 0.30·logic + 0.20·methodology + 0.25·factual + 0.15·manipulationAbsence + 0.10·consistency
 *   penalty = 10·(1 − n/20)   (n < 20 일 때만)
 *   final   = max(0, base − penalty)
 * </pre>
 */
@Component
public class CompositeGrader {

    static final int FULL_SAMPLE_SIZE = 20;
    static final double MAX_SMALL_SAMPLE_PENALTY = 10;
    static final double DECEPTION_DEDUCTION = 20;
    static final double CONSISTENCY_DEDUCTION_PER_SD = 4;

    /**
     * @param analyses     매체의 전체 분석 (비어 있으면 안 됨)
     * @param articleCount 분석이 속한 기사 수 (논리 점수 정규화용)
     */
    public CompositeGrade grade(List<AnalysisRecord> analyses, int articleCount, GlobalPrior prior) {
        int n = analyses.size();

        List<TimedScore> observations = analyses.stream()
                .map(a -> new TimedScore(a.createdAt(), a.truthScore()))
                .toList();
        BayesianSourceScore bayesian = BayesianCredibilityEstimator.estimateTimed(observations, prior);

        List<FallacyInstance> fallacies = analyses.stream()
                .flatMap(a -> a.fallacyInstances().stream())
                .toList();
        long deceptionCount = analyses.stream()
                .mapToLong(a -> a.deceptionInstances().size())
                .sum();

        ComponentScores components = new ComponentScores(
                LogicScorer.score(fallacies, articleCount),
                MethodologyScorer.score(methodologyInput(analyses)),
                bayesian.shrunkScore(),
                n == 0 ? 100 : Math.max(0, 100 - ((double) deceptionCount / n) * DECEPTION_DEDUCTION),
                Math.max(0, 100 - Math.sqrt(bayesian.rawVariance()) * CONSISTENCY_DEDUCTION_PER_SD)
        );

        double penalty = smallSamplePenalty(n);
        String penaltyReason = penalty > 0 ? "Low sample size (" + n + " articles)" : null;

        double finalScore = Math.max(0, components.weightedScore() - penalty);
        String grade = LetterGrade.fromScore(finalScore);

        return new CompositeGrade(
                bayesian,
                components,
                round1(finalScore),
                round1(penalty),
                penaltyReason,
                grade,
                LetterGrade.display(grade, bayesian.gradeConfidence())
        );
    }

    static double smallSamplePenalty(int n) {
        if (n >= FULL_SAMPLE_SIZE) return 0;
        return MAX_SMALL_SAMPLE_PENALTY * (1 - (double) n / FULL_SAMPLE_SIZE);
    }

    /**
     * 세부 배점 평균과 팩트체크 비율로 방법론 입력을 만든다.
     * 출처 위계가 알려진 팩트체크가 없으면 1차 출처 비율은 기본값, 팩트체크가 없으면 검증 비율도 기본값.
     */
    static MethodologyInput methodologyInput(List<AnalysisRecord> analyses) {
        double avgEvidence = analyses.isEmpty()
                ? ScoreBreakdown.MIDPOINT.evidenceQuality()
                : StatisticsUtils.mean(analyses.stream().map(a -> a.scoreBreakdown().evidenceQuality()).toList());
        double avgRigor = analyses.isEmpty()
                ? ScoreBreakdown.MIDPOINT.methodologyRigor()
                : StatisticsUtils.mean(analyses.stream().map(a -> a.scoreBreakdown().methodologyRigor()).toList());

        List<FactCheckResult> checks = analyses.stream()
                .flatMap(a -> a.factCheckResults().stream())
                .toList();

        List<FactCheckResult> ranked = checks.stream()
                .filter(c -> c.evidenceHierarchy() != null && c.evidenceHierarchy() != EvidenceHierarchy.UNKNOWN)
                .toList();
        double primaryRate = ranked.isEmpty()
                ? MethodologyInput.DEFAULT_RATE
                : (double) ranked.stream().filter(c -> c.evidenceHierarchy() == EvidenceHierarchy.PRIMARY).count() / ranked.size();

        double verifiedRate = checks.isEmpty()
                ? MethodologyInput.DEFAULT_RATE
                : (double) checks.stream().filter(c -> c.verification() != null && c.verification().isVerified()).count() / checks.size();

        return new MethodologyInput(avgEvidence, avgRigor, primaryRate, verifiedRate);
    }
}
