package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.model.AnalysisRecord;
import com.goormthonuniv.credibility.model.DeceptionInstance;
import com.goormthonuniv.credibility.model.EvidenceHierarchy;
import com.goormthonuniv.credibility.model.FactCheckResult;
import com.goormthonuniv.credibility.model.ScoreBreakdown;
import com.goormthonuniv.credibility.model.Severity;
import com.goormthonuniv.credibility.model.Verification;
import com.goormthonuniv.credibility.stats.GlobalPrior;
import com.goormthonuniv.credibility.stats.GradeConfidence;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link CompositeGrader}.
 */
class CompositeGraderTest {

    private static final Instant BASE = Instant.parse("2024-01-01T00:00:00Z");

    private final CompositeGrader grader = new CompositeGrader();

    @Test
    void smallSamplePenalty_scalesDownToZeroAtTwenty() {
        assertThat(CompositeGrader.smallSamplePenalty(0)).isEqualTo(10);
        assertThat(CompositeGrader.smallSamplePenalty(5)).isEqualTo(7.5);
        assertThat(CompositeGrader.smallSamplePenalty(19)).isCloseTo(0.5, within(1e-9));
        assertThat(CompositeGrader.smallSamplePenalty(20)).isZero();
        assertThat(CompositeGrader.smallSamplePenalty(100)).isZero();
    }

    @Test
    void grade_smallSample_appliesPenaltyWithReason() {
        List<AnalysisRecord> analyses = spacedAnalyses(5, 80);

        CompositeGrade result = grader.grade(analyses, 5, GlobalPrior.DEFAULT);

        assertThat(result.penalty()).isEqualTo(7.5);
        assertThat(result.penaltyReason()).isEqualTo("Low sample size (5 articles)");
        assertThat(result.numericScore())
                .isCloseTo(result.components().weightedScore() - 7.5, within(0.05));
    }

    @Test
    void grade_fullSample_hasNoPenalty() {
        CompositeGrade result = grader.grade(spacedAnalyses(25, 80), 25, GlobalPrior.DEFAULT);

        assertThat(result.penalty()).isZero();
        assertThat(result.penaltyReason()).isNull();
    }

    @Test
    void grade_consistentSource_endToEnd() {
        CompositeGrade result = grader.grade(spacedAnalyses(20, 80), 20, GlobalPrior.DEFAULT);

        ComponentScores c = result.components();
        assertThat(c.logicalStructure()).isEqualTo(100);
        assertThat(c.methodologyRigor()).isEqualTo(50);
        assertThat(c.manipulationAbsence()).isEqualTo(100);
        assertThat(c.consistency()).isEqualTo(100);
        assertThat(c.factualReliability()).isEqualTo(result.bayesianScore().shrunkScore());
        assertThat(c.factualReliability()).isGreaterThan(50).isLessThan(80);

        assertThat(result.bayesianScore().effectiveSampleSize()).isEqualTo(20);
        assertThat(result.bayesianScore().gradeConfidence()).isEqualTo(GradeConfidence.MEDIUM);
        assertThat(result.numericScore()).isCloseTo(84.65, within(0.1));
        assertThat(result.grade()).isEqualTo("B");
        assertThat(result.gradeDisplay()).isEqualTo("B ±");
    }

    @Test
    void grade_singleAnalysis_isNotRated() {
        CompositeGrade result = grader.grade(spacedAnalyses(1, 90), 1, GlobalPrior.DEFAULT);

        assertThat(result.gradeDisplay()).isEqualTo(LetterGrade.NOT_RATED);
        assertThat(result.grade()).isNotEqualTo(LetterGrade.NOT_RATED);
    }

    @Test
    void grade_deceptionsLowerManipulationAbsence() {
        List<AnalysisRecord> analyses = List.of(
                analysis(0, 70, List.of(new DeceptionInstance("emotional", "fear_appeal", Severity.HIGH)), List.of()),
                analysis(40, 70, List.of(new DeceptionInstance("framing", "false_balance", Severity.LOW)), List.of()),
                analysis(80, 70, List.of(), List.of()),
                analysis(120, 70, List.of(), List.of()));

        CompositeGrade result = grader.grade(analyses, 4, GlobalPrior.DEFAULT);

        // 2 deceptions / 4 analyses × 20
        assertThat(result.components().manipulationAbsence()).isEqualTo(90);
    }

    @Test
    void grade_noisyScores_lowerConsistency() {
        List<AnalysisRecord> steady = IntStream.range(0, 6)
                .mapToObj(i -> analysis(i * 40, 70, List.of(), List.of())).toList();
        List<AnalysisRecord> noisy = IntStream.range(0, 6)
                .mapToObj(i -> analysis(i * 40, i % 2 == 0 ? 40 : 100, List.of(), List.of())).toList();

        double steadyConsistency = grader.grade(steady, 6, GlobalPrior.DEFAULT).components().consistency();
        double noisyConsistency = grader.grade(noisy, 6, GlobalPrior.DEFAULT).components().consistency();

        assertThat(steadyConsistency).isEqualTo(100);
        assertThat(noisyConsistency).isLessThan(steadyConsistency).isGreaterThanOrEqualTo(0);
    }

    @Test
    void methodologyInput_derivesRatesFromFactChecks() {
        List<AnalysisRecord> analyses = List.of(
                analysis(0, 70, List.of(), List.of(
                        new FactCheckResult(Verification.SUPPORTED, EvidenceHierarchy.PRIMARY),
                        new FactCheckResult(Verification.REFUTED, EvidenceHierarchy.SECONDARY))),
                analysis(10, 70, List.of(), List.of(
                        new FactCheckResult(Verification.PARTIALLY_SUPPORTED, EvidenceHierarchy.UNKNOWN),
                        new FactCheckResult(Verification.INCONCLUSIVE, null))));

        MethodologyInput input = CompositeGrader.methodologyInput(analyses);

        assertThat(input.primarySourceRate()).isEqualTo(0.5);
        assertThat(input.verifiedClaimRate()).isEqualTo(0.5);
        assertThat(input.avgEvidenceQuality()).isEqualTo(ScoreBreakdown.MIDPOINT.evidenceQuality());
    }

    @Test
    void methodologyInput_withoutFactChecks_usesDefaultRates() {
        MethodologyInput input = CompositeGrader.methodologyInput(spacedAnalyses(3, 60));

        assertThat(input.primarySourceRate()).isEqualTo(MethodologyInput.DEFAULT_RATE);
        assertThat(input.verifiedClaimRate()).isEqualTo(MethodologyInput.DEFAULT_RATE);
    }

    @Test
    void methodologyInput_averagesBreakdowns() {
        List<AnalysisRecord> analyses = List.of(
                new AnalysisRecord("a1", 80, BASE, null, new ScoreBreakdown(30, 20, 15, 15), null, null, null),
                new AnalysisRecord("a2", 60, BASE, null, new ScoreBreakdown(10, 10, 15, 15), null, null, null));

        MethodologyInput input = CompositeGrader.methodologyInput(analyses);

        assertThat(input.avgEvidenceQuality()).isEqualTo(20);
        assertThat(input.avgMethodologyRigor()).isEqualTo(15);
    }

    private static List<AnalysisRecord> spacedAnalyses(int n, double score) {
        return IntStream.range(0, n)
                .mapToObj(i -> analysis(i * 40L, score, List.of(), List.of()))
                .toList();
    }

    private static AnalysisRecord analysis(long dayOffset, double score,
                                           List<DeceptionInstance> deceptions,
                                           List<FactCheckResult> checks) {
        return new AnalysisRecord(
                "an-" + dayOffset,
                score,
                BASE.plus(Duration.ofDays(dayOffset)),
                null,
                null,
                deceptions,
                List.of(),
                checks);
    }
}
