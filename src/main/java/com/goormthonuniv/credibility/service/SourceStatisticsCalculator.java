package com.goormthonuniv.credibility.service;

import com.goormthonuniv.credibility.dto.FactCheckPerformance;
import com.goormthonuniv.credibility.dto.SourceStats;
import com.goormthonuniv.credibility.dto.TypeCount;
import com.goormthonuniv.credibility.model.AnalysisRecord;
import com.goormthonuniv.credibility.model.ArticleRecord;
import com.goormthonuniv.credibility.model.FactCheckResult;
import com.goormthonuniv.credibility.model.Verification;
import com.goormthonuniv.credibility.scoring.CompositeGrade;
import com.goormthonuniv.credibility.scoring.CompositeGrader;
import com.goormthonuniv.credibility.scoring.Trend;
import com.goormthonuniv.credibility.scoring.TrendAnalyzer;
import com.goormthonuniv.credibility.stats.GlobalPrior;
import com.goormthonuniv.credibility.stats.TimedScore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 매체 한 곳의 분석 이력 → {@link SourceStats}.
 * 매체끼리는 서로 독립이라 호출 순서나 병렬 여부와 무관하다.
 */
@Service
@RequiredArgsConstructor
public class SourceStatisticsCalculator {

    static final int TOP_N = 5;

    private final CompositeGrader grader;
    private final TrendAnalyzer trendAnalyzer;

    /**
     * @param articles 매체의 기사들 (분석 없는 기사 포함 가능)
     * @param analyses 통계에 쓸 분석들, 비어 있으면 안 됨
     */
    public SourceStats calculate(String publication,
                                 List<ArticleRecord> articles,
                                 List<AnalysisRecord> analyses,
                                 GlobalPrior prior) {
        if (analyses.isEmpty()) {
            throw new IllegalArgumentException("no analyses for publication " + publication);
        }

        CompositeGrade graded = grader.grade(analyses, articles.size(), prior);

        List<TimedScore> observations = analyses.stream()
                .map(a -> new TimedScore(a.createdAt(), a.truthScore()))
                .toList();
        Trend trend = trendAnalyzer.analyze(observations);

        Instant first = analyses.stream().map(AnalysisRecord::createdAt).min(Comparator.naturalOrder()).orElseThrow();
        Instant last = analyses.stream().map(AnalysisRecord::createdAt).max(Comparator.naturalOrder()).orElseThrow();

        return new SourceStats(
                slug(publication),
                publication,
                articles.size(),
                graded.bayesianScore(),
                graded.grade(),
                graded.gradeDisplay(),
                graded.numericScore(),
                graded.components(),
                graded.penalty(),
                graded.penaltyReason(),
                countBy(analyses, a -> a.credibility().value()),
                countBy(articles, a -> a.articleType() == null ? "unknown" : a.articleType()),
                countBy(analyses.stream().flatMap(a -> a.deceptionInstances().stream()).toList(),
                        d -> d.category()),
                top(analyses.stream().flatMap(a -> a.deceptionInstances().stream()).toList(),
                        d -> d.type()),
                top(analyses.stream().flatMap(a -> a.fallacyInstances().stream()).toList(),
                        f -> f.type()),
                factCheckPerformance(analyses.stream().flatMap(a -> a.factCheckResults().stream()).toList()),
                trend,
                first,
                last,
                timeSpanDays(first, last)
        );
    }

    /** 소문자로 바꾸고 영숫자가 아닌 문자는 '-' 로 */
    static String slug(String publication) {
        return publication.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]", "-");
    }

    static long timeSpanDays(Instant first, Instant last) {
        long millis = Duration.between(first, last).toMillis();
        return (long) Math.ceil(millis / (double) Duration.ofDays(1).toMillis());
    }

    static FactCheckPerformance factCheckPerformance(List<FactCheckResult> checks) {
        long supported = checks.stream().filter(c -> c.verification() == Verification.SUPPORTED).count();
        long partially = checks.stream().filter(c -> c.verification() == Verification.PARTIALLY_SUPPORTED).count();
        long refuted = checks.stream().filter(c -> c.verification() == Verification.REFUTED).count();
        double successRate = checks.isEmpty() ? 0 : (supported + partially) * 100.0 / checks.size();
        return new FactCheckPerformance(supported, partially, refuted, successRate);
    }

    private static <T> Map<String, Long> countBy(List<T> items, Function<T, String> key) {
        return items.stream().collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    }

    /** 건수 내림차순 상위 5개 (동률은 처음 나온 순서) */
    private static <T> List<TypeCount> top(List<T> items, Function<T, String> key) {
        return countBy(items, key).entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(TOP_N)
                .map(e -> new TypeCount(e.getKey(), e.getValue()))
                .toList();
    }
}
