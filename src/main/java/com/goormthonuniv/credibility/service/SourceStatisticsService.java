package com.goormthonuniv.credibility.service;

import com.goormthonuniv.credibility.config.CredibilityProperties;
import com.goormthonuniv.credibility.dto.SortOrder;
import com.goormthonuniv.credibility.dto.SourceStats;
import com.goormthonuniv.credibility.dto.SourceStatsPage;
import com.goormthonuniv.credibility.dto.SourceStatsQuery;
import com.goormthonuniv.credibility.model.AnalysisRecord;
import com.goormthonuniv.credibility.model.ArticleRecord;
import com.goormthonuniv.credibility.repository.AnalysisHistoryRepository;
import com.goormthonuniv.credibility.repository.HistoryFilter;
import com.goormthonuniv.credibility.stats.GlobalPrior;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 매체별 신뢰도 통계 조회의 진입점.
 *
 * 1) global prior (TTL 캐시)
 * 2) 조건에 맞는 기사/분석을 매체 단위로 묶기
 * 3) 매체마다 {@link SourceStatisticsCalculator}
 * 4) 정렬 → 페이지네이션
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SourceStatisticsService {

    private final AnalysisHistoryRepository repository;
    private final SourceStatisticsCalculator calculator;
    private final GlobalPriorCache priorCache;
    private final CredibilityProperties props;
    private final Clock clock;

    public SourceStatsPage getSourceStats(SourceStatsQuery query) {
        GlobalPrior prior = globalPrior();

        Duration window = query.timeRange().window();
        Instant since = window == null ? null : clock.instant().minus(window);
        List<ArticleRecord> articles = repository.findArticles(new HistoryFilter(since, query.articleType()));

        // ===== 매체 단위로 묶기 =====
        Map<String, List<ArticleRecord>> byPublication = new LinkedHashMap<>();
        for (ArticleRecord article : articles) {
            byPublication.computeIfAbsent(article.publication(), p -> new ArrayList<>()).add(article);
        }

        List<SourceStats> stats = new ArrayList<>();
        for (Map.Entry<String, List<ArticleRecord>> e : byPublication.entrySet()) {
            List<AnalysisRecord> analyses = flatten(e.getValue());
            // 분석 수가 minArticles 미만인 매체는 조용히 제외
            if (analyses.isEmpty() || analyses.size() < query.minArticles()) continue;
            stats.add(calculator.calculate(e.getKey(), e.getValue(), analyses, prior));
        }

        stats.sort(comparator(query));

        int total = stats.size();
        int limit = Math.min(query.limit(), props.getQuery().getMaxLimit());
        List<SourceStats> page = stats.stream()
                .skip(query.offset())
                .limit(limit)
                .toList();

        log.info("Source stats: timeRange={} articleType={} minArticles={} -> {} sources (page {})",
                query.timeRange().param(), query.articleType(), query.minArticles(), total, page.size());

        return new SourceStatsPage(page, total, prior.mean());
    }

    public Optional<SourceStats> getSourceStatsById(String publication) {
        GlobalPrior prior = globalPrior();

        List<ArticleRecord> articles = repository.findArticlesByPublication(publication);
        if (articles.isEmpty()) return Optional.empty();

        List<AnalysisRecord> analyses = flatten(articles);
        if (analyses.isEmpty()) return Optional.empty();

        return Optional.of(calculator.calculate(publication, articles, analyses, prior));
    }

    GlobalPrior globalPrior() {
        return priorCache.getOrCompute(() -> {
            List<Double> scores = repository.findAllTruthScores();
            CredibilityProperties.Prior defaults = props.getPrior();
            GlobalPrior prior = GlobalPrior.fromScores(scores,
                    new GlobalPrior(defaults.getDefaultMean(), defaults.getDefaultVariance()));
            log.debug("Recomputed global prior from {} analyses: mean={} variance={}",
                    scores.size(), prior.mean(), prior.variance());
            return prior;
        });
    }

    private static List<AnalysisRecord> flatten(List<ArticleRecord> articles) {
        return articles.stream().flatMap(a -> a.analyses().stream()).toList();
    }

    private static Comparator<SourceStats> comparator(SourceStatsQuery query) {
        Comparator<SourceStats> c = switch (query.sortBy()) {
            case GRADE -> Comparator.comparingDouble(SourceStats::numericScore);
            case ARTICLES -> Comparator.comparingInt(SourceStats::articleCount);
            case RECENT -> Comparator.comparing(SourceStats::lastAnalysis);
        };
        return query.sortOrder() == SortOrder.DESC ? c.reversed() : c;
    }
}
