package com.goormthonuniv.credibility.repository;

import com.goormthonuniv.credibility.model.AnalysisRecord;
import com.goormthonuniv.credibility.model.ArticleRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * article / analysis 테이블에서 분석 이력을 읽는다.
 *
 * JSON 컬럼(score_breakdown, deception_detected, fallacies, fact_check_results)은
 * {@link AnalysisRowParser}가 타입 있는 레코드로 바꾼다.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class JdbcAnalysisHistoryRepository implements AnalysisHistoryRepository {

    private static final String SELECT_COLUMNS = """
            SELECT
                ar.id            AS article_id,
                ar.publication   AS publication,
                ar.article_type  AS article_type,
                an.id            AS analysis_id,
                an.truth_score   AS truth_score,
                an.credibility   AS credibility,
                an.score_breakdown    AS score_breakdown,
                an.deception_detected AS deception_detected,
                an.fallacies          AS fallacies,
                an.fact_check_results AS fact_check_results,
                an.created_at    AS created_at
            """;

    private final JdbcTemplate jdbcTemplate;
    private final AnalysisRowParser parser;

    @Override
    public List<ArticleRecord> findArticles(HistoryFilter filter) {
        StringBuilder sql = new StringBuilder(SELECT_COLUMNS).append("""
                FROM article ar
                JOIN analysis an ON an.article_id = ar.id
                WHERE 1 = 1
                """);
        List<Object> args = new ArrayList<>();
        if (filter.articleType() != null) {
            sql.append(" AND ar.article_type = ?");
            args.add(filter.articleType());
        }
        if (filter.since() != null) {
            sql.append(" AND an.created_at >= ?");
            args.add(Timestamp.from(filter.since()));
        }
        sql.append(" ORDER BY ar.publication, ar.id, an.created_at DESC");

        List<ArticleRecord> articles = groupByArticle(sql.toString(), args.toArray());
        log.debug("Loaded {} articles for filter {}", articles.size(), filter);
        return articles;
    }

    @Override
    public List<ArticleRecord> findArticlesByPublication(String publication) {
        String sql = SELECT_COLUMNS + """
                FROM article ar
                LEFT JOIN analysis an ON an.article_id = ar.id
                WHERE ar.publication = ?
                ORDER BY ar.id, an.created_at DESC
                """;
        return groupByArticle(sql, publication);
    }

    @Override
    public List<Double> findAllTruthScores() {
        List<Double> scores = new ArrayList<>();
        jdbcTemplate.query("SELECT id, truth_score FROM analysis", (RowCallbackHandler) rs ->
                parser.parseTruthScore(rs.getString("id"), rs.getObject("truth_score")).ifPresent(scores::add));
        return scores;
    }

    /** 행(기사 × 분석)을 기사 단위로 묶는다. 기사 순서는 쿼리 정렬을 따른다. */
    private List<ArticleRecord> groupByArticle(String sql, Object... args) {
        Map<String, ArticleRow> byId = new LinkedHashMap<>();
        jdbcTemplate.query(sql, (RowCallbackHandler) rs -> {
            String articleId = rs.getString("article_id");
            ArticleRow article = byId.computeIfAbsent(articleId, id -> newArticle(rs, id));
            if (rs.getString("analysis_id") != null) {
                parser.parse(toRawRow(rs)).ifPresent(article.analyses::add);
            }
        }, args);

        return byId.values().stream()
                .map(a -> new ArticleRecord(a.id, a.publication, a.articleType, a.analyses))
                .toList();
    }

    private static ArticleRow newArticle(ResultSet rs, String id) {
        try {
            return new ArticleRow(id, rs.getString("publication"), rs.getString("article_type"));
        } catch (SQLException e) {
            throw new IllegalStateException("Cannot read article " + id, e);
        }
    }

    private static RawAnalysisRow toRawRow(ResultSet rs) throws SQLException {
        return new RawAnalysisRow(
                rs.getString("analysis_id"),
                rs.getObject("truth_score"),
                rs.getTimestamp("created_at"),
                rs.getString("credibility"),
                rs.getString("score_breakdown"),
                rs.getString("deception_detected"),
                rs.getString("fallacies"),
                rs.getString("fact_check_results")
        );
    }

    private static final class ArticleRow {
        private final String id;
        private final String publication;
        private final String articleType;
        private final List<AnalysisRecord> analyses = new ArrayList<>();

        private ArticleRow(String id, String publication, String articleType) {
            this.id = id;
            this.publication = publication;
            this.articleType = articleType;
        }
    }
}
