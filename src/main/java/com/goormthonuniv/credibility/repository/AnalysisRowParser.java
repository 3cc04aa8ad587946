package com.goormthonuniv.credibility.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.goormthonuniv.credibility.model.AnalysisRecord;
import com.goormthonuniv.credibility.model.CredibilityLevel;
import com.goormthonuniv.credibility.model.DeceptionInstance;
import com.goormthonuniv.credibility.model.EvidenceHierarchy;
import com.goormthonuniv.credibility.model.FactCheckResult;
import com.goormthonuniv.credibility.model.FallacyInstance;
import com.goormthonuniv.credibility.model.ScoreBreakdown;
import com.goormthonuniv.credibility.model.Severity;
import com.goormthonuniv.credibility.model.Verification;
import com.goormthonuniv.credibility.stats.StatisticsUtils;
import com.goormthonuniv.credibility.stats.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * 느슨한 타입의 저장소 행을 검증된 {@link AnalysisRecord}로 바꾸는 경계 단계.
 * 필드마다 "변환하거나 기본값" 하나만 적용하고, 점수 계산 쪽은 이미 정리된 값만 받는다.
 *
 * - 세부 배점 누락 → 중간값 (evidence 20, rigor 12.5, logic 10, manipulation 7.5)
 * - 범위 밖 값 → 범위로 clamp
 * - 깨진 JSON → 빈 목록 / 기본 배점
 * - truth score / 작성 시각을 읽을 수 없는 행 → 건너뜀
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AnalysisRowParser {

    private final ObjectMapper om;

    public Optional<AnalysisRecord> parse(RawAnalysisRow row) {
        Optional<Double> truthScore = parseTruthScore(row.id(), row.truthScore());
        if (truthScore.isEmpty()) return Optional.empty();

        Instant createdAt;
        try {
            createdAt = Timestamps.toInstant(row.createdAt());
        } catch (IllegalArgumentException e) {
            log.warn("Skipping analysis {}: {}", row.id(), e.getMessage());
            return Optional.empty();
        }

        return Optional.of(new AnalysisRecord(
                row.id(),
                truthScore.get(),
                createdAt,
                CredibilityLevel.fromValue(row.credibility()),
                parseBreakdown(row.id(), row.scoreBreakdownJson()),
                parseList(row.id(), "deceptionDetected", row.deceptionJson(), this::toDeception),
                parseList(row.id(), "fallacies", row.fallaciesJson(), this::toFallacy),
                parseList(row.id(), "factCheckResults", row.factCheckResultsJson(), this::toFactCheck)
        ));
    }

    /**
     * truth score 하나를 [0, 100]으로 정리한다. prior 계산도 같은 규칙을 쓴다.
     *
     * @return 읽을 수 없으면 empty
     */
    public Optional<Double> parseTruthScore(String id, Object raw) {
        Double v = toDouble(raw);
        if (v == null) {
            log.warn("Skipping analysis {}: unreadable truth score {}", id, raw);
            return Optional.empty();
        }
        return Optional.of(clamped(id, "truthScore", v, 100));
    }

    ScoreBreakdown parseBreakdown(String id, String json) {
        JsonNode node = readTree(id, "scoreBreakdown", json);
        if (node == null || !node.isObject()) return ScoreBreakdown.MIDPOINT;

        ScoreBreakdown mid = ScoreBreakdown.MIDPOINT;
        return new ScoreBreakdown(
                field(id, node, "evidenceQuality", mid.evidenceQuality(), ScoreBreakdown.MAX_EVIDENCE_QUALITY),
                field(id, node, "methodologyRigor", mid.methodologyRigor(), ScoreBreakdown.MAX_METHODOLOGY_RIGOR),
                field(id, node, "logicalStructure", mid.logicalStructure(), ScoreBreakdown.MAX_LOGICAL_STRUCTURE),
                field(id, node, "manipulationAbsence", mid.manipulationAbsence(), ScoreBreakdown.MAX_MANIPULATION_ABSENCE)
        );
    }

    private double field(String id, JsonNode node, String name, double fallback, double max) {
        Double v = toDouble(node.get(name));
        if (v == null) return fallback;
        return clamped(id, name, v, max);
    }

    private DeceptionInstance toDeception(JsonNode n) {
        return new DeceptionInstance(
                text(n, "category", "unknown"),
                text(n, "type", "unknown"),
                Severity.fromValue(text(n, "severity", null))
        );
    }

    private FallacyInstance toFallacy(JsonNode n) {
        return new FallacyInstance(
                text(n, "type", "unknown"),
                Severity.fromValue(text(n, "severity", null))
        );
    }

    private FactCheckResult toFactCheck(JsonNode n) {
        return new FactCheckResult(
                Verification.fromValue(text(n, "verification", null)),
                EvidenceHierarchy.fromValue(text(n, "evidenceHierarchy", null))
        );
    }

    private <T> List<T> parseList(String id, String column, String json, Function<JsonNode, T> mapper) {
        JsonNode node = readTree(id, column, json);
        if (node == null || !node.isArray()) return List.of();
        List<T> out = new ArrayList<>(node.size());
        for (JsonNode item : node) {
            if (item.isObject()) out.add(mapper.apply(item));
        }
        return out;
    }

    private JsonNode readTree(String id, String column, String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return om.readTree(json);
        } catch (JsonProcessingException e) {
            log.warn("Malformed {} JSON in analysis {}: {}", column, id, e.getOriginalMessage());
            return null;
        }
    }

    private static double clamped(String id, String name, double v, double max) {
        if (v < 0 || v > max) {
            log.warn("Analysis {} {}={} out of [0, {}], clamping", id, name, v, max);
        }
        return StatisticsUtils.clamp(v, 0, max);
    }

    private static String text(JsonNode n, String name, String fallback) {
        JsonNode v = n.get(name);
        return (v == null || v.isNull() || v.asText().isBlank()) ? fallback : v.asText();
    }

    /** 숫자 또는 숫자 문자열. 그 외는 null */
    static Double toDouble(Object raw) {
        if (raw == null) return null;
        if (raw instanceof JsonNode node) {
            if (node.isNumber()) return node.doubleValue();
            if (node.isTextual()) return toDouble(node.asText());
            return null;
        }
        if (raw instanceof Number n) {
            double d = n.doubleValue();
            return Double.isFinite(d) ? d : null;
        }
        if (raw instanceof CharSequence cs) {
            try {
                double d = Double.parseDouble(cs.toString().trim());
                return Double.isFinite(d) ? d : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
