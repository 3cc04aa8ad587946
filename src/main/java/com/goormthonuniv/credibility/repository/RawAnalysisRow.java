package com.goormthonuniv.credibility.repository;

/**
 * 저장소에서 읽은 그대로의 분석 행. 숫자가 문자열로 들어있거나 JSON 필드가 비어 있을 수 있다.
 */
public record RawAnalysisRow(
        String id,
        Object truthScore,
        Object createdAt,
        String credibility,
        String scoreBreakdownJson,
        String deceptionJson,
        String fallaciesJson,
        String factCheckResultsJson
) {}
