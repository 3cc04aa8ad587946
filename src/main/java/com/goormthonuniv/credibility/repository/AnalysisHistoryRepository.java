package com.goormthonuniv.credibility.repository;

import com.goormthonuniv.credibility.model.ArticleRecord;

import java.util.List;

/**
 * 분석 이력 저장소 (읽기 전용). 엔진의 유일한 I/O 경계.
 */
public interface AnalysisHistoryRepository {

    /**
     * 조건에 맞는 분석을 하나 이상 가진 기사들. 각 기사에는 조건에 맞는 분석만 최신순으로 담긴다.
     */
    List<ArticleRecord> findArticles(HistoryFilter filter);

    /** 매체의 모든 기사(분석이 없는 기사 포함)와 전체 분석 */
    List<ArticleRecord> findArticlesByPublication(String publication);

    /** 전체 분석의 truth score, [0, 100]으로 정리된 값 (global prior 계산용) */
    List<Double> findAllTruthScores();
}
