package com.goormthonuniv.credibility.scoring;

import com.goormthonuniv.credibility.stats.GradeConfidence;

/** 점수 → 학점 변환과 신뢰도 표기 */
public final class LetterGrade {

    /** 평가 불가 표기 */
    public static final String NOT_RATED = "N/R";

    private static final double[] THRESHOLDS = {93, 90, 87, 83, 80, 77, 73, 70, 67, 63, 60};
    private static final String[] GRADES = {"A", "A-", "B+", "B", "B-", "C+", "C", "C-", "D+", "D", "D-"};

    private LetterGrade() {}

    public static String fromScore(double score) {
        for (int i = 0; i < THRESHOLDS.length; i++) {
            if (score >= THRESHOLDS[i]) return GRADES[i];
        }
        return "F";
    }

    public static String display(String grade, GradeConfidence confidence) {
        return switch (confidence) {
            case HIGH -> grade;
            case MEDIUM -> grade + " ±";
            case LOW -> "~" + grade;
            case INSUFFICIENT -> NOT_RATED;
        };
    }
}
