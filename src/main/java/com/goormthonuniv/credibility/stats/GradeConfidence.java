package com.goormthonuniv.credibility.stats;

public enum GradeConfidence {
    HIGH,
    MEDIUM,
    LOW,
    INSUFFICIENT
}
