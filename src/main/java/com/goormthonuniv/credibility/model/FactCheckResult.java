package com.goormthonuniv.credibility.model;

public record FactCheckResult(
        Verification verification,
        EvidenceHierarchy evidenceHierarchy
) {}
