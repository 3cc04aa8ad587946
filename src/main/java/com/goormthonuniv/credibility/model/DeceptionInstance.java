package com.goormthonuniv.credibility.model;

public record DeceptionInstance(
        String category,      // emotional | framing | omission | source | propaganda
        String type,          // 예: fear_appeal, false_balance ...
        Severity severity
) {}
