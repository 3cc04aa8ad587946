package com.goormthonuniv.credibility.dto;

public record TypeCount(
        String type,
        long count
) {}
