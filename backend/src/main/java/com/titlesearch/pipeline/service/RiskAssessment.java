package com.titlesearch.pipeline.service;

import java.util.List;

public record RiskAssessment(int score, String level, List<String> factors) {
    public RiskAssessment {
        factors = factors == null ? List.of() : List.copyOf(factors);
    }
}
