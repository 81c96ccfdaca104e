package com.recomart.recommendation.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Tier of the recommendation waterfall that produced a result.
 */
public enum RecommendationStrategy {
    PERSONALIZED,
    SEGMENT,
    POPULARITY;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }
}
