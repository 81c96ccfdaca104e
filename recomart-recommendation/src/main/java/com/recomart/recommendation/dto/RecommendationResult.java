package com.recomart.recommendation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Ordered, duplicate-free product ids recommended to a customer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResult {

    private String customerId;

    private List<String> productIds;

    /** Waterfall tier that produced the ids */
    private RecommendationStrategy strategy;
}
