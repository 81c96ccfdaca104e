package com.recomart.recommendation.dto;

import com.recomart.product.dto.ProductDTO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for customer recommendations.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {

    private String customerId;

    /** Waterfall tier that produced the products */
    private RecommendationStrategy strategy;

    /** Recommended products in rank order */
    private List<ProductDTO> products;

    private int totalCount;

    private long processingTimeMs;
}
