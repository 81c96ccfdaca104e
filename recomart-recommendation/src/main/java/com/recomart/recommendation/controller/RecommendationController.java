package com.recomart.recommendation.controller;

import com.recomart.product.dto.ProductDTO;
import com.recomart.product.service.ProductService;
import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.core.RecommendationEngine;
import com.recomart.recommendation.core.SimilarityIndex;
import com.recomart.recommendation.dto.RecommendationResponse;
import com.recomart.recommendation.dto.RecommendationResult;
import com.recomart.recommendation.dto.SimilarProduct;
import com.recomart.recommendation.exception.RecommendationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
public class RecommendationController {

    private final RecommendationEngine recommendationEngine;
    private final SimilarityIndex similarityIndex;
    private final ProductService productService;
    private final RecommendationConfig config;

    /**
     * Recommend products to a customer.
     *
     * GET /api/recommendations/{customerId}?limit=5
     */
    @GetMapping("/{customerId}")
    public ResponseEntity<RecommendationResponse> getRecommendations(
            @PathVariable String customerId,
            @RequestParam(required = false) Integer limit) {
        long startTime = System.currentTimeMillis();

        RecommendationResult result = recommendationEngine.recommend(customerId, resolveLimit(limit));
        List<ProductDTO> products = productService.getProductsByIds(result.getProductIds());

        RecommendationResponse response = RecommendationResponse.builder()
                .customerId(customerId)
                .strategy(result.getStrategy())
                .products(products)
                .totalCount(products.size())
                .processingTimeMs(System.currentTimeMillis() - startTime)
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Products most similar to the given one, with their cosine scores.
     *
     * GET /api/recommendations/products/{productId}/similar?limit=5
     */
    @GetMapping("/products/{productId}/similar")
    public ResponseEntity<List<SimilarProduct>> getSimilarProducts(
            @PathVariable String productId,
            @RequestParam(required = false) Integer limit) {
        return ResponseEntity.ok(similarityIndex.scoredNeighbors(productId, resolveLimit(limit)));
    }

    private int resolveLimit(Integer limit) {
        RecommendationConfig.Personalization personalization = config.getPersonalization();
        if (limit == null) {
            return personalization.getDefaultLimit();
        }
        if (limit <= 0) {
            throw RecommendationException.invalidArgument("limit must be positive, got " + limit);
        }
        return Math.min(limit, personalization.getMaxLimit());
    }
}
