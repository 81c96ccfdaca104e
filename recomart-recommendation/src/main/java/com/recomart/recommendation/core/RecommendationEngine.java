package com.recomart.recommendation.core;

import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.dto.RecommendationResult;
import com.recomart.recommendation.dto.RecommendationStrategy;
import com.recomart.recommendation.exception.RecommendationException;
import com.recomart.recommendation.store.RecommendationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recommendation waterfall:
 * 1. Personalized - products similar to the customer's latest interactions
 * 2. Segment - best sellers among customers of the same segment
 * 3. Popularity - catalog ranked by popularity score
 *
 * Each tier runs only when the one before it produced nothing. Customers the store
 * has never seen go straight to the popularity tier.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationEngine {

    private final RecommendationStore store;
    private final SimilarityIndex similarityIndex;
    private final RecommendationConfig config;

    public RecommendationResult recommend(String customerId, int topN) {
        if (topN <= 0) {
            throw RecommendationException.invalidArgument("topN must be positive, got " + topN);
        }

        if (!store.customerExists(customerId)) {
            log.debug("Cold start for unknown customer {}", customerId);
            return result(customerId, store.getProductsByPopularity(topN), RecommendationStrategy.POPULARITY);
        }

        List<String> personalized = personalized(customerId, topN);
        if (!personalized.isEmpty()) {
            return result(customerId, personalized, RecommendationStrategy.PERSONALIZED);
        }

        Optional<String> segment = store.getCustomerSegment(customerId);
        if (segment.isPresent()) {
            List<String> segmentRanking = store.getSegmentPurchaseRanking(segment.get(), topN);
            if (!segmentRanking.isEmpty()) {
                return result(customerId, segmentRanking, RecommendationStrategy.SEGMENT);
            }
        }

        return result(customerId, store.getProductsByPopularity(topN), RecommendationStrategy.POPULARITY);
    }

    /**
     * Union of the neighbours of each recent interaction, first-seen order, at most topN.
     * Interacted products that are missing from the index contribute nothing.
     */
    private List<String> personalized(String customerId, int topN) {
        int recent = config.getPersonalization().getRecentInteractions();
        Set<String> seeds = new LinkedHashSet<>(store.getCustomerInteractions(customerId, recent));

        Set<String> candidates = new LinkedHashSet<>();
        for (String seed : seeds) {
            if (!similarityIndex.contains(seed)) {
                log.debug("Skipping interaction with unindexed product {} for customer {}", seed, customerId);
                continue;
            }
            try {
                candidates.addAll(similarityIndex.nearestNeighbors(seed, topN));
            } catch (RecommendationException e) {
                // product removed from the index between contains() and the lookup
                if (!"PRODUCT_NOT_INDEXED".equals(e.getErrorCode())) {
                    throw e;
                }
                log.debug("Product {} left the index during lookup", seed);
            }
        }

        List<String> ranked = new ArrayList<>(candidates);
        return ranked.size() > topN ? List.copyOf(ranked.subList(0, topN)) : List.copyOf(ranked);
    }

    private RecommendationResult result(String customerId, List<String> productIds, RecommendationStrategy strategy) {
        log.debug("Recommending {} products to {} via {}", productIds.size(), customerId, strategy);
        return RecommendationResult.builder()
                .customerId(customerId)
                .productIds(productIds)
                .strategy(strategy)
                .build();
    }
}
