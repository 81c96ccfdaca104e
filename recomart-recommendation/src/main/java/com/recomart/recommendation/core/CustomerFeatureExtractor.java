package com.recomart.recommendation.core;

import com.recomart.recommendation.dto.CustomerFeature;
import com.recomart.recommendation.dto.PurchaseStats;
import com.recomart.recommendation.store.RecommendationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates a customer's activity into the four segmentation features.
 * A customer without records yields an all-zero feature.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerFeatureExtractor {

    private final RecommendationStore store;

    public CustomerFeature extract(String customerId) {
        int interactionCount = store.countCustomerInteractions(customerId);
        PurchaseStats stats = store.getCustomerPurchaseStats(customerId);
        if (stats == null) {
            stats = PurchaseStats.EMPTY;
        }

        return new CustomerFeature(
                customerId,
                interactionCount,
                stats.purchaseCount(),
                stats.totalSpent(),
                stats.activeMonths());
    }

    /**
     * Features for every customer known to the store, in the store's order.
     */
    public List<CustomerFeature> extractAll() {
        List<String> customerIds = store.getCustomerIds();
        List<CustomerFeature> features = new ArrayList<>(customerIds.size());
        for (String customerId : customerIds) {
            features.add(extract(customerId));
        }
        log.debug("Extracted features for {} customers", features.size());
        return features;
    }
}
