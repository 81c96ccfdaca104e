package com.recomart.recommendation.store;

import com.recomart.recommendation.dto.ProductText;
import com.recomart.recommendation.dto.PurchaseStats;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read and write access the recommendation core needs from catalog and customer data.
 */
public interface RecommendationStore {

    /** Every catalog product as searchable text, in insertion order. */
    List<ProductText> getProductTexts();

    Optional<ProductText> getProductText(String productId);

    /** Product ids of the customer's latest interactions, most recent first. */
    List<String> getCustomerInteractions(String customerId, int limit);

    int countCustomerInteractions(String customerId);

    PurchaseStats getCustomerPurchaseStats(String customerId);

    /** Product ids by popularity score descending, ties by product id. */
    List<String> getProductsByPopularity(int topN);

    /** Product ids most purchased by customers of the segment, ties by product id. */
    List<String> getSegmentPurchaseRanking(String segment, int topN);

    boolean customerExists(String customerId);

    Optional<String> getCustomerSegment(String customerId);

    List<String> getCustomerIds();

    /** Segment size by label, for status reporting. */
    Map<String, Long> countCustomersBySegment();

    void saveSegmentAssignments(Map<String, String> assignments);
}
