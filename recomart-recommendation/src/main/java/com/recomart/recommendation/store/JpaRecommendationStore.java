package com.recomart.recommendation.store;

import com.recomart.customer.entity.Purchase;
import com.recomart.customer.repository.CustomerRepository;
import com.recomart.customer.repository.InteractionRepository;
import com.recomart.customer.repository.PurchaseRepository;
import com.recomart.product.entity.Product;
import com.recomart.product.repository.ProductRepository;
import com.recomart.recommendation.dto.ProductText;
import com.recomart.recommendation.dto.PurchaseStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * {@link RecommendationStore} backed by the product and customer JPA repositories.
 * All lookups go through parameterized JPQL.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaRecommendationStore implements RecommendationStore {

    private final ProductRepository productRepository;
    private final CustomerRepository customerRepository;
    private final InteractionRepository interactionRepository;
    private final PurchaseRepository purchaseRepository;

    @Override
    public List<ProductText> getProductTexts() {
        return productRepository.findAllWithTagsInInsertionOrder().stream()
                .map(JpaRecommendationStore::toProductText)
                .toList();
    }

    @Override
    public Optional<ProductText> getProductText(String productId) {
        return productRepository.findByProductIdWithTags(productId)
                .map(JpaRecommendationStore::toProductText);
    }

    @Override
    public List<String> getCustomerInteractions(String customerId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return interactionRepository.findRecentProductIds(customerId, PageRequest.of(0, limit));
    }

    @Override
    public int countCustomerInteractions(String customerId) {
        return Math.toIntExact(interactionRepository.countByCustomerId(customerId));
    }

    @Override
    public PurchaseStats getCustomerPurchaseStats(String customerId) {
        List<Purchase> purchases = purchaseRepository.findByCustomerId(customerId);
        if (purchases.isEmpty()) {
            return PurchaseStats.EMPTY;
        }

        BigDecimal total = BigDecimal.ZERO;
        Set<YearMonth> months = new HashSet<>();
        for (Purchase purchase : purchases) {
            if (purchase.getAmount() != null) {
                total = total.add(purchase.getAmount());
            }
            if (purchase.getPurchasedAt() != null) {
                months.add(YearMonth.from(purchase.getPurchasedAt()));
            }
        }
        return new PurchaseStats(purchases.size(), total.doubleValue(), months.size());
    }

    @Override
    public List<String> getProductsByPopularity(int topN) {
        if (topN <= 0) {
            return List.of();
        }
        return productRepository.findProductIdsByPopularity(PageRequest.of(0, topN));
    }

    @Override
    public List<String> getSegmentPurchaseRanking(String segment, int topN) {
        if (topN <= 0 || segment == null) {
            return List.of();
        }
        return purchaseRepository.findTopProductIdsBySegment(segment, PageRequest.of(0, topN));
    }

    @Override
    public boolean customerExists(String customerId) {
        return customerRepository.existsByCustomerId(customerId);
    }

    @Override
    public Optional<String> getCustomerSegment(String customerId) {
        return customerRepository.findSegmentByCustomerId(customerId);
    }

    @Override
    public List<String> getCustomerIds() {
        return customerRepository.findAllCustomerIds();
    }

    @Override
    public Map<String, Long> countCustomersBySegment() {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (Object[] row : customerRepository.countBySegment()) {
            counts.put((String) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    @Override
    @Transactional
    public void saveSegmentAssignments(Map<String, String> assignments) {
        int updated = 0;
        for (Map.Entry<String, String> entry : assignments.entrySet()) {
            updated += customerRepository.updateSegment(entry.getKey(), entry.getValue());
        }
        if (updated != assignments.size()) {
            log.warn("Segment assignment touched {} of {} customers; the rest no longer exist",
                    updated, assignments.size());
        }
        log.info("Saved segment assignments for {} customers", updated);
    }

    private static ProductText toProductText(Product product) {
        return new ProductText(product.getProductId(), product.getSearchableText());
    }
}
