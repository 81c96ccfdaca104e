package com.recomart.recommendation.service;

import com.recomart.product.event.ProductChangedEvent;
import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.core.SimilarityIndex;
import com.recomart.recommendation.dto.ProductText;
import com.recomart.recommendation.exception.RecommendationException;
import com.recomart.recommendation.store.RecommendationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps the in-memory similarity index in step with the catalog.
 * Full rebuilds run on startup and on demand; single products are refreshed
 * after each committed catalog write. A refresh that lands while a rebuild is
 * reading the catalog is replayed once the rebuilt index is published.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProductIndexingService {

    private final RecommendationStore store;
    private final SimilarityIndex similarityIndex;
    private final RecommendationConfig config;

    private final AtomicBoolean indexingInProgress = new AtomicBoolean(false);
    private final Set<String> refreshedDuringRebuild = ConcurrentHashMap.newKeySet();
    private volatile LocalDateTime lastRebuiltAt;

    /**
     * Build the index on application startup if configured.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (config.getIndexing().isOnStartup()) {
            log.info("Building similarity index on application startup");
            rebuildIndex();
        }
    }

    /**
     * Rebuild the index from every catalog product.
     *
     * @return Number of products indexed
     * @throws RecommendationException INDEXING_IN_PROGRESS when a rebuild is already running
     */
    public int rebuildIndex() {
        if (!indexingInProgress.compareAndSet(false, true)) {
            log.warn("Index rebuild already in progress, rejecting request");
            throw RecommendationException.indexingInProgress();
        }

        try {
            long startTime = System.currentTimeMillis();
            List<ProductText> products = store.getProductTexts();
            similarityIndex.rebuild(products);
            int replayed = replayRefreshedProducts();
            lastRebuiltAt = LocalDateTime.now();

            if (replayed > 0) {
                log.info("Replayed {} product refreshes received during the rebuild", replayed);
            }

            log.info("Similarity index rebuilt in {}ms with {} products",
                    System.currentTimeMillis() - startTime, similarityIndex.size());
            return similarityIndex.size();
        } finally {
            indexingInProgress.set(false);
        }
    }

    /**
     * Refresh one product once the catalog write that changed it has committed.
     */
    @TransactionalEventListener(fallbackExecution = true)
    public void onProductChanged(ProductChangedEvent event) {
        // Recorded before it is applied, so a rebuild that swaps in an older catalog afterwards replays it.
        if (indexingInProgress.get()) {
            refreshedDuringRebuild.add(event.productId());
        }

        if (event.changeType() == ProductChangedEvent.ChangeType.DELETED) {
            similarityIndex.remove(event.productId());
            return;
        }
        refresh(event.productId());
    }

    private void refresh(String productId) {
        Optional<ProductText> product = store.getProductText(productId);
        if (product.isPresent()) {
            similarityIndex.upsert(product.get().productId(), product.get().text());
        } else {
            log.debug("Product {} vanished before indexing, removing it", productId);
            similarityIndex.remove(productId);
        }
    }

    private int replayRefreshedProducts() {
        int replayed = 0;
        for (String productId : refreshedDuringRebuild) {
            refreshedDuringRebuild.remove(productId);
            refresh(productId);
            replayed++;
        }
        return replayed;
    }

    public boolean isIndexingInProgress() {
        return indexingInProgress.get();
    }

    public LocalDateTime getLastRebuiltAt() {
        return lastRebuiltAt;
    }

    public int getIndexedProductCount() {
        return similarityIndex.size();
    }
}
