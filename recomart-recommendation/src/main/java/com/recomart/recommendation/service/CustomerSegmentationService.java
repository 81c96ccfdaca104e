package com.recomart.recommendation.service;

import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.core.CustomerFeatureExtractor;
import com.recomart.recommendation.core.SegmentationEngine;
import com.recomart.recommendation.dto.CustomerFeature;
import com.recomart.recommendation.dto.SegmentationRunSummary;
import com.recomart.recommendation.exception.RecommendationException;
import com.recomart.recommendation.store.RecommendationStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Batch job that re-segments every customer and stores the labels
 * used by the segment tier of the recommendation waterfall.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CustomerSegmentationService {

    private final CustomerFeatureExtractor featureExtractor;
    private final SegmentationEngine segmentationEngine;
    private final RecommendationStore store;
    private final RecommendationConfig config;

    private final AtomicBoolean segmentationInProgress = new AtomicBoolean(false);
    private final AtomicReference<SegmentationRunSummary> lastRun = new AtomicReference<>();

    @Scheduled(cron = "${recomart.recommendation.segmentation.cron:0 0 3 * * *}")
    public void scheduledSegmentation() {
        if (!config.getSegmentation().isScheduleEnabled()) {
            return;
        }
        log.info("Starting scheduled customer segmentation");
        try {
            runSegmentation(config.getSegmentation().getClusters());
        } catch (RecommendationException e) {
            log.warn("Scheduled segmentation skipped: {} [{}]", e.getMessage(), e.getErrorCode());
        }
    }

    /**
     * Cluster all customers into {@code k} segments and persist the labels.
     *
     * @throws RecommendationException INVALID_ARGUMENT for non-positive k,
     *                                 SEGMENTATION_IN_PROGRESS when a run is already active
     */
    public SegmentationRunSummary runSegmentation(int k) {
        if (k <= 0) {
            throw RecommendationException.invalidArgument("Number of segments must be positive, got " + k);
        }
        if (!segmentationInProgress.compareAndSet(false, true)) {
            log.warn("Segmentation already in progress, rejecting request");
            throw RecommendationException.segmentationInProgress();
        }

        try {
            LocalDateTime startedAt = LocalDateTime.now();
            long startTime = System.currentTimeMillis();

            List<CustomerFeature> features = featureExtractor.extractAll();
            Map<String, Integer> sizes = new TreeMap<>();
            if (features.isEmpty()) {
                log.info("No customers to segment");
            } else {
                Map<String, String> assignments = segmentationEngine.run(features, k);
                store.saveSegmentAssignments(assignments);
                assignments.values().forEach(label -> sizes.merge(label, 1, Integer::sum));
            }

            SegmentationRunSummary summary = SegmentationRunSummary.builder()
                    .customers(features.size())
                    .requestedClusters(k)
                    .segmentSizes(sizes)
                    .startedAt(startedAt)
                    .durationMs(System.currentTimeMillis() - startTime)
                    .build();
            lastRun.set(summary);

            log.info("Segmented {} customers into {} segments in {}ms: {}",
                    summary.getCustomers(), sizes.size(), summary.getDurationMs(), sizes);
            return summary;
        } finally {
            segmentationInProgress.set(false);
        }
    }

    public Optional<SegmentationRunSummary> getLastRun() {
        return Optional.ofNullable(lastRun.get());
    }

    public boolean isSegmentationInProgress() {
        return segmentationInProgress.get();
    }

    public Map<String, Long> getSegmentSizes() {
        return store.countCustomersBySegment();
    }
}
