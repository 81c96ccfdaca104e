package com.recomart.recommendation.controller;

import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.dto.SegmentationRunSummary;
import com.recomart.recommendation.service.CustomerSegmentationService;
import com.recomart.recommendation.service.ProductIndexingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Internal controller for the recommendation batch jobs.
 * Protected by API key - meant for operators and scheduled pipelines.
 *
 * Endpoints:
 * - POST /api/internal/recommendation/index - Rebuild the similarity index
 * - POST /api/internal/recommendation/segments?k=4 - Re-segment all customers
 * - GET /api/internal/recommendation/status - Index and segmentation status
 */
@Slf4j
@RestController
@RequestMapping("/api/internal/recommendation")
@RequiredArgsConstructor
public class RecommendationAdminController {

    private final ProductIndexingService productIndexingService;
    private final CustomerSegmentationService customerSegmentationService;
    private final RecommendationConfig config;

    @Value("${recomart.internal.api-key:}")
    private String internalApiKey;

    /**
     * POST /api/internal/recommendation/index
     */
    @PostMapping("/index")
    public ResponseEntity<Map<String, Object>> rebuildIndex(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey) {

        if (!isValidApiKey(apiKey)) {
            log.warn("Unauthorized index rebuild attempt - invalid API key");
            return unauthorized();
        }

        log.info("Operator triggered similarity index rebuild");
        int indexed = productIndexingService.rebuildIndex();

        return ResponseEntity.ok(Map.of(
                "success", true,
                "indexedProducts", indexed
        ));
    }

    /**
     * POST /api/internal/recommendation/segments?k=4
     */
    @PostMapping("/segments")
    public ResponseEntity<Map<String, Object>> runSegmentation(
            @RequestParam(required = false) Integer k,
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey) {

        if (!isValidApiKey(apiKey)) {
            log.warn("Unauthorized segmentation attempt - invalid API key");
            return unauthorized();
        }

        int clusters = k != null ? k : config.getSegmentation().getClusters();
        log.info("Operator triggered customer segmentation with k={}", clusters);
        SegmentationRunSummary summary = customerSegmentationService.runSegmentation(clusters);

        return ResponseEntity.ok(Map.of(
                "success", true,
                "summary", summary
        ));
    }

    /**
     * GET /api/internal/recommendation/status
     */
    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> getStatus(
            @RequestHeader(value = "X-Internal-Api-Key", required = false) String apiKey) {

        if (!isValidApiKey(apiKey)) {
            return unauthorized();
        }

        // LinkedHashMap since lastRebuiltAt and lastSegmentation may be null
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("indexedProducts", productIndexingService.getIndexedProductCount());
        status.put("indexingInProgress", productIndexingService.isIndexingInProgress());
        status.put("lastRebuiltAt", productIndexingService.getLastRebuiltAt());
        status.put("segmentationInProgress", customerSegmentationService.isSegmentationInProgress());
        status.put("segmentSizes", customerSegmentationService.getSegmentSizes());
        status.put("lastSegmentation", customerSegmentationService.getLastRun().orElse(null));
        return ResponseEntity.ok(status);
    }

    private ResponseEntity<Map<String, Object>> unauthorized() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(Map.of(
                "success", false,
                "message", "Invalid or missing API key"
        ));
    }

    private boolean isValidApiKey(String apiKey) {
        if (internalApiKey == null || internalApiKey.isBlank()) {
            log.warn("Internal API key not configured - rejecting request");
            return false;
        }
        return internalApiKey.equals(apiKey);
    }
}
