package com.recomart.recommendation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Outcome of one segmentation batch run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SegmentationRunSummary {

    private int customers;

    private int requestedClusters;

    /** Segment label -> number of customers assigned to it */
    private Map<String, Integer> segmentSizes;

    private LocalDateTime startedAt;

    private long durationMs;
}
