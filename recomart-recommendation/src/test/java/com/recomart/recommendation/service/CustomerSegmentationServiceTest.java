package com.recomart.recommendation.service;

import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.core.CustomerFeatureExtractor;
import com.recomart.recommendation.core.SegmentationEngine;
import com.recomart.recommendation.dto.CustomerFeature;
import com.recomart.recommendation.dto.SegmentationRunSummary;
import com.recomart.recommendation.exception.RecommendationException;
import com.recomart.recommendation.store.RecommendationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CustomerSegmentationServiceTest {

    @Mock
    private CustomerFeatureExtractor featureExtractor;

    @Mock
    private RecommendationStore store;

    private RecommendationConfig config;
    private CustomerSegmentationService service;

    @BeforeEach
    void setUp() {
        config = new RecommendationConfig();
        service = new CustomerSegmentationService(featureExtractor, new SegmentationEngine(42L, 100), store, config);
    }

    @Test
    @SuppressWarnings("unchecked")
    void runPersistsAssignmentsAndKeepsSummary() {
        when(featureExtractor.extractAll()).thenReturn(List.of(
                new CustomerFeature("CUST001", 2, 1, 99.99, 1),
                new CustomerFeature("CUST002", 2, 0, 0.0, 0),
                new CustomerFeature("CUST003", 2, 0, 0.0, 0)));

        SegmentationRunSummary summary = service.runSegmentation(2);

        ArgumentCaptor<Map<String, String>> captor = ArgumentCaptor.forClass(Map.class);
        verify(store).saveSegmentAssignments(captor.capture());
        assertThat(captor.getValue()).containsExactly(
                Map.entry("CUST001", "segment_0"),
                Map.entry("CUST002", "segment_1"),
                Map.entry("CUST003", "segment_1"));

        assertEquals(3, summary.getCustomers());
        assertEquals(2, summary.getRequestedClusters());
        assertEquals(Map.of("segment_0", 1, "segment_1", 2), summary.getSegmentSizes());
        assertThat(service.getLastRun()).contains(summary);
        assertFalse(service.isSegmentationInProgress());
    }

    @Test
    void noCustomersIsAnEmptyRun() {
        when(featureExtractor.extractAll()).thenReturn(List.of());

        SegmentationRunSummary summary = service.runSegmentation(4);

        assertEquals(0, summary.getCustomers());
        assertThat(summary.getSegmentSizes()).isEmpty();
        verify(store, never()).saveSegmentAssignments(anyMap());
    }

    @Test
    void nonPositiveKIsRejectedBeforeAnyWork() {
        RecommendationException ex = assertThrows(RecommendationException.class, () -> service.runSegmentation(0));

        assertEquals("INVALID_ARGUMENT", ex.getErrorCode());
        verifyNoInteractions(featureExtractor, store);
    }

    @Test
    void concurrentRunIsRejected() {
        when(featureExtractor.extractAll()).thenAnswer(invocation -> {
            RecommendationException nested = assertThrows(RecommendationException.class,
                    () -> service.runSegmentation(2));
            assertEquals("SEGMENTATION_IN_PROGRESS", nested.getErrorCode());
            return List.of();
        });

        service.runSegmentation(2);

        assertFalse(service.isSegmentationInProgress());
    }

    @Test
    void scheduledRunIsSkippedWhenDisabled() {
        config.getSegmentation().setScheduleEnabled(false);

        service.scheduledSegmentation();

        verifyNoInteractions(featureExtractor, store);
    }

    @Test
    void scheduledRunUsesConfiguredClusterCount() {
        config.getSegmentation().setScheduleEnabled(true);
        config.getSegmentation().setClusters(3);
        when(featureExtractor.extractAll()).thenReturn(List.of());

        service.scheduledSegmentation();

        assertThat(service.getLastRun()).hasValueSatisfying(run -> assertEquals(3, run.getRequestedClusters()));
    }

    @Test
    void failedRunReleasesGuard() {
        when(featureExtractor.extractAll()).thenReturn(List.of(new CustomerFeature("CUST001", 1, 0, 0.0, 0)));
        doThrow(new IllegalStateException("db down")).when(store).saveSegmentAssignments(any());

        assertThrows(IllegalStateException.class, () -> service.runSegmentation(1));
        assertFalse(service.isSegmentationInProgress());
    }
}
