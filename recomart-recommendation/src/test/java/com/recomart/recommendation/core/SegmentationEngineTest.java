package com.recomart.recommendation.core;

import com.recomart.recommendation.dto.CustomerFeature;
import com.recomart.recommendation.exception.RecommendationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SegmentationEngineTest {

    private final SegmentationEngine engine = new SegmentationEngine(42L, 100);

    private static CustomerFeature low(String id) {
        return new CustomerFeature(id, 0, 0, 0.0, 0);
    }

    private static CustomerFeature high(String id) {
        return new CustomerFeature(id, 10, 10, 10.0, 10);
    }

    @Test
    void wellSeparatedGroupsGetDistinctSegments() {
        List<CustomerFeature> features = List.of(
                low("a1"), high("b1"), low("a2"), high("b2"), low("a3"), high("b3"));

        Map<String, String> segments = engine.run(features, 2);

        assertEquals("segment_0", segments.get("a1"));
        assertEquals("segment_0", segments.get("a2"));
        assertEquals("segment_0", segments.get("a3"));
        assertEquals("segment_1", segments.get("b1"));
        assertEquals("segment_1", segments.get("b2"));
        assertEquals("segment_1", segments.get("b3"));
    }

    @Test
    void labelsFollowFirstAppearanceOrder() {
        List<CustomerFeature> features = List.of(
                high("b1"), low("a1"), high("b2"), low("a2"));

        Map<String, String> segments = engine.run(features, 2);

        assertEquals("segment_0", segments.get("b1"));
        assertEquals("segment_1", segments.get("a1"));
    }

    @Test
    void resultPreservesInputOrderAndCoversEveryCustomer() {
        List<CustomerFeature> features = List.of(
                high("z"), low("m"), high("a"), low("q"));

        Map<String, String> segments = engine.run(features, 2);

        assertThat(segments.keySet()).containsExactly("z", "m", "a", "q");
    }

    @Test
    void sameSeedAndBatchGiveSameAssignment() {
        List<CustomerFeature> features = randomFeatures(40, new Random(7));

        Map<String, String> first = engine.run(features, 4);
        Map<String, String> second = new SegmentationEngine(42L, 100).run(features, 4);

        assertEquals(first, second);
    }

    @Test
    void neverMoreLabelsThanK() {
        List<CustomerFeature> features = randomFeatures(30, new Random(11));

        Map<String, String> segments = engine.run(features, 3);

        assertEquals(30, segments.size());
        assertThat(new HashSet<>(segments.values())).hasSizeLessThanOrEqualTo(3)
                .allSatisfy(label -> assertThat(label).matches("segment_[0-2]"));
    }

    @Test
    void kLargerThanDistinctPointsCollapsesToDistinctGroups() {
        List<CustomerFeature> features = List.of(
                low("a1"), low("a2"), high("b1"), high("b2"));

        Map<String, String> segments = engine.run(features, 3);

        assertThat(new HashSet<>(segments.values())).containsExactlyInAnyOrder("segment_0", "segment_1");
        assertEquals(segments.get("a1"), segments.get("a2"));
        assertEquals(segments.get("b1"), segments.get("b2"));
    }

    @Test
    void identicalCustomersShareOneSegment() {
        List<CustomerFeature> features = List.of(
                new CustomerFeature("c1", 3, 1, 50.0, 1),
                new CustomerFeature("c2", 3, 1, 50.0, 1),
                new CustomerFeature("c3", 3, 1, 50.0, 1));

        Map<String, String> segments = engine.run(features, 2);

        assertThat(segments.values()).containsOnly("segment_0");
    }

    @Test
    void singleClusterPutsEveryoneInSegmentZero() {
        Map<String, String> segments = engine.run(randomFeatures(10, new Random(3)), 1);

        assertThat(segments.values()).containsOnly("segment_0");
    }

    @Test
    void standardizationUsesPopulationDeviation() {
        double[][] points = SegmentationEngine.standardize(List.of(low("a"), high("b")));

        assertArrayEquals(new double[]{-1, -1, -1, -1}, points[0], 1e-9);
        assertArrayEquals(new double[]{1, 1, 1, 1}, points[1], 1e-9);
    }

    @Test
    void constantDimensionStandardizesToZero() {
        double[][] points = SegmentationEngine.standardize(List.of(
                new CustomerFeature("a", 5, 0, 0.0, 0),
                new CustomerFeature("b", 5, 2, 0.0, 0)));

        assertEquals(0.0, points[0][0]);
        assertEquals(0.0, points[1][0]);
        assertEquals(-1.0, points[0][1], 1e-9);
    }

    @Test
    void invalidInputIsRejected() {
        assertInvalid(() -> engine.run(List.of(low("a")), 0));
        assertInvalid(() -> engine.run(List.of(), 2));
        assertInvalid(() -> engine.run(List.of(low("a"), high("a")), 2));
        assertInvalid(() -> engine.run(List.of(new CustomerFeature("a", 1, 1, Double.NaN, 1)), 1));
    }

    private static void assertInvalid(org.junit.jupiter.api.function.Executable call) {
        RecommendationException ex = assertThrows(RecommendationException.class, call);
        assertEquals("INVALID_ARGUMENT", ex.getErrorCode());
    }

    private static List<CustomerFeature> randomFeatures(int count, Random random) {
        List<CustomerFeature> features = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            features.add(new CustomerFeature(
                    "CUST" + i,
                    random.nextInt(50),
                    random.nextInt(10),
                    random.nextDouble() * 1000,
                    random.nextInt(12)));
        }
        return features;
    }
}
