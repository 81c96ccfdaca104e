package com.recomart.recommendation.core;

import com.recomart.recommendation.config.RecommendationConfig;
import com.recomart.recommendation.dto.CustomerFeature;
import com.recomart.recommendation.exception.RecommendationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

/**
 * Groups customers into {@code k} behavioural segments with k-means.
 *
 * Features are standardized per dimension over the batch before clustering, so that
 * spend does not drown out counts. Centroids are seeded with k-means++ from a
 * {@link Random} created with the configured seed on every run: the same batch and
 * seed always give the same assignment.
 */
@Slf4j
@Component
public class SegmentationEngine {

    public static final String LABEL_PREFIX = "segment_";

    private final long seed;
    private final int maxIterations;

    @Autowired
    public SegmentationEngine(RecommendationConfig config) {
        this(config.getSegmentation().getSeed(), config.getSegmentation().getMaxIterations());
    }

    public SegmentationEngine(long seed, int maxIterations) {
        if (maxIterations <= 0) {
            throw RecommendationException.invalidArgument("maxIterations must be positive, got " + maxIterations);
        }
        this.seed = seed;
        this.maxIterations = maxIterations;
    }

    /**
     * Assign every customer of the batch to exactly one segment.
     *
     * @return customer id to label {@code segment_0..segment_{k-1}}, in input order.
     * Labels are numbered by first appearance over the input, so fewer than k labels
     * appear when clusters coincide.
     */
    public Map<String, String> run(List<CustomerFeature> features, int k) {
        validate(features, k);

        double[][] points = standardize(features);
        Random random = new Random(seed);
        double[][] centroids = chooseInitialCentroids(points, k, random);

        int[] assignment = new int[points.length];
        Arrays.fill(assignment, -1);

        int iteration = 0;
        boolean changed = true;
        while (changed && iteration < maxIterations) {
            changed = assign(points, centroids, assignment);
            updateCentroids(points, centroids, assignment);
            iteration++;
        }
        if (changed) {
            log.debug("k-means stopped at iteration cap {} for {} customers", maxIterations, points.length);
        } else {
            log.debug("k-means converged after {} iterations for {} customers", iteration, points.length);
        }

        return relabel(features, assignment);
    }

    private void validate(List<CustomerFeature> features, int k) {
        if (k <= 0) {
            throw RecommendationException.invalidArgument("Number of segments must be positive, got " + k);
        }
        if (features == null || features.isEmpty()) {
            throw RecommendationException.invalidArgument("Cannot segment an empty customer batch");
        }
        Set<String> seen = new HashSet<>();
        for (CustomerFeature feature : features) {
            if (feature.customerId() == null) {
                throw RecommendationException.invalidArgument("Customer feature without a customer id");
            }
            if (!seen.add(feature.customerId())) {
                throw RecommendationException.invalidArgument("Duplicate customer id in batch: " + feature.customerId());
            }
            for (double value : feature.toArray()) {
                if (!Double.isFinite(value)) {
                    throw RecommendationException.invalidArgument(
                            "Non-finite feature value for customer " + feature.customerId());
                }
            }
        }
    }

    /**
     * z-score per dimension using the population standard deviation. A dimension
     * with no spread maps to 0 for every customer.
     */
    static double[][] standardize(List<CustomerFeature> features) {
        int n = features.size();
        int dims = CustomerFeature.DIMENSIONS;
        double[][] points = new double[n][];
        for (int i = 0; i < n; i++) {
            points[i] = features.get(i).toArray();
        }

        for (int d = 0; d < dims; d++) {
            double mean = 0.0;
            for (double[] point : points) {
                mean += point[d];
            }
            mean /= n;

            double variance = 0.0;
            for (double[] point : points) {
                double diff = point[d] - mean;
                variance += diff * diff;
            }
            double std = Math.sqrt(variance / n);

            for (double[] point : points) {
                point[d] = std == 0.0 ? 0.0 : (point[d] - mean) / std;
            }
        }
        return points;
    }

    /**
     * k-means++: the first centroid is uniform, each next one is drawn with
     * probability proportional to its squared distance from the nearest chosen
     * centroid. Points already at distance 0 are never drawn unless every point is.
     */
    private static double[][] chooseInitialCentroids(double[][] points, int k, Random random) {
        double[][] centroids = new double[k][];
        centroids[0] = points[random.nextInt(points.length)].clone();

        double[] distances = new double[points.length];
        for (int j = 0; j < points.length; j++) {
            distances[j] = squaredDistance(points[j], centroids[0]);
        }

        for (int i = 1; i < k; i++) {
            double total = 0.0;
            for (double distance : distances) {
                total += distance;
            }

            int selected;
            if (total == 0.0) {
                selected = random.nextInt(points.length);
            } else {
                double r = random.nextDouble() * total;
                selected = -1;
                int lastPositive = -1;
                for (int j = 0; j < points.length; j++) {
                    if (distances[j] == 0.0) {
                        continue;
                    }
                    lastPositive = j;
                    r -= distances[j];
                    if (r <= 0.0) {
                        selected = j;
                        break;
                    }
                }
                // rounding can leave r slightly above zero after the last point
                if (selected == -1) {
                    selected = lastPositive;
                }
            }

            centroids[i] = points[selected].clone();
            for (int j = 0; j < points.length; j++) {
                distances[j] = Math.min(distances[j], squaredDistance(points[j], centroids[i]));
            }
        }
        return centroids;
    }

    private static boolean assign(double[][] points, double[][] centroids, int[] assignment) {
        boolean changed = false;
        for (int p = 0; p < points.length; p++) {
            int nearest = 0;
            double best = squaredDistance(points[p], centroids[0]);
            for (int c = 1; c < centroids.length; c++) {
                double distance = squaredDistance(points[p], centroids[c]);
                if (distance < best) {
                    best = distance;
                    nearest = c;
                }
            }
            if (assignment[p] != nearest) {
                assignment[p] = nearest;
                changed = true;
            }
        }
        return changed;
    }

    private static void updateCentroids(double[][] points, double[][] centroids, int[] assignment) {
        int dims = points[0].length;
        double[][] sums = new double[centroids.length][dims];
        int[] counts = new int[centroids.length];

        for (int p = 0; p < points.length; p++) {
            int c = assignment[p];
            counts[c]++;
            for (int d = 0; d < dims; d++) {
                sums[c][d] += points[p][d];
            }
        }

        for (int c = 0; c < centroids.length; c++) {
            if (counts[c] == 0) {
                continue;  // empty cluster keeps its centroid
            }
            for (int d = 0; d < dims; d++) {
                centroids[c][d] = sums[c][d] / counts[c];
            }
        }
    }

    private static Map<String, String> relabel(List<CustomerFeature> features, int[] assignment) {
        Map<Integer, String> labels = new HashMap<>();
        Map<String, String> result = new LinkedHashMap<>();
        for (int p = 0; p < assignment.length; p++) {
            String label = labels.computeIfAbsent(assignment[p], c -> LABEL_PREFIX + labels.size());
            result.put(features.get(p).customerId(), label);
        }
        return result;
    }

    static double squaredDistance(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double diff = a[i] - b[i];
            sum += diff * diff;
        }
        return sum;
    }
}
