package com.recomart.recommendation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for recommendations and customer segmentation.
 * Maps to recomart.recommendation.* properties in application.properties.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "recomart.recommendation")
public class RecommendationConfig {

    private Vector vector = new Vector();
    private Personalization personalization = new Personalization();
    private Segmentation segmentation = new Segmentation();
    private Indexing indexing = new Indexing();

    @Data
    public static class Vector {
        /** Length of every product feature vector */
        private int dimensions = 128;
        /** Salt mixed into the feature hash; changing it reshuffles all buckets */
        private int hashSalt = 0x5EED;
    }

    @Data
    public static class Personalization {
        /** Number of most recent interactions used as similarity seeds */
        private int recentInteractions = 3;
        /** Recommendations returned when the caller gives no limit */
        private int defaultLimit = 5;
        /** Upper bound applied to caller-supplied limits */
        private int maxLimit = 50;
    }

    @Data
    public static class Segmentation {
        /** Number of clusters (k) for scheduled runs */
        private int clusters = 4;
        /** Seed for centroid initialization; fixed so that runs are reproducible */
        private long seed = 42L;
        /** Iteration cap for the assign/update loop */
        private int maxIterations = 100;
        /** Whether the cron-triggered run is active */
        private boolean scheduleEnabled = false;
    }

    @Data
    public static class Indexing {
        /** Whether to build the similarity index on application startup */
        private boolean onStartup = true;
    }
}
