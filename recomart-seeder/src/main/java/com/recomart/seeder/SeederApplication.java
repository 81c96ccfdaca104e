package com.recomart.seeder;

import com.recomart.recommendation.dto.RecommendationResult;
import com.recomart.recommendation.dto.SegmentationRunSummary;
import com.recomart.recommendation.core.RecommendationEngine;
import com.recomart.recommendation.service.CustomerSegmentationService;
import com.recomart.recommendation.service.ProductIndexingService;
import com.recomart.seeder.service.SampleDataSeederService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;

/**
 * Standalone application that loads the sample catalog and customers, then runs
 * indexing, segmentation and recommendations once and prints the results.
 *
 * Usage:
 *   mvn spring-boot:run -pl recomart-seeder
 *
 *   # Against PostgreSQL instead of the in-memory database
 *   SPRING_DATASOURCE_URL=jdbc:postgresql://localhost:5432/recomart mvn spring-boot:run -pl recomart-seeder
 */
@SpringBootApplication(scanBasePackages = "com.recomart")
@EntityScan(basePackages = "com.recomart")
@EnableJpaRepositories(basePackages = "com.recomart")
@RequiredArgsConstructor
@Slf4j
public class SeederApplication implements CommandLineRunner {

    private final SampleDataSeederService sampleDataSeederService;
    private final ProductIndexingService productIndexingService;
    private final CustomerSegmentationService customerSegmentationService;
    private final RecommendationEngine recommendationEngine;

    @Value("${seeder.segments:2}")
    private int segments;

    @Value("${seeder.recommendations.limit:5}")
    private int limit;

    public static void main(String[] args) {
        SpringApplication.run(SeederApplication.class, args);
    }

    @Override
    public void run(String... args) {
        log.info("=".repeat(60));
        log.info("RecoMart Data Seeder");
        log.info("=".repeat(60));

        long startTime = System.currentTimeMillis();

        int products = sampleDataSeederService.seedProducts();
        int customers = sampleDataSeederService.seedCustomers();
        int indexed = productIndexingService.rebuildIndex();
        SegmentationRunSummary summary = customerSegmentationService.runSegmentation(segments);

        log.info("Products created: {}, customers created: {}, products indexed: {}",
                products, customers, indexed);
        log.info("Segments: {}", summary.getSegmentSizes());

        for (String customerId : sampleDataSeederService.getSampleCustomerIds()) {
            RecommendationResult result = recommendationEngine.recommend(customerId, limit);
            log.info("Recommendations for {} ({}): {}",
                    customerId, result.getStrategy(), result.getProductIds());
        }

        log.info("=".repeat(60));
        log.info("Seeding completed in {} seconds",
                String.format("%.1f", (System.currentTimeMillis() - startTime) / 1000.0));
        log.info("=".repeat(60));
    }
}
