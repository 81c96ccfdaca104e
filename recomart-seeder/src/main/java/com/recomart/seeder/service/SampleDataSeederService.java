package com.recomart.seeder.service;

import com.recomart.common.enums.InteractionType;
import com.recomart.customer.dto.RecordInteractionRequest;
import com.recomart.customer.dto.RecordPurchaseRequest;
import com.recomart.customer.dto.UpdateCustomerRequest;
import com.recomart.customer.repository.CustomerRepository;
import com.recomart.customer.service.CustomerService;
import com.recomart.product.dto.CreateProductRequest;
import com.recomart.product.service.ProductService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;

/**
 * Loads a small sample catalog and two customers with some activity.
 * Existing products and customers are left untouched, so reruns do not duplicate activity.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SampleDataSeederService {

    private static final List<CreateProductRequest> SAMPLE_PRODUCTS = List.of(
            product("P1001", "Wireless Headphones", "Electronics", "99.99",
                    "Noise-cancelling over-ear headphones with long battery life",
                    List.of("audio", "wireless", "bluetooth"), 8.5),
            product("P1002", "Smartphone", "Electronics", "699.99",
                    "Android smartphone with a triple camera and OLED display",
                    List.of("mobile", "android", "camera"), 9.2),
            product("P1003", "Running Shoes", "Sports", "79.99",
                    "Lightweight running shoes with breathable mesh",
                    List.of("fitness", "running", "shoes"), 7.8)
    );

    private static final List<String> SAMPLE_CUSTOMER_IDS = List.of("CUST001", "CUST002");

    private final ProductService productService;
    private final CustomerService customerService;
    private final CustomerRepository customerRepository;

    /**
     * @return Number of products created
     */
    public int seedProducts() {
        int created = 0;
        for (CreateProductRequest request : SAMPLE_PRODUCTS) {
            if (productService.existsByProductId(request.getProductId())) {
                log.debug("Product {} already exists, skipping", request.getProductId());
                continue;
            }
            productService.createProduct(request);
            created++;
        }
        log.info("Seeded {} of {} sample products", created, SAMPLE_PRODUCTS.size());
        return created;
    }

    /**
     * @return Number of customers created
     */
    public int seedCustomers() {
        int created = 0;

        if (!customerRepository.existsByCustomerId("CUST001")) {
            customerService.updateProfile("CUST001", UpdateCustomerRequest.builder()
                    .name("John Doe").age(32).gender("M").location("New York").build());
            customerService.recordInteraction("CUST001", interaction("P1001", InteractionType.VIEW, 120));
            customerService.recordInteraction("CUST001", interaction("P1001", InteractionType.CART_ADD, 0));
            customerService.recordPurchase("CUST001", RecordPurchaseRequest.builder()
                    .productId("P1001").quantity(1).amount(new BigDecimal("99.99")).build());
            created++;
        }

        if (!customerRepository.existsByCustomerId("CUST002")) {
            customerService.updateProfile("CUST002", UpdateCustomerRequest.builder()
                    .name("Jane Smith").age(28).gender("F").location("San Francisco").build());
            customerService.recordInteraction("CUST002", interaction("P1002", InteractionType.VIEW, 180));
            customerService.recordInteraction("CUST002", interaction("P1003", InteractionType.WISHLIST, 0));
            created++;
        }

        log.info("Seeded {} of {} sample customers", created, SAMPLE_CUSTOMER_IDS.size());
        return created;
    }

    public List<String> getSampleCustomerIds() {
        return SAMPLE_CUSTOMER_IDS;
    }

    private static CreateProductRequest product(String productId, String name, String category, String price,
                                                String description, List<String> tags, double popularity) {
        return CreateProductRequest.builder()
                .productId(productId)
                .name(name)
                .category(category)
                .price(new BigDecimal(price))
                .description(description)
                .tags(tags)
                .popularityScore(popularity)
                .build();
    }

    private static RecordInteractionRequest interaction(String productId, InteractionType type, int durationSeconds) {
        return RecordInteractionRequest.builder()
                .productId(productId)
                .type(type)
                .durationSeconds(durationSeconds)
                .build();
    }
}
