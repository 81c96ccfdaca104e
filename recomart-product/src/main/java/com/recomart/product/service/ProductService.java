package com.recomart.product.service;

import com.recomart.product.dto.CreateProductRequest;
import com.recomart.product.dto.ProductDTO;
import com.recomart.product.dto.UpdateProductRequest;
import com.recomart.product.entity.Product;
import com.recomart.product.event.ProductChangedEvent;
import com.recomart.product.event.ProductChangedEvent.ChangeType;
import com.recomart.product.exception.ProductException;
import com.recomart.product.repository.ProductRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class ProductService {

    private final ProductRepository productRepository;
    private final ApplicationEventPublisher eventPublisher;

    @Transactional(readOnly = true)
    public Page<ProductDTO> getAllProducts(Pageable pageable) {
        return productRepository.findAll(pageable)
                .map(ProductDTO::fromEntity);
    }

    @Transactional(readOnly = true)
    public ProductDTO getProduct(String productId) {
        Product product = productRepository.findByProductIdWithTags(productId)
                .orElseThrow(() -> ProductException.productNotFound(productId));
        return ProductDTO.fromEntity(product);
    }

    @Transactional(readOnly = true)
    public boolean existsByProductId(String productId) {
        return productRepository.existsByProductId(productId);
    }

    @Transactional(readOnly = true)
    public Page<ProductDTO> getProductsByCategory(String category, Pageable pageable) {
        return productRepository.findByCategory(category, pageable)
                .map(ProductDTO::fromEntity);
    }

    /**
     * Fetch several products and return them in the order of the requested ids.
     * Unknown ids are skipped.
     */
    @Transactional(readOnly = true)
    public List<ProductDTO> getProductsByIds(Collection<String> productIds) {
        if (productIds == null || productIds.isEmpty()) {
            return List.of();
        }
        Map<String, Product> byId = productRepository.findByProductIdIn(productIds).stream()
                .collect(Collectors.toMap(Product::getProductId, Function.identity()));

        List<ProductDTO> ordered = new ArrayList<>();
        for (String productId : productIds) {
            Product product = byId.get(productId);
            if (product != null) {
                ordered.add(ProductDTO.fromEntity(product));
            }
        }
        return ordered;
    }

    @Transactional
    public ProductDTO createProduct(CreateProductRequest request) {
        if (productRepository.existsByProductId(request.getProductId())) {
            throw ProductException.productIdAlreadyExists(request.getProductId());
        }

        Product product = Product.builder()
                .productId(request.getProductId())
                .name(request.getName())
                .category(request.getCategory())
                .price(request.getPrice())
                .description(request.getDescription())
                .tags(request.getTags() != null ? new ArrayList<>(request.getTags()) : new ArrayList<>())
                .popularityScore(request.getPopularityScore() != null ? request.getPopularityScore() : 0.0)
                .build();

        product = productRepository.save(product);
        log.info("Created product: productId={}, name={}", product.getProductId(), product.getName());

        eventPublisher.publishEvent(new ProductChangedEvent(product.getProductId(), ChangeType.CREATED));
        return ProductDTO.fromEntity(product);
    }

    @Transactional
    public ProductDTO updateProduct(String productId, UpdateProductRequest request) {
        Product product = productRepository.findByProductIdWithTags(productId)
                .orElseThrow(() -> ProductException.productNotFound(productId));

        if (request.getName() != null) {
            product.setName(request.getName());
        }
        if (request.getCategory() != null) {
            product.setCategory(request.getCategory());
        }
        if (request.getPrice() != null) {
            product.setPrice(request.getPrice());
        }
        if (request.getDescription() != null) {
            product.setDescription(request.getDescription());
        }
        if (request.getTags() != null) {
            product.getTags().clear();
            product.getTags().addAll(request.getTags());
        }
        if (request.getPopularityScore() != null) {
            product.setPopularityScore(request.getPopularityScore());
        }

        product = productRepository.save(product);
        log.info("Updated product: productId={}", productId);

        eventPublisher.publishEvent(new ProductChangedEvent(productId, ChangeType.UPDATED));
        return ProductDTO.fromEntity(product);
    }

    @Transactional
    public void deleteProduct(String productId) {
        Product product = productRepository.findByProductId(productId)
                .orElseThrow(() -> ProductException.productNotFound(productId));

        productRepository.delete(product);
        log.info("Deleted product: productId={}", productId);

        eventPublisher.publishEvent(new ProductChangedEvent(productId, ChangeType.DELETED));
    }
}
