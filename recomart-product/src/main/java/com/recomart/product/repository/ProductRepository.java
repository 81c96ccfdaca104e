package com.recomart.product.repository;

import com.recomart.product.entity.Product;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ProductRepository extends JpaRepository<Product, UUID> {

    Optional<Product> findByProductId(String productId);

    boolean existsByProductId(String productId);

    Page<Product> findByCategory(String category, Pageable pageable);

    List<Product> findByProductIdIn(Collection<String> productIds);

    /**
     * All products in insertion order, tags fetched eagerly for text extraction.
     * Note: productId breaks ties between rows created in the same instant.
     */
    @Query("SELECT p FROM Product p LEFT JOIN FETCH p.tags ORDER BY p.createdAt ASC, p.productId ASC")
    List<Product> findAllWithTagsInInsertionOrder();

    @Query("SELECT p FROM Product p LEFT JOIN FETCH p.tags WHERE p.productId = :productId")
    Optional<Product> findByProductIdWithTags(@Param("productId") String productId);

    /**
     * Product ids ranked by stored popularity score.
     * Note: productId added for deterministic ordering when scores are equal.
     */
    @Query("SELECT p.productId FROM Product p ORDER BY p.popularityScore DESC NULLS LAST, p.productId ASC")
    List<String> findProductIdsByPopularity(Pageable pageable);
}
