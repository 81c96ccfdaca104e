package com.recomart.customer.repository;

import com.recomart.customer.entity.Purchase;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PurchaseRepository extends JpaRepository<Purchase, Long> {

    List<Purchase> findByCustomerId(String customerId);

    List<Purchase> findByCustomerIdOrderByPurchasedAtDescIdDesc(String customerId, Pageable pageable);

    /**
     * Catalog products ranked by how often customers of one segment bought them.
     * Note: productId added for deterministic ordering when counts are equal.
     */
    @Query("SELECT pu.productId FROM Purchase pu, Customer c, Product p " +
           "WHERE pu.customerId = c.customerId AND pu.productId = p.productId " +
           "AND c.segment = :segment " +
           "GROUP BY pu.productId " +
           "ORDER BY COUNT(pu) DESC, pu.productId ASC")
    List<String> findTopProductIdsBySegment(@Param("segment") String segment, Pageable pageable);
}
