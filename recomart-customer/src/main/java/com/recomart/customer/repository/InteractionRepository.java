package com.recomart.customer.repository;

import com.recomart.customer.entity.Interaction;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, Long> {

    /**
     * Product ids of a customer's interactions, most recent first.
     * Note: id breaks ties between interactions recorded in the same instant.
     */
    @Query("SELECT i.productId FROM Interaction i WHERE i.customerId = :customerId " +
           "ORDER BY i.occurredAt DESC, i.id DESC")
    List<String> findRecentProductIds(@Param("customerId") String customerId, Pageable pageable);

    List<Interaction> findByCustomerIdOrderByOccurredAtDescIdDesc(String customerId, Pageable pageable);

    long countByCustomerId(String customerId);
}
