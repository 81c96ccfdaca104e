package com.recomart.customer.repository;

import com.recomart.customer.entity.Customer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<Customer, UUID> {

    Optional<Customer> findByCustomerId(String customerId);

    boolean existsByCustomerId(String customerId);

    @Query("SELECT c.segment FROM Customer c WHERE c.customerId = :customerId")
    Optional<String> findSegmentByCustomerId(@Param("customerId") String customerId);

    @Query("SELECT c.customerId FROM Customer c ORDER BY c.createdAt ASC, c.customerId ASC")
    List<String> findAllCustomerIds();

    @Query("SELECT c.segment, COUNT(c) FROM Customer c GROUP BY c.segment ORDER BY c.segment")
    List<Object[]> countBySegment();

    @Modifying
    @Query("UPDATE Customer c SET c.segment = :segment WHERE c.customerId = :customerId")
    int updateSegment(@Param("customerId") String customerId, @Param("segment") String segment);
}
