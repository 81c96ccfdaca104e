package com.recomart.customer.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.UUID;

@Entity
@Table(name = "customers", indexes = {
    @Index(name = "idx_customer_segment", columnList = "segment")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
@EqualsAndHashCode
public class Customer {

    /** Segment given to customers who have not been through a segmentation run yet. */
    public static final String DEFAULT_SEGMENT = "new";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "customer_id", nullable = false, unique = true)
    private String customerId;

    private String name;

    private Integer age;

    private String gender;

    private String location;

    @Column(nullable = false)
    @Builder.Default
    private String segment = DEFAULT_SEGMENT;

    /** Free-form JSON preferences document. */
    @Column(length = 4000)
    @Builder.Default
    private String preferences = "{}";

    private LocalDateTime lastActivity;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        if (lastActivity == null) {
            lastActivity = createdAt;
        }
    }
}
