package com.recomart.product.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(name = "products", indexes = {
    @Index(name = "idx_product_product_id", columnList = "product_id"),
    @Index(name = "idx_product_category", columnList = "category"),
    @Index(name = "idx_product_popularity", columnList = "popularity_score")
})
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = {"tags"})
@EqualsAndHashCode(exclude = {"tags"})
public class Product {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "product_id", nullable = false, unique = true)
    private String productId;

    @Column(nullable = false)
    private String name;

    private String category;

    @Column(nullable = false, precision = 10, scale = 2)
    private BigDecimal price;

    @Column(length = 2000)
    private String description;

    @ElementCollection
    @CollectionTable(name = "product_tags", joinColumns = @JoinColumn(name = "product_ref"))
    @OrderColumn(name = "tag_order")
    @Column(name = "tag")
    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Column(name = "popularity_score", nullable = false)
    @Builder.Default
    private Double popularityScore = 0.0;

    @CreationTimestamp
    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(nullable = false)
    private LocalDateTime updatedAt;

    /**
     * Free text used for content similarity: name, description and tags joined by spaces.
     */
    public String getSearchableText() {
        StringBuilder text = new StringBuilder();
        if (name != null) {
            text.append(name);
        }
        if (description != null) {
            text.append(' ').append(description);
        }
        if (tags != null && !tags.isEmpty()) {
            text.append(' ').append(String.join(" ", tags));
        }
        return text.toString().trim();
    }
}
