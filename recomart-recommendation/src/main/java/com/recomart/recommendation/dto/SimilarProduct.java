package com.recomart.recommendation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A nearest-neighbour hit from the similarity index.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarProduct {
    /** Business product id */
    private String productId;

    /** Cosine similarity to the query product (-1 to 1, higher is more similar) */
    private double similarityScore;
}
