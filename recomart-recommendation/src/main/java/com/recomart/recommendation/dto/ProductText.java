package com.recomart.recommendation.dto;

/**
 * A product as the vectorizer sees it: its id and the concatenated name, description and tags.
 */
public record ProductText(String productId, String text) {
}
