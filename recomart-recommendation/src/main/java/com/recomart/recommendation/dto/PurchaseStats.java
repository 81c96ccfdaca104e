package com.recomart.recommendation.dto;

/**
 * Aggregated purchase history of one customer.
 */
public record PurchaseStats(int purchaseCount, double totalSpent, int activeMonths) {

    public static final PurchaseStats EMPTY = new PurchaseStats(0, 0.0, 0);
}
