package com.recomart.recommendation.dto;

/**
 * Behavioural features of one customer, derived on demand from the activity log.
 */
public record CustomerFeature(
        String customerId,
        int interactionCount,
        int purchaseCount,
        double totalSpent,
        int activeMonths) {

    public static final int DIMENSIONS = 4;

    public static CustomerFeature empty(String customerId) {
        return new CustomerFeature(customerId, 0, 0, 0.0, 0);
    }

    public double[] toArray() {
        return new double[]{interactionCount, purchaseCount, totalSpent, activeMonths};
    }
}
