package com.recomart.product.event;

/**
 * Published after a catalog write so that derived data (such as the similarity index)
 * can refresh the affected product.
 */
public record ProductChangedEvent(String productId, ChangeType changeType) {

    public enum ChangeType {
        CREATED,
        UPDATED,
        DELETED
    }
}
