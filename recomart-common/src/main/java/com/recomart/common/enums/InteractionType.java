package com.recomart.common.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of customer-product interactions recorded in the activity log.
 */
public enum InteractionType {
    VIEW,
    CART_ADD,
    WISHLIST,
    PURCHASE,
    SEARCH;

    @JsonValue
    public String toJson() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static InteractionType fromJson(String value) {
        if (value == null) {
            return null;
        }
        return InteractionType.valueOf(value.trim().toUpperCase());
    }
}
