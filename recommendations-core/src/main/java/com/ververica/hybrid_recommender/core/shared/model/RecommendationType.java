package com.ververica.hybrid_recommender.core.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Query mode, and the recommendation_type reported back in the result.
 */
public enum RecommendationType {

    ITEM_BASED("item_based", "similar item purchase pattern"),
    MARKET_BASKET("market_basket", "frequently purchased together"),
    HYBRID("hybrid", "hybrid");

    private final String wireName;
    private final String reason;

    RecommendationType(String wireName, String reason) {
        this.wireName = wireName;
        this.reason = reason;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /** Reason tag attached to every product recommended in this mode. */
    public String getReason() {
        return reason;
    }

    @JsonCreator
    public static RecommendationType fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Recommendation type cannot be null");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (RecommendationType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown recommendation type: " + value);
    }
}
