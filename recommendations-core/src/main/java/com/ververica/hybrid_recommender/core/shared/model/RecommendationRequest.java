package com.ververica.hybrid_recommender.core.shared.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Input of one recommendation query.
 *
 * Which fields are required depends on the mode:
 * - ITEM_BASED: productId
 * - MARKET_BASKET: a non-empty basket
 * - HYBRID: productId, basket, or both
 *
 * Example usage:
 * <pre>{@code
 * RecommendationRequest request = RecommendationRequest.builder(RecommendationType.HYBRID)
 *     .withCustomerId("C1")
 *     .withProductId("A")
 *     .withBasket(List.of("B"))
 *     .build();
 * }</pre>
 */
public final class RecommendationRequest {

    private final String customerId;
    private final String productId;
    private final List<String> basket;
    private final RecommendationType mode;

    private RecommendationRequest(Builder builder) {
        this.customerId = builder.customerId;
        this.productId = builder.productId;
        this.basket = builder.basket == null
            ? null
            : Collections.unmodifiableList(new ArrayList<>(new LinkedHashSet<>(builder.basket)));
        this.mode = builder.mode;
    }

    public static Builder builder(RecommendationType mode) {
        return new Builder(mode);
    }

    public String getCustomerId() {
        return customerId;
    }

    public String getProductId() {
        return productId;
    }

    /** Distinct basket product ids in their original order, or null when no basket was given. */
    public List<String> getBasket() {
        return basket;
    }

    public RecommendationType getMode() {
        return mode;
    }

    public boolean hasProductId() {
        return productId != null && !productId.trim().isEmpty();
    }

    public boolean hasBasket() {
        return basket != null && !basket.isEmpty();
    }

    @Override
    public String toString() {
        return "RecommendationRequest{" +
               "customerId='" + customerId + '\'' +
               ", productId='" + productId + '\'' +
               ", basket=" + basket +
               ", mode=" + mode +
               '}';
    }

    public static class Builder {
        private final RecommendationType mode;
        private String customerId;
        private String productId;
        private List<String> basket;

        private Builder(RecommendationType mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
        }

        public Builder withCustomerId(String customerId) {
            this.customerId = customerId;
            return this;
        }

        public Builder withProductId(String productId) {
            this.productId = productId;
            return this;
        }

        public Builder withBasket(List<String> basket) {
            this.basket = basket;
            return this;
        }

        public RecommendationRequest build() {
            return new RecommendationRequest(this);
        }
    }
}
