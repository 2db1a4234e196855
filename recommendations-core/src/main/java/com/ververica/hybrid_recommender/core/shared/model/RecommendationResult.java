package com.ververica.hybrid_recommender.core.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Answer to one recommendation query. Created fresh per query, never persisted.
 *
 * This is the contract consumed by the dashboard / API layer:
 * <pre>
 * {
 *   "customer_id": "C1",
 *   "recommended_products": [{"product_id": "B", "score": 0.667, "reason": "frequently purchased together"}],
 *   "recommendation_type": "market_basket",
 *   "confidence_score": 0.667,
 *   "explanation": "..."
 * }
 * </pre>
 *
 * confidence_score is the mean score of the returned products, or 0.0 for an empty list.
 */
@JsonPropertyOrder({"customer_id", "recommended_products", "recommendation_type", "confidence_score", "explanation"})
public final class RecommendationResult implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String UNKNOWN_CUSTOMER = "unknown";

    private final String customerId;
    private final List<RecommendedProduct> recommendedProducts;
    private final RecommendationType recommendationType;
    private final double confidenceScore;
    private final String explanation;

    @JsonCreator
    public RecommendationResult(
            @JsonProperty("customer_id") String customerId,
            @JsonProperty("recommended_products") List<RecommendedProduct> recommendedProducts,
            @JsonProperty("recommendation_type") RecommendationType recommendationType,
            @JsonProperty("confidence_score") double confidenceScore,
            @JsonProperty("explanation") String explanation) {
        this.customerId = customerId != null ? customerId : UNKNOWN_CUSTOMER;
        this.recommendedProducts = recommendedProducts == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(recommendedProducts));
        this.recommendationType = Objects.requireNonNull(recommendationType, "recommendationType");
        this.confidenceScore = confidenceScore;
        this.explanation = explanation;
    }

    /**
     * Builds a result from an already ranked and truncated list, deriving the
     * confidence score from the products' scores.
     */
    public static RecommendationResult of(
            String customerId,
            List<RecommendedProduct> products,
            RecommendationType type,
            String explanation) {
        double confidence = products.stream()
            .mapToDouble(RecommendedProduct::getScore)
            .average()
            .orElse(0.0);
        return new RecommendationResult(customerId, products, type, confidence, explanation);
    }

    @JsonProperty("customer_id")
    public String getCustomerId() {
        return customerId;
    }

    @JsonProperty("recommended_products")
    public List<RecommendedProduct> getRecommendedProducts() {
        return recommendedProducts;
    }

    @JsonProperty("recommendation_type")
    public RecommendationType getRecommendationType() {
        return recommendationType;
    }

    @JsonProperty("confidence_score")
    public double getConfidenceScore() {
        return confidenceScore;
    }

    @JsonProperty("explanation")
    public String getExplanation() {
        return explanation;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return recommendedProducts.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("RecommendationResult{customer=%s, type=%s, products=%d, confidence=%.3f}",
            customerId, recommendationType.getWireName(), recommendedProducts.size(), confidenceScore);
    }
}
