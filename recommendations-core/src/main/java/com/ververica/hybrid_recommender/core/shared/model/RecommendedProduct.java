package com.ververica.hybrid_recommender.core.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Objects;

@JsonPropertyOrder({"product_id", "score", "reason"})
public final class RecommendedProduct implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String productId;
    private final double score;
    private final String reason;

    @JsonCreator
    public RecommendedProduct(
            @JsonProperty("product_id") String productId,
            @JsonProperty("score") double score,
            @JsonProperty("reason") String reason) {
        this.productId = Objects.requireNonNull(productId, "productId");
        this.score = score;
        this.reason = reason;
    }

    public static RecommendedProduct of(ScoredProduct scored, RecommendationType type) {
        return new RecommendedProduct(scored.getProductId(), scored.getScore(), type.getReason());
    }

    @JsonProperty("product_id")
    public String getProductId() {
        return productId;
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @JsonProperty("reason")
    public String getReason() {
        return reason;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RecommendedProduct that = (RecommendedProduct) o;
        return Double.compare(that.score, score) == 0 &&
               productId.equals(that.productId) &&
               Objects.equals(reason, that.reason);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId, score, reason);
    }

    @Override
    public String toString() {
        return String.format("RecommendedProduct{id=%s, score=%.3f, reason=%s}", productId, score, reason);
    }
}
