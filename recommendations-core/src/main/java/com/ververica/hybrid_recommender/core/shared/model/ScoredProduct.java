package com.ververica.hybrid_recommender.core.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * A product id paired with a model score.
 *
 * {@link #RANKING} is the single ordering used for every ranked list the engine
 * returns: score descending, then product id ascending, so equal scores always
 * come out in the same order.
 */
public final class ScoredProduct implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final Comparator<ScoredProduct> RANKING =
        Comparator.<ScoredProduct>comparingDouble(ScoredProduct::getScore).reversed()
            .thenComparing(ScoredProduct::getProductId);

    private final String productId;
    private final double score;

    @JsonCreator
    public ScoredProduct(
            @JsonProperty("product_id") String productId,
            @JsonProperty("score") double score) {
        this.productId = Objects.requireNonNull(productId, "productId");
        this.score = score;
    }

    @JsonProperty("product_id")
    public String getProductId() {
        return productId;
    }

    @JsonProperty("score")
    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScoredProduct that = (ScoredProduct) o;
        return Double.compare(that.score, score) == 0 && productId.equals(that.productId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(productId, score);
    }

    @Override
    public String toString() {
        return String.format("(%s, %.3f)", productId, score);
    }
}
