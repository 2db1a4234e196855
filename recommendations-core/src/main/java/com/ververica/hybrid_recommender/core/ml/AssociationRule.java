package com.ververica.hybrid_recommender.core.ml;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Objects;

/**
 * Represents a directional association rule for basket analysis
 * Format: antecedent => consequent
 * Example: lipstick => lip_liner with confidence 0.8
 *
 * METRICS:
 * - support: share of all baskets containing both products
 * - confidence: P(consequent | antecedent)
 * - lift: confidence / support(consequent), > 1 means positive association
 */
@JsonPropertyOrder({"antecedent", "consequent", "support", "confidence", "lift"})
public final class AssociationRule implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Antecedent ascending, then consequent ascending. */
    public static final Comparator<AssociationRule> BY_PRODUCTS =
        Comparator.comparing(AssociationRule::getAntecedent)
            .thenComparing(AssociationRule::getConsequent);

    private final String antecedent;   // Item in basket (IF)
    private final String consequent;   // Predicted item (THEN)
    private final double support;
    private final double confidence;
    private final double lift;

    @JsonCreator
    public AssociationRule(
            @JsonProperty("antecedent") String antecedent,
            @JsonProperty("consequent") String consequent,
            @JsonProperty("support") double support,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("lift") double lift) {
        this.antecedent = Objects.requireNonNull(antecedent, "antecedent");
        this.consequent = Objects.requireNonNull(consequent, "consequent");
        if (antecedent.equals(consequent)) {
            throw new IllegalArgumentException("Antecedent and consequent must differ: " + antecedent);
        }
        this.support = support;
        this.confidence = confidence;
        this.lift = lift;
    }

    public String getAntecedent() {
        return antecedent;
    }

    public String getConsequent() {
        return consequent;
    }

    public double getSupport() {
        return support;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getLift() {
        return lift;
    }

    /**
     * Recommendation strength of this rule: confidence × lift.
     */
    @JsonIgnore
    public double getScore() {
        return confidence * lift;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssociationRule that = (AssociationRule) o;
        return antecedent.equals(that.antecedent) && consequent.equals(that.consequent);
    }

    @Override
    public int hashCode() {
        return Objects.hash(antecedent, consequent);
    }

    @Override
    public String toString() {
        return String.format("%s => %s (sup=%.3f, conf=%.3f, lift=%.3f)",
            antecedent, consequent, support, confidence, lift);
    }
}
