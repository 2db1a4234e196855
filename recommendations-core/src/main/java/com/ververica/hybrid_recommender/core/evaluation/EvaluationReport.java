package com.ververica.hybrid_recommender.core.evaluation;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Offline quality metrics measured against withheld purchases.
 *
 * All rates are fractions in [0, 1] except average_order_value_lift, which is a
 * ratio of quantities and may exceed 1.
 */
@JsonPropertyOrder({
    "k", "evaluated_customers", "skipped_customers",
    "precision_at_k", "recall_at_k", "click_through_rate", "conversion_rate",
    "average_order_value_lift", "cross_sell_success_rate"
})
public final class EvaluationReport {

    private final int k;
    private final int evaluatedCustomers;
    private final int skippedCustomers;
    private final double precisionAtK;
    private final double recallAtK;
    private final double clickThroughRate;
    private final double conversionRate;
    private final double averageOrderValueLift;
    private final double crossSellSuccessRate;

    EvaluationReport(
            int k,
            int evaluatedCustomers,
            int skippedCustomers,
            double precisionAtK,
            double recallAtK,
            double clickThroughRate,
            double conversionRate,
            double averageOrderValueLift,
            double crossSellSuccessRate) {
        this.k = k;
        this.evaluatedCustomers = evaluatedCustomers;
        this.skippedCustomers = skippedCustomers;
        this.precisionAtK = precisionAtK;
        this.recallAtK = recallAtK;
        this.clickThroughRate = clickThroughRate;
        this.conversionRate = conversionRate;
        this.averageOrderValueLift = averageOrderValueLift;
        this.crossSellSuccessRate = crossSellSuccessRate;
    }

    @JsonProperty("k")
    public int getK() {
        return k;
    }

    @JsonProperty("evaluated_customers")
    public int getEvaluatedCustomers() {
        return evaluatedCustomers;
    }

    @JsonProperty("skipped_customers")
    public int getSkippedCustomers() {
        return skippedCustomers;
    }

    /** Mean over evaluated customers of hits / k. */
    @JsonProperty("precision_at_k")
    public double getPrecisionAtK() {
        return precisionAtK;
    }

    /** Mean over evaluated customers of hits / withheld distinct products. */
    @JsonProperty("recall_at_k")
    public double getRecallAtK() {
        return recallAtK;
    }

    /** Share of evaluated customers with at least one recommended product among their withheld purchases. */
    @JsonProperty("click_through_rate")
    public double getClickThroughRate() {
        return clickThroughRate;
    }

    /** Withheld quantity covered by recommendations / total withheld quantity. */
    @JsonProperty("conversion_rate")
    public double getConversionRate() {
        return conversionRate;
    }

    /** Withheld quantity covered by recommendations / visible quantity of the evaluated customers. */
    @JsonProperty("average_order_value_lift")
    public double getAverageOrderValueLift() {
        return averageOrderValueLift;
    }

    /**
     * Among customers whose withheld purchases contain a product new to them,
     * the share for whom such a product was recommended.
     */
    @JsonProperty("cross_sell_success_rate")
    public double getCrossSellSuccessRate() {
        return crossSellSuccessRate;
    }

    /** Metric name → value, in report order. */
    @JsonIgnore
    public Map<String, Double> getMetrics() {
        Map<String, Double> metrics = new LinkedHashMap<>();
        metrics.put("precision_at_" + k, precisionAtK);
        metrics.put("recall_at_" + k, recallAtK);
        metrics.put("click_through_rate", clickThroughRate);
        metrics.put("conversion_rate", conversionRate);
        metrics.put("average_order_value_lift", averageOrderValueLift);
        metrics.put("cross_sell_success_rate", crossSellSuccessRate);
        return metrics;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "EvaluationReport{k=%d, customers=%d, precision=%.3f, recall=%.3f, ctr=%.3f, conversion=%.3f, aovLift=%.3f, crossSell=%.3f}",
            k, evaluatedCustomers, precisionAtK, recallAtK, clickThroughRate, conversionRate,
            averageOrderValueLift, crossSellSuccessRate);
    }
}
