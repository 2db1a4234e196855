package com.ververica.hybrid_recommender.core.evaluation;

import com.ververica.hybrid_recommender.core.ledger.TransactionValidator;
import com.ververica.hybrid_recommender.core.service.RecommendationEngine;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationRequest;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationResult;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationType;
import com.ververica.hybrid_recommender.core.shared.model.RecommendedProduct;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Back-tests the hybrid engine on withheld purchases.
 *
 * ALGORITHM:
 * <pre>
 * 1. Withhold the last N lines of every customer's purchase sequence (HoldoutSplit)
 * 2. Train a fresh engine on the remaining ledger (serving models are not touched)
 * 3. For each evaluated customer, query HYBRID with
 *      productId = product of the last visible line
 *      basket    = visible products of the last visible transaction
 *    using top-k = evaluationK
 * 4. Compare the returned products with the withheld ones
 * </pre>
 *
 * METRICS CALCULATED: see {@link EvaluationReport}.
 */
public class EvaluationReporter {

    private static final Logger LOG = LoggerFactory.getLogger(EvaluationReporter.class);

    private final RecommenderConfig config;

    public EvaluationReporter(RecommenderConfig config) {
        this.config = config.toBuilder()
            .withTopNRecommendations(config.getEvaluationK())
            .build();
    }

    /**
     * @throws com.ververica.hybrid_recommender.core.shared.error.DataValidationException
     *         if the ledger, or the training slice left after withholding, is empty or malformed
     */
    public EvaluationReport evaluate(Collection<Transaction> transactions) {
        TransactionValidator.validateLedger(transactions);
        int k = config.getTopNRecommendations();

        HoldoutSplit split = HoldoutSplit.of(transactions, config.getHoldoutItemsPerCustomer());
        RecommendationEngine engine = new RecommendationEngine(config);
        engine.train(split.getTraining());

        MetricAccumulator metrics = new MetricAccumulator(k);
        for (HoldoutSplit.CustomerHoldout holdout : split.getHoldouts().values()) {
            RecommendationResult result = engine.recommend(
                RecommendationRequest.builder(RecommendationType.HYBRID)
                    .withCustomerId(holdout.getCustomerId())
                    .withProductId(holdout.lastVisibleProduct())
                    .withBasket(holdout.lastVisibleBasket())
                    .build());
            metrics.add(holdout, result);
        }

        EvaluationReport report = metrics.toReport(split.getSkippedCustomers());
        if (report.getEvaluatedCustomers() == 0) {
            LOG.warn("No customer has more than {} purchase lines, nothing to evaluate",
                config.getHoldoutItemsPerCustomer());
        } else {
            LOG.info("Evaluation completed: {}", report);
        }
        return report;
    }

    private static final class MetricAccumulator {
        private final int k;

        private int customers;
        private double precisionSum;
        private double recallSum;
        private int customersWithHit;

        private long hiddenQuantity;
        private long recoveredQuantity;
        private long visibleQuantity;

        private int crossSellOpportunities;
        private int crossSellSuccesses;

        MetricAccumulator(int k) {
            this.k = k;
        }

        void add(HoldoutSplit.CustomerHoldout holdout, RecommendationResult result) {
            Map<String, Integer> hiddenQuantities = new HashMap<>();
            for (Transaction line : holdout.getHidden()) {
                hiddenQuantities.merge(line.getProductId(), line.getQuantity(), Integer::sum);
            }
            Set<String> previouslyBought = new HashSet<>();
            for (Transaction line : holdout.getVisible()) {
                previouslyBought.add(line.getProductId());
                visibleQuantity += line.getQuantity();
            }

            int hits = 0;
            boolean newProductRecommended = false;
            for (RecommendedProduct product : result.getRecommendedProducts()) {
                Integer quantity = hiddenQuantities.get(product.getProductId());
                if (quantity != null) {
                    hits++;
                    recoveredQuantity += quantity;
                    if (!previouslyBought.contains(product.getProductId())) {
                        newProductRecommended = true;
                    }
                }
            }

            for (int quantity : hiddenQuantities.values()) {
                hiddenQuantity += quantity;
            }

            customers++;
            precisionSum += (double) hits / k;
            recallSum += (double) hits / hiddenQuantities.size();
            if (hits > 0) {
                customersWithHit++;
            }

            boolean hasNewProduct = hiddenQuantities.keySet().stream()
                .anyMatch(productId -> !previouslyBought.contains(productId));
            if (hasNewProduct) {
                crossSellOpportunities++;
                if (newProductRecommended) {
                    crossSellSuccesses++;
                }
            }
        }

        EvaluationReport toReport(int skippedCustomers) {
            return new EvaluationReport(
                k,
                customers,
                skippedCustomers,
                ratio(precisionSum, customers),
                ratio(recallSum, customers),
                ratio(customersWithHit, customers),
                ratio(recoveredQuantity, hiddenQuantity),
                ratio(recoveredQuantity, visibleQuantity),
                ratio(crossSellSuccesses, crossSellOpportunities));
        }

        private static double ratio(double numerator, double denominator) {
            return denominator == 0 ? 0.0 : numerator / denominator;
        }
    }
}
