package com.ververica.hybrid_recommender.core.service;

import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Blends item-based and basket-based candidates into one ranked list.
 *
 * For every candidate p:
 * <pre>
 * score(p) = itemWeight × item_score(p) + basketWeight × basket_score(p)
 * </pre>
 * A candidate missing from one source contributes 0 from that source; it is
 * never dropped for lacking a signal. Defaults are 0.6 / 0.4.
 */
public class HybridRanker {

    private final double itemBasedWeight;
    private final double basketWeight;

    public HybridRanker(RecommenderConfig config) {
        this(config.getItemBasedWeight(), config.getBasketWeight());
    }

    public HybridRanker(double itemBasedWeight, double basketWeight) {
        this.itemBasedWeight = itemBasedWeight;
        this.basketWeight = basketWeight;
    }

    /**
     * @param itemScores   item-based candidates (may be empty)
     * @param basketScores basket-based candidates (may be empty)
     * @param topN         maximum length of the returned list
     * @return merged candidates sorted by blended score descending, ties by product id
     */
    public List<ScoredProduct> rank(List<ScoredProduct> itemScores, List<ScoredProduct> basketScores, int topN) {
        Map<String, Double> blended = new HashMap<>();
        for (ScoredProduct candidate : itemScores) {
            blended.merge(candidate.getProductId(), candidate.getScore() * itemBasedWeight, Double::sum);
        }
        for (ScoredProduct candidate : basketScores) {
            blended.merge(candidate.getProductId(), candidate.getScore() * basketWeight, Double::sum);
        }

        List<ScoredProduct> ranked = new ArrayList<>(blended.size());
        blended.forEach((productId, score) -> ranked.add(new ScoredProduct(productId, score)));
        ranked.sort(ScoredProduct.RANKING);
        return new ArrayList<>(ranked.subList(0, Math.min(topN, ranked.size())));
    }

    public double getItemBasedWeight() {
        return itemBasedWeight;
    }

    public double getBasketWeight() {
        return basketWeight;
    }
}
