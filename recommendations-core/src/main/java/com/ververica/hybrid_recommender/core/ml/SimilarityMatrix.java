package com.ververica.hybrid_recommender.core.ml;

import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable, sparse item-to-item similarity matrix.
 *
 * Only non-zero pairs are stored. Each row is pre-sorted with
 * {@link ScoredProduct#RANKING} and never contains the row's own product, so a
 * top-n lookup is a sublist of a single row.
 *
 * Symmetric: score(i, j) == score(j, i). A product is never its own neighbour:
 * score(i, i) is 0.0 and i never appears in its own row.
 */
public final class SimilarityMatrix {

    private final Map<String, List<ScoredProduct>> rows;
    private final Map<String, Map<String, Double>> scores;

    SimilarityMatrix(Map<String, List<ScoredProduct>> rows, Map<String, Map<String, Double>> scores) {
        this.rows = Collections.unmodifiableMap(rows);
        this.scores = Collections.unmodifiableMap(scores);
    }

    /**
     * Ranked neighbours of a product, best first. Empty for unknown products.
     */
    public List<ScoredProduct> row(String productId) {
        List<ScoredProduct> row = rows.get(productId);
        return row != null ? row : Collections.emptyList();
    }

    public double score(String productA, String productB) {
        if (!rows.containsKey(productA) || !rows.containsKey(productB) || productA.equals(productB)) {
            return 0.0;
        }
        return scores.get(productA).getOrDefault(productB, 0.0);
    }

    public boolean contains(String productId) {
        return rows.containsKey(productId);
    }

    public Set<String> productIds() {
        return rows.keySet();
    }

    public int size() {
        return rows.size();
    }

    /** Number of stored (non-zero, unordered) product pairs. */
    public long pairCount() {
        long entries = 0;
        for (List<ScoredProduct> row : rows.values()) {
            entries += row.size();
        }
        return entries / 2;
    }
}
