package com.ververica.hybrid_recommender.core.ml;

import com.ververica.hybrid_recommender.core.ledger.TransactionValidator;
import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Item-to-item collaborative filtering model.
 *
 * ALGORITHM: Cosine similarity over customer purchase vectors
 * <pre>
 * 1. Aggregate quantity per (customer, product) → customer × product matrix
 * 2. Treat each product column as a vector over customers
 * 3. S(i, j) = dot(v_i, v_j) / (|v_i| · |v_j|), 0 if either vector is all-zero
 * </pre>
 *
 * Dot products are accumulated per customer over the products that customer
 * actually bought, so the cost follows the number of co-purchased pairs rather
 * than the square of the catalog.
 *
 * PUBLICATION:
 * build() computes a complete {@link SimilarityMatrix} off to the side and then
 * publishes it with a single reference swap. Concurrent readers see either the
 * previous matrix or the new one, never a partial build; reads take no locks.
 */
public class SimilarityModel {

    private static final Logger LOG = LoggerFactory.getLogger(SimilarityModel.class);

    private final AtomicReference<SimilarityMatrix> published = new AtomicReference<>();

    /**
     * Builds a new matrix from the ledger and publishes it.
     *
     * @throws com.ververica.hybrid_recommender.core.shared.error.DataValidationException
     *         if the ledger is empty or contains a malformed record
     */
    public SimilarityMatrix build(Collection<Transaction> transactions) {
        TransactionValidator.validateLedger(transactions);
        long start = System.currentTimeMillis();

        SimilarityMatrix matrix = computeMatrix(transactions);
        published.set(matrix);

        LOG.info("Built similarity matrix: {} products, {} non-zero pairs in {}ms",
            matrix.size(), matrix.pairCount(), System.currentTimeMillis() - start);
        return matrix;
    }

    /**
     * Up to n most similar products, excluding the product itself, sorted by
     * score descending then product id ascending.
     *
     * Returns an empty list (never throws) if the model has not been built or the
     * product is unknown: absence of a recommendation is a normal outcome.
     */
    public List<ScoredProduct> getSimilar(String productId, int n) {
        SimilarityMatrix matrix = published.get();
        if (matrix == null || productId == null || n <= 0) {
            return Collections.emptyList();
        }
        List<ScoredProduct> row = matrix.row(productId);
        return row.subList(0, Math.min(n, row.size()));
    }

    public double getSimilarity(String productA, String productB) {
        SimilarityMatrix matrix = published.get();
        return matrix == null ? 0.0 : matrix.score(productA, productB);
    }

    public boolean isTrained() {
        return published.get() != null;
    }

    /** Currently published matrix, or null before the first successful build. */
    public SimilarityMatrix getMatrix() {
        return published.get();
    }

    // ========================================
    // Matrix construction
    // ========================================

    private static SimilarityMatrix computeMatrix(Collection<Transaction> transactions) {
        // STEP 1: customer × product quantities (sorted for deterministic summation order)
        Map<String, Map<String, Double>> customerVectors = new TreeMap<>();
        for (Transaction transaction : transactions) {
            customerVectors
                .computeIfAbsent(transaction.getCustomerId(), id -> new TreeMap<>())
                .merge(transaction.getProductId(), (double) transaction.getQuantity(), Double::sum);
        }

        // STEP 2: squared norms of the product vectors and pairwise dot products
        Map<String, Double> squaredNorms = new TreeMap<>();
        Map<String, Map<String, Double>> dots = new HashMap<>();

        for (Map<String, Double> purchases : customerVectors.values()) {
            List<Map.Entry<String, Double>> items = new ArrayList<>(purchases.entrySet());
            for (int i = 0; i < items.size(); i++) {
                Map.Entry<String, Double> a = items.get(i);
                squaredNorms.merge(a.getKey(), a.getValue() * a.getValue(), Double::sum);

                for (int j = i + 1; j < items.size(); j++) {
                    Map.Entry<String, Double> b = items.get(j);
                    // a < b lexicographically, TreeMap iteration order
                    dots.computeIfAbsent(a.getKey(), k -> new HashMap<>())
                        .merge(b.getKey(), a.getValue() * b.getValue(), Double::sum);
                }
            }
        }

        // STEP 3: cosine per stored pair, mirrored into both rows
        Map<String, Map<String, Double>> scores = new HashMap<>();
        for (String productId : squaredNorms.keySet()) {
            scores.put(productId, new HashMap<>());
        }

        for (Map.Entry<String, Map<String, Double>> rowEntry : dots.entrySet()) {
            String a = rowEntry.getKey();
            double normA = Math.sqrt(squaredNorms.get(a));

            for (Map.Entry<String, Double> cell : rowEntry.getValue().entrySet()) {
                String b = cell.getKey();
                double normB = Math.sqrt(squaredNorms.get(b));
                double similarity = cosine(cell.getValue(), normA, normB);
                if (similarity > 0.0) {
                    scores.get(a).put(b, similarity);
                    scores.get(b).put(a, similarity);
                }
            }
        }

        // STEP 4: rank every row once so lookups are a sublist
        Map<String, List<ScoredProduct>> rows = new HashMap<>();
        for (Map.Entry<String, Map<String, Double>> entry : scores.entrySet()) {
            List<ScoredProduct> row = new ArrayList<>(entry.getValue().size());
            for (Map.Entry<String, Double> cell : entry.getValue().entrySet()) {
                row.add(new ScoredProduct(cell.getKey(), cell.getValue()));
            }
            row.sort(ScoredProduct.RANKING);
            rows.put(entry.getKey(), Collections.unmodifiableList(row));
        }

        return new SimilarityMatrix(rows, scores);
    }

    static double cosine(double dot, double normA, double normB) {
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        // clamp rounding drift so scores stay within [0, 1]
        return Math.max(0.0, Math.min(1.0, dot / (normA * normB)));
    }
}
