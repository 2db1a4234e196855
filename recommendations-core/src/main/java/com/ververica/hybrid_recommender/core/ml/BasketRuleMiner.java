package com.ververica.hybrid_recommender.core.ml;

import com.ververica.hybrid_recommender.core.ledger.Baskets;
import com.ververica.hybrid_recommender.core.ledger.TransactionValidator;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.model.Basket;
import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Mines pairwise association rules from completed baskets.
 *
 * ALGORITHM: Association Rule Mining (Market Basket Analysis)
 * Discovers patterns like: "Customers who bought X also bought Y"
 * <pre>
 * 1. Group ledger lines into baskets by transaction id
 * 2. support(i) = baskets containing i / total baskets, keep items with support ≥ min_support
 * 3. For every unordered pair of frequent items (i, j), count co-occurrence C; skip C = 0
 * 4. Derive both directions:
 *      support(i,j)    = C / total_baskets
 *      confidence(i→j) = C / count(i)
 *      lift(i→j)       = confidence(i→j) / support(j)
 *    and keep each direction whose confidence ≥ min_confidence
 * </pre>
 *
 * COMPLEXITY:
 * Pair enumeration is O(k²) over the k frequent items, which is fine for a few
 * thousand frequent items. Co-occurrence for item i is counted by walking only
 * the baskets that contain i, and the outer index i is split into ranges that run
 * on a fixed worker pool (miningParallelism). Range results are concatenated in
 * range order, so the output never depends on the partitioning.
 *
 * PUBLICATION:
 * The finished {@link RuleSet} replaces the previous one with a single reference
 * swap; queries read whichever rule set is current without locking.
 */
public class BasketRuleMiner {

    private static final Logger LOG = LoggerFactory.getLogger(BasketRuleMiner.class);

    // Ranges per worker, so unequal range costs even out
    private static final int RANGES_PER_WORKER = 4;

    private final RecommenderConfig config;
    private final AtomicReference<RuleSet> published = new AtomicReference<>();

    public BasketRuleMiner(RecommenderConfig config) {
        this.config = config;
    }

    /**
     * Mines a new rule set from the ledger and publishes it.
     *
     * @throws com.ververica.hybrid_recommender.core.shared.error.DataValidationException
     *         if the ledger is empty or contains a malformed record
     */
    public RuleSet build(Collection<Transaction> transactions) {
        TransactionValidator.validateLedger(transactions);
        long start = System.currentTimeMillis();

        RuleSet ruleSet = mine(Baskets.group(transactions));
        published.set(ruleSet);

        LOG.info("Mined {} association rules from {} baskets ({} frequent items) in {}ms",
            ruleSet.size(), ruleSet.getTotalBaskets(), ruleSet.getFrequentItemSupport().size(),
            System.currentTimeMillis() - start);
        return ruleSet;
    }

    /**
     * Recommends products for a basket.
     *
     * STRATEGY:
     * 1. For each basket item, find rules with that item as antecedent
     * 2. Skip consequents already in the basket
     * 3. score = confidence × lift, keeping the maximum per consequent
     * 4. Sort by score (ties by product id) and keep the top N
     *
     * Returns an empty list if no rule set has been built or nothing matches.
     */
    public List<ScoredProduct> getBasketRecommendations(Collection<String> basket) {
        RuleSet ruleSet = published.get();
        if (ruleSet == null || basket == null || basket.isEmpty()) {
            return Collections.emptyList();
        }

        Set<String> basketItems = new HashSet<>(basket);
        Map<String, Double> scores = new HashMap<>();

        for (String item : basketItems) {
            for (AssociationRule rule : ruleSet.rulesFrom(item)) {
                String consequent = rule.getConsequent();
                if (!basketItems.contains(consequent)) {
                    scores.merge(consequent, rule.getScore(), Math::max);
                }
            }
        }

        List<ScoredProduct> ranked = new ArrayList<>(scores.size());
        scores.forEach((productId, score) -> ranked.add(new ScoredProduct(productId, score)));
        ranked.sort(ScoredProduct.RANKING);

        List<ScoredProduct> top = ranked.subList(0, Math.min(config.getTopNRecommendations(), ranked.size()));
        LOG.debug("Basket {} matched {} candidate consequents, returning {}", basketItems, ranked.size(), top.size());
        return new ArrayList<>(top);
    }

    /** All retained rules of the current rule set, empty before the first build. */
    public List<AssociationRule> getRules() {
        RuleSet ruleSet = published.get();
        return ruleSet == null ? Collections.emptyList() : ruleSet.getRules();
    }

    public boolean isTrained() {
        return published.get() != null;
    }

    /** Currently published rule set, or null before the first successful build. */
    public RuleSet getRuleSet() {
        return published.get();
    }

    // ========================================
    // Mining
    // ========================================

    private RuleSet mine(List<Basket> baskets) {
        int totalBaskets = baskets.size();

        // STEP 1: item frequencies (sorted so frequent items get a stable index)
        Map<String, Integer> itemCounts = new TreeMap<>();
        for (Basket basket : baskets) {
            for (String productId : basket.getProductIds()) {
                itemCounts.merge(productId, 1, Integer::sum);
            }
        }

        // STEP 2: frequent items
        Map<String, Double> frequentSupport = new LinkedHashMap<>();
        List<String> frequentItems = new ArrayList<>();
        for (Map.Entry<String, Integer> entry : itemCounts.entrySet()) {
            double support = (double) entry.getValue() / totalBaskets;
            if (support >= config.getMinSupport()) {
                frequentSupport.put(entry.getKey(), support);
                frequentItems.add(entry.getKey());
            }
        }

        // STEP 3: basket contents as frequent-item indices, plus postings per item
        Map<String, Integer> indexOf = new HashMap<>();
        for (int i = 0; i < frequentItems.size(); i++) {
            indexOf.put(frequentItems.get(i), i);
        }
        MiningInput input = MiningInput.create(baskets, indexOf, frequentItems, itemCounts, totalBaskets);

        // STEP 4: pair rules, partitioned by outer-index ranges
        List<AssociationRule> rules = minePairs(input);

        return new RuleSet(rules, frequentSupport, totalBaskets);
    }

    private List<AssociationRule> minePairs(MiningInput input) {
        int k = input.itemCount();
        int parallelism = config.getMiningParallelism();
        if (parallelism == 1 || k < 2) {
            return mineRange(input, 0, k);
        }

        List<int[]> ranges = partition(k, parallelism * RANGES_PER_WORKER);
        AtomicInteger workerId = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(parallelism, runnable -> {
            Thread thread = new Thread(runnable, "rule-miner-" + workerId.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Future<List<AssociationRule>>> futures = new ArrayList<>(ranges.size());
            for (int[] range : ranges) {
                futures.add(executor.submit(() -> mineRange(input, range[0], range[1])));
            }

            List<AssociationRule> rules = new ArrayList<>();
            for (Future<List<AssociationRule>> future : futures) {
                rules.addAll(future.get());
            }
            LOG.debug("Mined {} item ranges on {} workers", ranges.size(), parallelism);
            return rules;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Rule mining was interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException("Rule mining failed", cause);
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * Rules for every pair (i, j) with from ≤ i < to and j > i.
     */
    private List<AssociationRule> mineRange(MiningInput input, int from, int to) {
        List<AssociationRule> rules = new ArrayList<>();
        int k = input.itemCount();
        int[] coOccurrence = new int[k];

        for (int i = from; i < to; i++) {
            Arrays.fill(coOccurrence, 0);
            for (int basketIndex : input.postings[i]) {
                for (int j : input.basketItems[basketIndex]) {
                    if (j > i) {
                        coOccurrence[j]++;
                    }
                }
            }

            for (int j = i + 1; j < k; j++) {
                int together = coOccurrence[j];
                if (together == 0) {
                    continue;
                }
                addIfConfident(rules, input, i, j, together);
                addIfConfident(rules, input, j, i, together);
            }
        }
        return rules;
    }

    private void addIfConfident(List<AssociationRule> rules, MiningInput input, int antecedent, int consequent, int together) {
        double confidence = (double) together / input.counts[antecedent];
        if (confidence < config.getMinConfidence()) {
            return;
        }
        double support = (double) together / input.totalBaskets;
        double consequentSupport = (double) input.counts[consequent] / input.totalBaskets;
        double lift = confidence / consequentSupport;

        rules.add(new AssociationRule(
            input.items.get(antecedent), input.items.get(consequent), support, confidence, lift));
    }

    /**
     * Splits [0, k) into contiguous ranges carrying roughly equal pair counts.
     * Item i owns k - i - 1 pairs, so early ranges are narrower.
     */
    static List<int[]> partition(int k, int targetRanges) {
        long totalPairs = (long) k * (k - 1) / 2;
        long perRange = Math.max(1, totalPairs / Math.max(1, targetRanges));

        List<int[]> ranges = new ArrayList<>();
        int start = 0;
        long accumulated = 0;
        for (int i = 0; i < k; i++) {
            accumulated += k - i - 1;
            if (accumulated >= perRange) {
                ranges.add(new int[]{start, i + 1});
                start = i + 1;
                accumulated = 0;
            }
        }
        if (start < k) {
            ranges.add(new int[]{start, k});
        }
        return ranges;
    }

    /**
     * Read-only arrays shared by all mining ranges.
     */
    private static final class MiningInput {
        final List<String> items;
        final int[] counts;
        final int[][] postings;     // item index → basket indices containing it
        final int[][] basketItems;  // basket index → frequent item indices
        final int totalBaskets;

        private MiningInput(List<String> items, int[] counts, int[][] postings, int[][] basketItems, int totalBaskets) {
            this.items = items;
            this.counts = counts;
            this.postings = postings;
            this.basketItems = basketItems;
            this.totalBaskets = totalBaskets;
        }

        static MiningInput create(
                List<Basket> baskets,
                Map<String, Integer> indexOf,
                List<String> frequentItems,
                Map<String, Integer> itemCounts,
                int totalBaskets) {

            int k = frequentItems.size();
            int[] counts = new int[k];
            for (int i = 0; i < k; i++) {
                counts[i] = itemCounts.get(frequentItems.get(i));
            }

            List<List<Integer>> postingLists = new ArrayList<>(k);
            for (int i = 0; i < k; i++) {
                postingLists.add(new ArrayList<>());
            }

            int[][] basketItems = new int[baskets.size()][];
            for (int b = 0; b < baskets.size(); b++) {
                List<Integer> indices = new ArrayList<>();
                for (String productId : baskets.get(b).getProductIds()) {
                    Integer index = indexOf.get(productId);
                    if (index != null) {
                        indices.add(index);
                        postingLists.get(index).add(b);
                    }
                }
                basketItems[b] = indices.stream().mapToInt(Integer::intValue).toArray();
            }

            int[][] postings = new int[k][];
            for (int i = 0; i < k; i++) {
                postings[i] = postingLists.get(i).stream().mapToInt(Integer::intValue).toArray();
            }
            return new MiningInput(Collections.unmodifiableList(frequentItems), counts, postings, basketItems, totalBaskets);
        }

        int itemCount() {
            return items.size();
        }
    }
}
