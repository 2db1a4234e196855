package com.ververica.hybrid_recommender.core.evaluation;

import com.ververica.hybrid_recommender.core.shared.model.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a ledger into a training slice and per-customer withheld purchases.
 *
 * Each customer's lines are ordered by (timestamp, transaction id, product id) and
 * the last N lines are withheld. Customers with N lines or fewer stay entirely in
 * the training slice and are not evaluated.
 */
public final class HoldoutSplit {

    static final Comparator<Transaction> PURCHASE_ORDER =
        Comparator.comparingLong(Transaction::getTimestamp)
            .thenComparing(Transaction::getTransactionId)
            .thenComparing(Transaction::getProductId);

    private final List<Transaction> training;
    private final Map<String, CustomerHoldout> holdouts;
    private final int skippedCustomers;

    private HoldoutSplit(List<Transaction> training, Map<String, CustomerHoldout> holdouts, int skippedCustomers) {
        this.training = Collections.unmodifiableList(training);
        this.holdouts = Collections.unmodifiableMap(holdouts);
        this.skippedCustomers = skippedCustomers;
    }

    public static HoldoutSplit of(Collection<Transaction> transactions, int holdoutItemsPerCustomer) {
        Map<String, List<Transaction>> byCustomer = new TreeMap<>();
        for (Transaction transaction : transactions) {
            byCustomer.computeIfAbsent(transaction.getCustomerId(), id -> new ArrayList<>()).add(transaction);
        }

        List<Transaction> training = new ArrayList<>(transactions.size());
        Map<String, CustomerHoldout> holdouts = new LinkedHashMap<>();
        int skipped = 0;

        for (Map.Entry<String, List<Transaction>> entry : byCustomer.entrySet()) {
            List<Transaction> lines = entry.getValue();
            lines.sort(PURCHASE_ORDER);

            if (lines.size() <= holdoutItemsPerCustomer) {
                training.addAll(lines);
                skipped++;
                continue;
            }

            int cut = lines.size() - holdoutItemsPerCustomer;
            List<Transaction> visible = new ArrayList<>(lines.subList(0, cut));
            List<Transaction> hidden = new ArrayList<>(lines.subList(cut, lines.size()));
            training.addAll(visible);
            holdouts.put(entry.getKey(), new CustomerHoldout(entry.getKey(), visible, hidden));
        }

        return new HoldoutSplit(training, holdouts, skipped);
    }

    public List<Transaction> getTraining() {
        return training;
    }

    /** Evaluated customers in ascending customer id order. */
    public Map<String, CustomerHoldout> getHoldouts() {
        return holdouts;
    }

    public int getSkippedCustomers() {
        return skippedCustomers;
    }

    /**
     * One customer's visible history and withheld purchases, both in purchase order.
     */
    public static final class CustomerHoldout {
        private final String customerId;
        private final List<Transaction> visible;
        private final List<Transaction> hidden;

        CustomerHoldout(String customerId, List<Transaction> visible, List<Transaction> hidden) {
            this.customerId = customerId;
            this.visible = Collections.unmodifiableList(visible);
            this.hidden = Collections.unmodifiableList(hidden);
        }

        public String getCustomerId() {
            return customerId;
        }

        public List<Transaction> getVisible() {
            return visible;
        }

        public List<Transaction> getHidden() {
            return hidden;
        }

        /** Product of the most recent visible line. */
        public String lastVisibleProduct() {
            return visible.get(visible.size() - 1).getProductId();
        }

        /** Distinct products of the visible lines of the most recent visible transaction. */
        public List<String> lastVisibleBasket() {
            String lastTransaction = visible.get(visible.size() - 1).getTransactionId();
            List<String> basket = new ArrayList<>();
            for (Transaction line : visible) {
                if (line.getTransactionId().equals(lastTransaction) && !basket.contains(line.getProductId())) {
                    basket.add(line.getProductId());
                }
            }
            return basket;
        }
    }
}
