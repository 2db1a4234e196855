package com.ververica.hybrid_recommender.core.shared.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * All line items sharing one transaction id.
 *
 * Derived from the ledger, never stored. A product appears at most once;
 * duplicate lines are merged by summing their quantities.
 *
 * Used by BasketRuleMiner for support and co-occurrence counting.
 */
public final class Basket {

    private final String transactionId;
    private final Map<String, Integer> quantities;

    public Basket(String transactionId, Map<String, Integer> quantities) {
        this.transactionId = transactionId;
        this.quantities = Collections.unmodifiableMap(new LinkedHashMap<>(quantities));
    }

    public String getTransactionId() {
        return transactionId;
    }

    public Set<String> getProductIds() {
        return quantities.keySet();
    }

    public Map<String, Integer> getQuantities() {
        return quantities;
    }

    public boolean contains(String productId) {
        return quantities.containsKey(productId);
    }

    public int size() {
        return quantities.size();
    }

    @Override
    public String toString() {
        return String.format("Basket{txn=%s, products=%s}", transactionId, quantities.keySet());
    }
}
