package com.ververica.hybrid_recommender.core.ledger;

import com.ververica.hybrid_recommender.core.shared.model.Basket;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Groups ledger lines into baskets.
 */
public final class Baskets {

    private Baskets() {}

    /**
     * Groups transactions by transaction id.
     *
     * Duplicate product lines within one transaction merge by summing quantity.
     * Baskets are returned ordered by transaction id, and products inside a basket
     * in ascending id order, so repeated calls yield identical output.
     */
    public static List<Basket> group(Collection<Transaction> transactions) {
        Map<String, BasketAccumulator> byTransaction = new TreeMap<>();

        for (Transaction transaction : transactions) {
            byTransaction
                .computeIfAbsent(transaction.getTransactionId(), BasketAccumulator::new)
                .add(transaction);
        }

        List<Basket> baskets = new ArrayList<>(byTransaction.size());
        for (BasketAccumulator accumulator : byTransaction.values()) {
            baskets.add(accumulator.toBasket());
        }
        return baskets;
    }

    private static final class BasketAccumulator {
        private final String transactionId;
        private final Map<String, Integer> quantities = new TreeMap<>();

        BasketAccumulator(String transactionId) {
            this.transactionId = transactionId;
        }

        void add(Transaction transaction) {
            quantities.merge(transaction.getProductId(), transaction.getQuantity(), Integer::sum);
        }

        Basket toBasket() {
            return new Basket(transactionId, quantities);
        }
    }
}
