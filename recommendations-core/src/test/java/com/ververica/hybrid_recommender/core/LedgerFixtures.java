package com.ververica.hybrid_recommender.core;

import com.ververica.hybrid_recommender.core.shared.model.Transaction;

import java.util.ArrayList;
import java.util.List;

/**
 * Small hand-written ledgers shared by the engine tests.
 */
public final class LedgerFixtures {

    private static final long BASE_TIME = 1_700_000_000_000L;

    private LedgerFixtures() {}

    public static Transaction line(String transactionId, String customerId, String productId, int quantity) {
        return line(transactionId, customerId, productId, quantity, BASE_TIME);
    }

    public static Transaction line(String transactionId, String customerId, String productId, int quantity, long timestamp) {
        return new Transaction(transactionId, customerId, productId, quantity, timestamp);
    }

    /**
     * (T1,C1,A),(T1,C1,B),(T2,C2,A),(T2,C2,B),(T3,C3,A)
     */
    public static List<Transaction> abLedger() {
        return List.of(
            line("T1", "C1", "A", 1),
            line("T1", "C1", "B", 1),
            line("T2", "C2", "A", 1),
            line("T2", "C2", "B", 1),
            line("T3", "C3", "A", 1));
    }

    /**
     * Baskets {A,B,C} {A,C} {B,C} {A,D}, one customer each.
     */
    public static List<Transaction> hybridLedger() {
        return List.of(
            line("T1", "C1", "A", 1),
            line("T1", "C1", "B", 1),
            line("T1", "C1", "C", 1),
            line("T2", "C2", "A", 1),
            line("T2", "C2", "C", 1),
            line("T3", "C3", "B", 1),
            line("T3", "C3", "C", 1),
            line("T4", "C4", "A", 1),
            line("T4", "C4", "D", 1));
    }

    /**
     * Product X bought together with P1..P8, where Pi shares exactly i baskets with X.
     * Every rule X → Pi has lift 1 and confidence i / 36.
     */
    public static List<Transaction> eightCandidateLedger() {
        List<Transaction> lines = new ArrayList<>();
        int basket = 0;
        for (int i = 1; i <= 8; i++) {
            for (int repeat = 0; repeat < i; repeat++) {
                String transactionId = String.format("T%03d", basket++);
                String customerId = "C" + (basket % 7);
                lines.add(line(transactionId, customerId, "X", 1));
                lines.add(line(transactionId, customerId, "P" + i, 1));
            }
        }
        return lines;
    }
}
