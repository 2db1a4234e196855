package com.ververica.hybrid_recommender.core.ledger;

import com.ververica.hybrid_recommender.core.shared.error.DataValidationException;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;

import java.util.Collection;

/**
 * Checks ledger records before a model build.
 *
 * A record is valid when transaction, customer and product ids are non-blank
 * and quantity is at least 1. Timestamp presence is enforced when the record is
 * read (it is a required JSON property).
 */
public final class TransactionValidator {

    private TransactionValidator() {}

    /**
     * @throws DataValidationException if the collection is null or empty, or any record is malformed
     */
    public static void validateLedger(Collection<Transaction> transactions) {
        if (transactions == null || transactions.isEmpty()) {
            throw new DataValidationException("Transaction ledger is empty");
        }
        int index = 0;
        for (Transaction transaction : transactions) {
            String problem = describeProblem(transaction);
            if (problem != null) {
                throw new DataValidationException(
                    String.format("Malformed transaction at position %d: %s (%s)", index, problem, transaction));
            }
            index++;
        }
    }

    /**
     * @return true if the record carries every required field with a legal value
     */
    public static boolean isValid(Transaction transaction) {
        return describeProblem(transaction) == null;
    }

    private static String describeProblem(Transaction transaction) {
        if (transaction == null) {
            return "record is null";
        }
        if (isBlank(transaction.getTransactionId())) {
            return "missing transaction_id";
        }
        if (isBlank(transaction.getCustomerId())) {
            return "missing customer_id";
        }
        if (isBlank(transaction.getProductId())) {
            return "missing product_id";
        }
        if (transaction.getQuantity() <= 0) {
            return "quantity must be positive";
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }
}
