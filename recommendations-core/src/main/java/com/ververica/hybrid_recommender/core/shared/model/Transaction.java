package com.ververica.hybrid_recommender.core.shared.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Objects;

/**
 * One purchased line item from the transaction ledger.
 *
 * Lines sharing a transactionId form one {@link Basket}.
 *
 * JSON form (one object per ledger line):
 * <pre>
 * {"transaction_id":"T1","customer_id":"C1","product_id":"A","quantity":1,"timestamp":1700000000000}
 * </pre>
 *
 * Instances are immutable. Field-level checks (non-blank ids, positive quantity)
 * are applied by TransactionValidator before a model build, so a malformed record
 * can still be read and reported with its position in the ledger.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class Transaction implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String transactionId;
    private final String customerId;
    private final String productId;
    private final int quantity;
    private final long timestamp;

    @JsonCreator
    public Transaction(
            @JsonProperty(value = "transaction_id", required = true) String transactionId,
            @JsonProperty(value = "customer_id", required = true) String customerId,
            @JsonProperty(value = "product_id", required = true) String productId,
            @JsonProperty(value = "quantity", required = true) int quantity,
            @JsonProperty(value = "timestamp", required = true) long timestamp) {
        this.transactionId = transactionId;
        this.customerId = customerId;
        this.productId = productId;
        this.quantity = quantity;
        this.timestamp = timestamp;
    }

    @JsonProperty("transaction_id")
    public String getTransactionId() {
        return transactionId;
    }

    @JsonProperty("customer_id")
    public String getCustomerId() {
        return customerId;
    }

    @JsonProperty("product_id")
    public String getProductId() {
        return productId;
    }

    @JsonProperty("quantity")
    public int getQuantity() {
        return quantity;
    }

    /** Epoch milliseconds. */
    @JsonProperty("timestamp")
    public long getTimestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Transaction that = (Transaction) o;
        return quantity == that.quantity &&
               timestamp == that.timestamp &&
               Objects.equals(transactionId, that.transactionId) &&
               Objects.equals(customerId, that.customerId) &&
               Objects.equals(productId, that.productId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transactionId, customerId, productId, quantity, timestamp);
    }

    @Override
    public String toString() {
        return String.format("Transaction{txn=%s, customer=%s, product=%s, qty=%d, time=%d}",
            transactionId, customerId, productId, quantity, timestamp);
    }
}
