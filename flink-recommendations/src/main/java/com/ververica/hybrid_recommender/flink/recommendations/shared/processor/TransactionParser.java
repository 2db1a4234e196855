package com.ververica.hybrid_recommender.flink.recommendations.shared.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ververica.hybrid_recommender.core.ledger.LedgerMappers;
import com.ververica.hybrid_recommender.core.ledger.TransactionValidator;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses ledger lines into validated {@link Transaction} records.
 *
 * PATTERN: Data Transformation / Parsing
 *
 * Handles both:
 * - JSON lines: {"transaction_id":"T1","customer_id":"C1","product_id":"A","quantity":1,"timestamp":...}
 * - JSON arrays on one line: [{...}, {...}]
 *
 * USAGE:
 * <pre>
 * DataStream<String> rawLines = ...;
 * DataStream<Transaction> transactions = rawLines.process(new TransactionParser());
 * </pre>
 *
 * ERROR HANDLING:
 * - Unparseable lines and records failing validation are logged and dropped
 * - Dropped records are counted per subtask and reported on close
 * - The training job fails later if nothing valid survives
 */
public class TransactionParser extends ProcessFunction<String, Transaction> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(TransactionParser.class);

    // Transient because ObjectMapper is not serializable
    private transient ObjectMapper mapper;

    private long accepted;
    private long rejected;

    @Override
    public void open(Configuration parameters) {
        mapper = LedgerMappers.newLedgerMapper();
        accepted = 0;
        rejected = 0;
    }

    @Override
    public void processElement(String value, Context ctx, Collector<Transaction> out) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }

        String trimmed = value.trim();
        try {
            if (trimmed.startsWith("[")) {
                for (Transaction transaction : mapper.readValue(trimmed, Transaction[].class)) {
                    emitIfValid(transaction, out);
                }
            } else if (trimmed.startsWith("{")) {
                emitIfValid(mapper.readValue(trimmed, Transaction.class), out);
            } else {
                rejected++;
                LOG.warn("Ledger line is not JSON, skipping: {}", abbreviate(trimmed));
            }
        } catch (Exception e) {
            rejected++;
            LOG.warn("Failed to parse ledger line: {}. Error: {}", abbreviate(trimmed), e.getMessage());
        }
    }

    @Override
    public void close() {
        if (rejected > 0) {
            LOG.warn("Dropped {} malformed ledger records, kept {}", rejected, accepted);
        } else {
            LOG.info("Parsed {} ledger records", accepted);
        }
    }

    private void emitIfValid(Transaction transaction, Collector<Transaction> out) {
        if (TransactionValidator.isValid(transaction)) {
            accepted++;
            out.collect(transaction);
        } else {
            rejected++;
            LOG.warn("Invalid transaction, skipping: {}", transaction);
        }
    }

    public long getAcceptedCount() {
        return accepted;
    }

    public long getRejectedCount() {
        return rejected;
    }

    private static String abbreviate(String value) {
        return value.substring(0, Math.min(200, value.length()));
    }
}
