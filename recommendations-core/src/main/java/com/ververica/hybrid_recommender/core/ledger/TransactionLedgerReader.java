package com.ververica.hybrid_recommender.core.ledger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ververica.hybrid_recommender.core.shared.error.DataValidationException;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads a materialized transaction ledger.
 *
 * Handles both:
 * - JSON lines: one transaction object per line
 * - JSON arrays: [{"transaction_id":"T1",...}, {"transaction_id":"T2",...}]
 *
 * ERROR HANDLING:
 * Unlike the streaming parser, a ledger is read as a whole. A line that is not a
 * parseable transaction fails the read with a DataValidationException naming the
 * line number; nothing is skipped silently.
 */
public class TransactionLedgerReader {

    private static final Logger LOG = LoggerFactory.getLogger(TransactionLedgerReader.class);

    private final ObjectMapper mapper;

    public TransactionLedgerReader() {
        this(LedgerMappers.newLedgerMapper());
    }

    public TransactionLedgerReader(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public List<Transaction> read(Path path) {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Transaction> transactions = read(reader);
            LOG.info("Read {} transactions from {}", transactions.size(), path);
            return transactions;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ledger " + path, e);
        }
    }

    public List<Transaction> read(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader
            ? (BufferedReader) source
            : new BufferedReader(source);

        StringBuilder content = new StringBuilder();
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
            content.append(line).append('\n');
        }

        String trimmed = content.toString().trim();
        if (trimmed.startsWith("[")) {
            return parseArray(trimmed);
        }
        return parseLines(lines);
    }

    /**
     * Parses a single JSON-encoded transaction.
     *
     * @throws DataValidationException if the text is not a transaction object
     */
    public Transaction parse(String json) {
        try {
            return mapper.readValue(json, Transaction.class);
        } catch (JsonProcessingException e) {
            throw new DataValidationException("Unparseable transaction: " + abbreviate(json), e);
        }
    }

    private List<Transaction> parseArray(String json) {
        try {
            return new ArrayList<>(Arrays.asList(mapper.readValue(json, Transaction[].class)));
        } catch (JsonProcessingException e) {
            throw new DataValidationException("Ledger is not a valid transaction array: " + e.getOriginalMessage(), e);
        }
    }

    private List<Transaction> parseLines(List<String> lines) {
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                transactions.add(mapper.readValue(line, Transaction.class));
            } catch (JsonProcessingException e) {
                throw new DataValidationException(
                    String.format("Unparseable transaction on line %d: %s", i + 1, abbreviate(line)), e);
            }
        }
        return transactions;
    }

    private static String abbreviate(String value) {
        return value.substring(0, Math.min(200, value.length()));
    }
}
