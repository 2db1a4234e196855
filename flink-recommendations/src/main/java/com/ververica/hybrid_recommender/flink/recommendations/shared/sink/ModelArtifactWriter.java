package com.ververica.hybrid_recommender.flink.recommendations.shared.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.ververica.hybrid_recommender.core.evaluation.EvaluationReport;
import com.ververica.hybrid_recommender.core.ml.RuleSet;
import com.ververica.hybrid_recommender.core.ml.SimilarityMatrix;
import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Writes trained models and the evaluation report as JSON files.
 *
 * OUTPUT LAYOUT:
 * <pre>
 * output/
 *   association-rules.json    {"total_baskets": n, "frequent_items": {...}, "rules": [...]}
 *   item-similarity.json      {"product": [{"product_id": ..., "score": ...}, ...], ...}
 *   evaluation-report.json    EvaluationReport
 *   synthetic-ledger.jsonl    only when the job generated its own ledger
 * </pre>
 *
 * Products and rules are written in sorted order, so two runs over the same
 * ledger produce identical files.
 */
public class ModelArtifactWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ModelArtifactWriter.class);

    public static final String RULES_FILE = "association-rules.json";
    public static final String SIMILARITY_FILE = "item-similarity.json";
    public static final String EVALUATION_FILE = "evaluation-report.json";
    public static final String SYNTHETIC_LEDGER_FILE = "synthetic-ledger.jsonl";

    private final Path outputDir;
    private final ObjectMapper mapper;
    private final ObjectWriter prettyWriter;

    public ModelArtifactWriter(Path outputDir) {
        this.outputDir = outputDir;
        this.mapper = new ObjectMapper();
        this.prettyWriter = mapper.writerWithDefaultPrettyPrinter();
    }

    public Path writeRules(RuleSet ruleSet) throws IOException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("total_baskets", ruleSet.getTotalBaskets());
        document.put("frequent_items", new TreeMap<>(ruleSet.getFrequentItemSupport()));
        document.put("rules", ruleSet.getRules());
        return write(RULES_FILE, document);
    }

    /**
     * @param neighbours how many of each product's most similar products to keep
     */
    public Path writeSimilarity(SimilarityMatrix matrix, int neighbours) throws IOException {
        Map<String, List<ScoredProduct>> rows = new LinkedHashMap<>();
        for (String productId : new TreeSet<>(matrix.productIds())) {
            List<ScoredProduct> row = matrix.row(productId);
            rows.put(productId, new ArrayList<>(row.subList(0, Math.min(neighbours, row.size()))));
        }
        return write(SIMILARITY_FILE, rows);
    }

    public Path writeEvaluation(EvaluationReport report) throws IOException {
        return write(EVALUATION_FILE, report);
    }

    public Path writeLedger(List<Transaction> ledger) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(SYNTHETIC_LEDGER_FILE);
        try (BufferedWriter writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8)) {
            for (Transaction transaction : ledger) {
                writer.write(mapper.writeValueAsString(transaction));
                writer.newLine();
            }
        }
        LOG.info("Wrote {} ledger lines to {}", ledger.size(), target);
        return target;
    }

    private Path write(String fileName, Object document) throws IOException {
        Files.createDirectories(outputDir);
        Path target = outputDir.resolve(fileName);
        prettyWriter.writeValue(target.toFile(), document);
        LOG.info("Wrote {}", target);
        return target;
    }
}
