package com.ververica.hybrid_recommender.flink.recommendations;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ververica.hybrid_recommender.core.evaluation.EvaluationReport;
import com.ververica.hybrid_recommender.core.evaluation.EvaluationReporter;
import com.ververica.hybrid_recommender.core.service.RecommendationEngine;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.error.DataValidationException;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import com.ververica.hybrid_recommender.flink.recommendations.shared.config.TrainingJobConfig;
import com.ververica.hybrid_recommender.flink.recommendations.shared.processor.TransactionParser;
import com.ververica.hybrid_recommender.flink.recommendations.shared.sink.ModelArtifactWriter;
import org.apache.flink.api.common.RuntimeExecutionMode;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.file.src.FileSource;
import org.apache.flink.connector.file.src.reader.TextLineInputFormat;
import org.apache.flink.core.fs.Path;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.CloseableIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Random;
import java.util.concurrent.TimeUnit;

/**
 * MODEL TRAINING JOB - Batch ingestion + offline model build
 *
 * Reads a transaction ledger with Flink in BATCH mode, trains the item-similarity
 * model and the basket rule miner, back-tests the hybrid ranking on withheld
 * purchases and writes everything as JSON artifacts.
 *
 * PATTERN FLOW:
 * <pre>
 * Ledger (FileSource, JSON lines)  or  SyntheticLedgerGenerator
 *   │
 *   ├─ TransactionParser: parse + validate, drop malformed lines
 *   │
 *   ▼
 * executeAndCollect → in-memory ledger snapshot
 *   │
 *   ├─→ RecommendationEngine.train   (similarity matrix + association rules)
 *   ├─→ EvaluationReporter.evaluate  (hold-out back-test on fresh models)
 *   │
 *   ▼
 * ModelArtifactWriter → association-rules.json, item-similarity.json, evaluation-report.json
 * </pre>
 *
 * USAGE:
 * <pre>
 * # Train on a ledger file
 * flink run flink-recommendations.jar --input /data/ledger.jsonl --output /tmp/models
 *
 * # Demo run on 2000 synthetic customers
 * flink run flink-recommendations.jar --synthetic-customers 2000 --seed 7
 * </pre>
 *
 * @see TrainingJobConfig for all arguments
 */
public class ModelTrainingJob {

    private static final Logger LOG = LoggerFactory.getLogger(ModelTrainingJob.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    // total order, so parallel reads always train on the same sequence
    private static final Comparator<Transaction> LEDGER_ORDER =
        Comparator.comparingLong(Transaction::getTimestamp)
            .thenComparing(Transaction::getTransactionId)
            .thenComparing(Transaction::getProductId)
            .thenComparing(Transaction::getCustomerId)
            .thenComparingInt(Transaction::getQuantity);

    public static void main(String[] args) throws Exception {
        TrainingJobConfig config = TrainingJobConfig.fromArgs(args);
        StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
        run(env, config);
    }

    public static EvaluationReport run(StreamExecutionEnvironment env, TrainingJobConfig config) throws Exception {

        // ========================================
        // STEP 1: Setup Environment & Configuration
        // ========================================

        env.setRuntimeMode(RuntimeExecutionMode.BATCH);
        env.setParallelism(config.getParallelism());

        RecommenderConfig engineConfig = config.getRecommenderConfig();
        ModelArtifactWriter writer = new ModelArtifactWriter(Paths.get(config.getOutputPath()));

        LOG.info("🛒 Starting Model Training Job");
        LOG.info("📊 Parallelism: {}", config.getParallelism());
        LOG.info("🔧 Engine: {}", engineConfig);
        LOG.info("📦 Output: {}", config.getOutputPath());

        // ========================================
        // STEP 2: Read & Parse Ledger
        // ========================================

        DataStream<String> rawLines;
        if (config.hasInput()) {
            LOG.info("\n📥 Reading ledger from {}", config.getInputPath());
            FileSource<String> source = FileSource
                .forRecordStreamFormat(new TextLineInputFormat(), new Path(config.getInputPath()))
                .build();
            rawLines = env.fromSource(source, WatermarkStrategy.noWatermarks(), "Transaction Ledger Source");
        } else {
            LOG.info("\n🏗️  No --input given, generating {} synthetic customers (seed {})",
                config.getSyntheticCustomers(), config.getSeed());
            long startMillis = System.currentTimeMillis() - TimeUnit.DAYS.toMillis(SyntheticLedgerGenerator.DAYS_HISTORY);
            List<Transaction> synthetic = new SyntheticLedgerGenerator(new Random(config.getSeed()), startMillis)
                .generate(config.getSyntheticCustomers());
            writer.writeLedger(synthetic);
            rawLines = env.fromCollection(toJsonLines(synthetic));
        }

        DataStream<Transaction> transactions = rawLines
            .process(new TransactionParser())
            .name("Parse Ledger Lines")
            .uid("transaction-parser");

        List<Transaction> ledger = collect(transactions);
        if (ledger.isEmpty()) {
            throw new DataValidationException("No valid transaction found in the ledger");
        }
        ledger.sort(LEDGER_ORDER);
        LOG.info("✓ Collected {} valid ledger lines", ledger.size());

        // ========================================
        // STEP 3: Train Models
        // ========================================

        LOG.info("\n🔧 Training item similarity + association rules");
        RecommendationEngine engine = new RecommendationEngine(engineConfig);
        engine.train(ledger);

        // ========================================
        // STEP 4: Offline Evaluation
        // ========================================

        LOG.info("\n📈 Back-testing hybrid recommendations on withheld purchases");
        EvaluationReport report = new EvaluationReporter(engineConfig).evaluate(ledger);
        report.getMetrics().forEach((metric, value) -> LOG.info("   {} = {}", metric, String.format(Locale.ROOT, "%.4f", value)));

        // ========================================
        // STEP 5: Write Artifacts
        // ========================================

        writer.writeRules(engine.getRuleMiner().getRuleSet());
        writer.writeSimilarity(engine.getSimilarityModel().getMatrix(), engineConfig.getTopNRecommendations());
        writer.writeEvaluation(report);

        LOG.info("✅ Model training complete!");
        LOG.info("   {} association rules, {} products with similarity rows",
            engine.getRuleMiner().getRules().size(), engine.getSimilarityModel().getMatrix().size());
        return report;
    }

    private static List<Transaction> collect(DataStream<Transaction> transactions) throws Exception {
        List<Transaction> ledger = new ArrayList<>();
        try (CloseableIterator<Transaction> iterator = transactions.executeAndCollect("Model Training Job")) {
            iterator.forEachRemaining(ledger::add);
        }
        return ledger;
    }

    private static List<String> toJsonLines(List<Transaction> ledger) throws JsonProcessingException {
        List<String> lines = new ArrayList<>(ledger.size());
        for (Transaction transaction : ledger) {
            lines.add(MAPPER.writeValueAsString(transaction));
        }
        return lines;
    }
}
