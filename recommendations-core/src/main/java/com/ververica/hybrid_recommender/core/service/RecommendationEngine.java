package com.ververica.hybrid_recommender.core.service;

import com.ververica.hybrid_recommender.core.ledger.TransactionValidator;
import com.ververica.hybrid_recommender.core.ml.BasketRuleMiner;
import com.ververica.hybrid_recommender.core.ml.SimilarityModel;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationRequest;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationResult;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wires both models and the query service together.
 *
 * PATTERN FLOW:
 * <pre>
 * Transaction ledger
 *   │
 *   ├─→ SimilarityModel.build  ─┐  (concurrently, each publishes by swap)
 *   └─→ BasketRuleMiner.build  ─┘
 *                                │
 *                                ▼
 *                     RecommendationService (read-only queries)
 * </pre>
 *
 * train() may be called again at any time; queries keep being served from the
 * previous models until each new one is published.
 */
public class RecommendationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RecommendationEngine.class);

    private final RecommenderConfig config;
    private final SimilarityModel similarityModel;
    private final BasketRuleMiner ruleMiner;
    private final RecommendationService service;

    public RecommendationEngine(RecommenderConfig config) {
        this.config = config;
        this.similarityModel = new SimilarityModel();
        this.ruleMiner = new BasketRuleMiner(config);
        this.service = new RecommendationService(config, similarityModel, ruleMiner);
    }

    /**
     * Builds both models from one ledger snapshot.
     *
     * @throws com.ververica.hybrid_recommender.core.shared.error.DataValidationException
     *         if the ledger is empty or malformed; no model is replaced in that case
     */
    public void train(Collection<Transaction> transactions) {
        TransactionValidator.validateLedger(transactions);
        List<Transaction> snapshot = new ArrayList<>(transactions);
        long start = System.currentTimeMillis();

        ExecutorService executor = Executors.newFixedThreadPool(2, trainingThreadFactory());
        try {
            CompletableFuture<Void> similarity =
                CompletableFuture.runAsync(() -> similarityModel.build(snapshot), executor);
            CompletableFuture<Void> rules =
                CompletableFuture.runAsync(() -> ruleMiner.build(snapshot), executor);

            CompletableFuture.allOf(similarity, rules).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        } finally {
            executor.shutdown();
        }

        LOG.info("Trained recommendation models on {} transactions in {}ms",
            snapshot.size(), System.currentTimeMillis() - start);
    }

    /** Daemon threads named model-training-1, model-training-2, ... */
    static ThreadFactory trainingThreadFactory() {
        AtomicInteger workerId = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "model-training-" + workerId.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public RecommendationResult recommend(RecommendationRequest request) {
        return service.getRecommendations(request);
    }

    public RecommenderConfig getConfig() {
        return config;
    }

    public SimilarityModel getSimilarityModel() {
        return similarityModel;
    }

    public BasketRuleMiner getRuleMiner() {
        return ruleMiner;
    }

    public RecommendationService getService() {
        return service;
    }
}
