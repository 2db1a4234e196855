package com.ververica.hybrid_recommender.core.shared.config;

import java.io.Serializable;

/**
 * Configuration for the recommendation engine.
 *
 * PATTERN: Configuration Management
 * Centralized, immutable configuration with a fluent builder and environment variable support.
 *
 * Example usage:
 * <pre>{@code
 * // From environment variables
 * RecommenderConfig config = RecommenderConfig.fromEnvironment();
 *
 * // Custom configuration
 * RecommenderConfig config = RecommenderConfig.builder()
 *     .withMinSupport(0.02)
 *     .withMinConfidence(0.2)
 *     .withTopNRecommendations(10)
 *     .build();
 * }</pre>
 */
public class RecommenderConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_MIN_SUPPORT = 0.01;
    public static final double DEFAULT_MIN_CONFIDENCE = 0.1;
    public static final int DEFAULT_TOP_N = 5;
    public static final double DEFAULT_ITEM_BASED_WEIGHT = 0.6;
    public static final double DEFAULT_BASKET_WEIGHT = 0.4;
    public static final int DEFAULT_HYBRID_ITEM_CANDIDATES = 10;

    // Rule mining thresholds
    private final double minSupport;
    private final double minConfidence;
    private final int miningParallelism;

    // Ranking
    private final int topNRecommendations;
    private final double itemBasedWeight;
    private final double basketWeight;
    private final int hybridItemCandidates;

    // Offline evaluation
    private final int holdoutItemsPerCustomer;
    private final int evaluationK;

    private RecommenderConfig(Builder builder) {
        this.minSupport = builder.minSupport;
        this.minConfidence = builder.minConfidence;
        this.miningParallelism = builder.miningParallelism;
        this.topNRecommendations = builder.topNRecommendations;
        this.itemBasedWeight = builder.itemBasedWeight;
        this.basketWeight = builder.basketWeight;
        this.hybridItemCandidates = builder.hybridItemCandidates;
        this.holdoutItemsPerCustomer = builder.holdoutItemsPerCustomer;
        this.evaluationK = builder.evaluationK > 0 ? builder.evaluationK : builder.topNRecommendations;
    }

    /**
     * Creates a new builder with default values.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a builder pre-populated with this configuration's values.
     */
    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.minSupport = minSupport;
        builder.minConfidence = minConfidence;
        builder.miningParallelism = miningParallelism;
        builder.topNRecommendations = topNRecommendations;
        builder.itemBasedWeight = itemBasedWeight;
        builder.basketWeight = basketWeight;
        builder.hybridItemCandidates = hybridItemCandidates;
        builder.holdoutItemsPerCustomer = holdoutItemsPerCustomer;
        builder.evaluationK = evaluationK;
        return builder;
    }

    /**
     * Configuration with every option at its default.
     */
    public static RecommenderConfig defaults() {
        return builder().build();
    }

    /**
     * Creates a RecommenderConfig from environment variables.
     *
     * Environment variables:
     * - RECO_MIN_SUPPORT (default: 0.01)
     * - RECO_MIN_CONFIDENCE (default: 0.1)
     * - RECO_TOP_N (default: 5)
     * - RECO_MINING_PARALLELISM (default: 1)
     * - RECO_HOLDOUT_ITEMS (default: 1)
     * - RECO_EVALUATION_K (default: same as RECO_TOP_N)
     */
    public static RecommenderConfig fromEnvironment() {
        return builder()
            .withMinSupport(Double.parseDouble(getEnv("RECO_MIN_SUPPORT", String.valueOf(DEFAULT_MIN_SUPPORT))))
            .withMinConfidence(Double.parseDouble(getEnv("RECO_MIN_CONFIDENCE", String.valueOf(DEFAULT_MIN_CONFIDENCE))))
            .withTopNRecommendations(Integer.parseInt(getEnv("RECO_TOP_N", String.valueOf(DEFAULT_TOP_N))))
            .withMiningParallelism(Integer.parseInt(getEnv("RECO_MINING_PARALLELISM", "1")))
            .withHoldoutItemsPerCustomer(Integer.parseInt(getEnv("RECO_HOLDOUT_ITEMS", "1")))
            .withEvaluationK(Integer.parseInt(getEnv("RECO_EVALUATION_K", "0")))
            .build();
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (minSupport < 0.0 || minSupport > 1.0) {
            throw new IllegalStateException("minSupport must be within [0, 1]");
        }
        if (minConfidence < 0.0 || minConfidence > 1.0) {
            throw new IllegalStateException("minConfidence must be within [0, 1]");
        }
        if (topNRecommendations <= 0) {
            throw new IllegalStateException("topNRecommendations must be positive");
        }
        if (itemBasedWeight < 0.0 || basketWeight < 0.0) {
            throw new IllegalStateException("Hybrid weights cannot be negative");
        }
        if (hybridItemCandidates <= 0) {
            throw new IllegalStateException("hybridItemCandidates must be positive");
        }
        if (miningParallelism <= 0) {
            throw new IllegalStateException("miningParallelism must be positive");
        }
        if (holdoutItemsPerCustomer <= 0) {
            throw new IllegalStateException("holdoutItemsPerCustomer must be positive");
        }
    }

    // Getters
    public double getMinSupport() {
        return minSupport;
    }

    public double getMinConfidence() {
        return minConfidence;
    }

    public int getMiningParallelism() {
        return miningParallelism;
    }

    public int getTopNRecommendations() {
        return topNRecommendations;
    }

    public double getItemBasedWeight() {
        return itemBasedWeight;
    }

    public double getBasketWeight() {
        return basketWeight;
    }

    public int getHybridItemCandidates() {
        return hybridItemCandidates;
    }

    public int getHoldoutItemsPerCustomer() {
        return holdoutItemsPerCustomer;
    }

    public int getEvaluationK() {
        return evaluationK;
    }

    @Override
    public String toString() {
        return "RecommenderConfig{" +
               "minSupport=" + minSupport +
               ", minConfidence=" + minConfidence +
               ", miningParallelism=" + miningParallelism +
               ", topNRecommendations=" + topNRecommendations +
               ", itemBasedWeight=" + itemBasedWeight +
               ", basketWeight=" + basketWeight +
               ", hybridItemCandidates=" + hybridItemCandidates +
               ", holdoutItemsPerCustomer=" + holdoutItemsPerCustomer +
               ", evaluationK=" + evaluationK +
               '}';
    }

    // Helper methods
    private static String getEnv(String key, String defaultValue) {
        String value = System.getenv(key);
        return value != null ? value : defaultValue;
    }

    /**
     * Builder for RecommenderConfig with fluent API.
     */
    public static class Builder {
        // Defaults
        private double minSupport = DEFAULT_MIN_SUPPORT;
        private double minConfidence = DEFAULT_MIN_CONFIDENCE;
        private int miningParallelism = 1;

        private int topNRecommendations = DEFAULT_TOP_N;
        private double itemBasedWeight = DEFAULT_ITEM_BASED_WEIGHT;
        private double basketWeight = DEFAULT_BASKET_WEIGHT;
        private int hybridItemCandidates = DEFAULT_HYBRID_ITEM_CANDIDATES;

        private int holdoutItemsPerCustomer = 1;
        private int evaluationK = 0; // 0 = use topNRecommendations

        private Builder() {}

        public Builder withMinSupport(double minSupport) {
            if (minSupport < 0.0 || minSupport > 1.0) {
                throw new IllegalArgumentException("minSupport must be within [0, 1]");
            }
            this.minSupport = minSupport;
            return this;
        }

        public Builder withMinConfidence(double minConfidence) {
            if (minConfidence < 0.0 || minConfidence > 1.0) {
                throw new IllegalArgumentException("minConfidence must be within [0, 1]");
            }
            this.minConfidence = minConfidence;
            return this;
        }

        public Builder withMiningParallelism(int miningParallelism) {
            if (miningParallelism <= 0) {
                throw new IllegalArgumentException("miningParallelism must be positive");
            }
            this.miningParallelism = miningParallelism;
            return this;
        }

        public Builder withTopNRecommendations(int topNRecommendations) {
            if (topNRecommendations <= 0) {
                throw new IllegalArgumentException("topNRecommendations must be positive");
            }
            this.topNRecommendations = topNRecommendations;
            return this;
        }

        public Builder withItemBasedWeight(double itemBasedWeight) {
            if (itemBasedWeight < 0.0) {
                throw new IllegalArgumentException("itemBasedWeight cannot be negative");
            }
            this.itemBasedWeight = itemBasedWeight;
            return this;
        }

        public Builder withBasketWeight(double basketWeight) {
            if (basketWeight < 0.0) {
                throw new IllegalArgumentException("basketWeight cannot be negative");
            }
            this.basketWeight = basketWeight;
            return this;
        }

        public Builder withHybridItemCandidates(int hybridItemCandidates) {
            if (hybridItemCandidates <= 0) {
                throw new IllegalArgumentException("hybridItemCandidates must be positive");
            }
            this.hybridItemCandidates = hybridItemCandidates;
            return this;
        }

        public Builder withHoldoutItemsPerCustomer(int holdoutItemsPerCustomer) {
            if (holdoutItemsPerCustomer <= 0) {
                throw new IllegalArgumentException("holdoutItemsPerCustomer must be positive");
            }
            this.holdoutItemsPerCustomer = holdoutItemsPerCustomer;
            return this;
        }

        public Builder withEvaluationK(int evaluationK) {
            if (evaluationK < 0) {
                throw new IllegalArgumentException("evaluationK cannot be negative");
            }
            this.evaluationK = evaluationK;
            return this;
        }

        public RecommenderConfig build() {
            RecommenderConfig config = new RecommenderConfig(this);
            config.validate();
            return config;
        }
    }
}
