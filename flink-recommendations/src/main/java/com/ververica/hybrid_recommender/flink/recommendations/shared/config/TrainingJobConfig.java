package com.ververica.hybrid_recommender.flink.recommendations.shared.config;

import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import org.apache.flink.api.java.utils.ParameterTool;

import java.util.Map;

/**
 * Command-line configuration of the model training job.
 *
 * Arguments (all optional):
 * <pre>
 * --input <path>                 JSON-lines transaction ledger; synthetic data when absent
 * --output <dir>                 artifact directory (default /tmp/hybrid-recommender)
 * --parallelism <n>              Flink parallelism (default 1)
 * --synthetic-customers <n>      customers to generate without --input (default 500)
 * --seed <n>                     seed of the synthetic generator (default 42)
 *
 * --min-support, --min-confidence, --top-n, --mining-parallelism,
 * --holdout-items, --evaluation-k override the RECO_* environment settings
 * </pre>
 */
public class TrainingJobConfig {

    public static final String DEFAULT_OUTPUT = "/tmp/hybrid-recommender";

    private final ParameterTool params;

    private TrainingJobConfig(final ParameterTool params) {
        this.params = params;
    }

    public static TrainingJobConfig fromArgs(String[] args) {
        return new TrainingJobConfig(ParameterTool.fromArgs(args));
    }

    public static TrainingJobConfig fromMap(Map<String, String> properties) {
        return new TrainingJobConfig(ParameterTool.fromMap(properties));
    }

    public boolean hasInput() {
        return params.has("input");
    }

    public String getInputPath() {
        return params.get("input");
    }

    public String getOutputPath() {
        return params.get("output", DEFAULT_OUTPUT);
    }

    public int getParallelism() {
        return params.getInt("parallelism", 1);
    }

    public int getSyntheticCustomers() {
        return params.getInt("synthetic-customers", 500);
    }

    public long getSeed() {
        return params.getLong("seed", 42L);
    }

    /**
     * Engine settings: RECO_* environment variables, overridden by any argument given.
     */
    public RecommenderConfig getRecommenderConfig() {
        return applyOverrides(RecommenderConfig.fromEnvironment());
    }

    RecommenderConfig applyOverrides(RecommenderConfig base) {
        RecommenderConfig.Builder builder = base.toBuilder();

        if (params.has("min-support")) {
            builder.withMinSupport(params.getDouble("min-support"));
        }
        if (params.has("min-confidence")) {
            builder.withMinConfidence(params.getDouble("min-confidence"));
        }
        if (params.has("top-n")) {
            builder.withTopNRecommendations(params.getInt("top-n"));
            if (!params.has("evaluation-k")) {
                // keep evaluation k tied to top-n
                builder.withEvaluationK(0);
            }
        }
        if (params.has("mining-parallelism")) {
            builder.withMiningParallelism(params.getInt("mining-parallelism"));
        }
        if (params.has("holdout-items")) {
            builder.withHoldoutItemsPerCustomer(params.getInt("holdout-items"));
        }
        if (params.has("evaluation-k")) {
            builder.withEvaluationK(params.getInt("evaluation-k"));
        }

        return builder.build();
    }

    @Override
    public String toString() {
        return "TrainingJobConfig" + params.toMap();
    }
}
