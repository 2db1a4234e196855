package com.ververica.hybrid_recommender.core.shared.error;

/**
 * Base type for the failures the recommendation engine reports to its callers.
 *
 * Only two kinds exist:
 * - {@link DataValidationException}: bad input to a build or a query
 * - {@link ModelNotTrainedException}: query against a model that was never built
 *
 * "No recommendation found" is not an error and never surfaces as one.
 */
public abstract class RecommendationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected RecommendationException(String message) {
        super(message);
    }

    protected RecommendationException(String message, Throwable cause) {
        super(message, cause);
    }
}
