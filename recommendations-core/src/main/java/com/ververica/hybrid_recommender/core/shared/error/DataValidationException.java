package com.ververica.hybrid_recommender.core.shared.error;

/**
 * Raised when a build receives an empty or malformed ledger, or when a query
 * is issued without the input its mode requires.
 */
public class DataValidationException extends RecommendationException {

    private static final long serialVersionUID = 1L;

    public DataValidationException(String message) {
        super(message);
    }

    public DataValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
