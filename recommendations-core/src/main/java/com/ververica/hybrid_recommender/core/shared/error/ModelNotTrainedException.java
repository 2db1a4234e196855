package com.ververica.hybrid_recommender.core.shared.error;

public class ModelNotTrainedException extends RecommendationException {

    private static final long serialVersionUID = 1L;

    public ModelNotTrainedException(String modelName) {
        super(modelName + " has not been trained yet");
    }
}
