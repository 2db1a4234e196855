package com.ververica.hybrid_recommender.core.service;

import com.ververica.hybrid_recommender.core.ml.BasketRuleMiner;
import com.ververica.hybrid_recommender.core.ml.SimilarityModel;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.error.DataValidationException;
import com.ververica.hybrid_recommender.core.shared.error.ModelNotTrainedException;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationRequest;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationResult;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationType;
import com.ververica.hybrid_recommender.core.shared.model.RecommendedProduct;
import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Single entry point for recommendation queries.
 *
 * RECOMMENDATION STRATEGIES:
 *
 * 1. ITEM_BASED:
 *    - Requires: productId
 *    - Logic: top-N products most similar to productId (cosine over purchase vectors)
 *
 * 2. MARKET_BASKET:
 *    - Requires: basket
 *    - Logic: association rules whose antecedent is in the basket
 *
 * 3. HYBRID:
 *    - Requires: productId and/or basket
 *    - Logic: 0.6 × item score (top-10 similar items) + 0.4 × basket score
 *
 * ERRORS:
 * - DataValidationException when the mode's required input is missing
 * - ModelNotTrainedException when a model the query needs was never built
 * Everything else propagates untouched. No match is a normal, empty result with
 * confidence 0.0.
 *
 * Queries only read the published models and may run concurrently.
 */
public class RecommendationService {

    private static final Logger LOG = LoggerFactory.getLogger(RecommendationService.class);

    static final String ITEM_MODEL_NAME = "Item similarity model";
    static final String BASKET_MODEL_NAME = "Basket rule model";

    private final RecommenderConfig config;
    private final SimilarityModel similarityModel;
    private final BasketRuleMiner ruleMiner;
    private final HybridRanker ranker;

    public RecommendationService(RecommenderConfig config, SimilarityModel similarityModel, BasketRuleMiner ruleMiner) {
        this.config = config;
        this.similarityModel = similarityModel;
        this.ruleMiner = ruleMiner;
        this.ranker = new HybridRanker(config);
    }

    public RecommendationResult getRecommendations(
            String customerId,
            String productId,
            List<String> basket,
            RecommendationType mode) {
        return getRecommendations(RecommendationRequest.builder(mode)
            .withCustomerId(customerId)
            .withProductId(productId)
            .withBasket(basket)
            .build());
    }

    public RecommendationResult getRecommendations(RecommendationRequest request) {
        validateBasketEntries(request);

        RecommendationResult result;
        switch (request.getMode()) {
            case ITEM_BASED:
                result = itemBased(request);
                break;
            case MARKET_BASKET:
                result = marketBasket(request);
                break;
            case HYBRID:
                result = hybrid(request);
                break;
            default:
                throw new DataValidationException("Unsupported recommendation mode: " + request.getMode());
        }

        LOG.debug("Answered {} with {}", request, result);
        return result;
    }

    // ========================================
    // Modes
    // ========================================

    private RecommendationResult itemBased(RecommendationRequest request) {
        if (!request.hasProductId()) {
            throw new DataValidationException("item_based recommendations require a product_id");
        }
        requireTrained(similarityModel.isTrained(), ITEM_MODEL_NAME);

        List<ScoredProduct> similar = similarityModel.getSimilar(
            request.getProductId(), config.getTopNRecommendations());

        String explanation = similar.isEmpty()
            ? String.format("No products similar to %s were found in customer purchase patterns", request.getProductId())
            : String.format("Products similar to %s based on customer purchase patterns", request.getProductId());
        return toResult(request, similar, RecommendationType.ITEM_BASED, explanation);
    }

    private RecommendationResult marketBasket(RecommendationRequest request) {
        if (!request.hasBasket()) {
            throw new DataValidationException("market_basket recommendations require a non-empty basket");
        }
        requireTrained(ruleMiner.isTrained(), BASKET_MODEL_NAME);

        List<ScoredProduct> recommendations = ruleMiner.getBasketRecommendations(request.getBasket());

        String explanation = recommendations.isEmpty()
            ? String.format("No association rules matched basket %s", request.getBasket())
            : String.format("Products frequently bought together with basket %s", request.getBasket());
        return toResult(request, recommendations, RecommendationType.MARKET_BASKET, explanation);
    }

    private RecommendationResult hybrid(RecommendationRequest request) {
        if (!request.hasProductId() && !request.hasBasket()) {
            throw new DataValidationException("hybrid recommendations require a product_id, a basket, or both");
        }

        List<ScoredProduct> itemScores = Collections.emptyList();
        if (request.hasProductId()) {
            requireTrained(similarityModel.isTrained(), ITEM_MODEL_NAME);
            itemScores = similarityModel.getSimilar(request.getProductId(), config.getHybridItemCandidates());
        }

        List<ScoredProduct> basketScores = Collections.emptyList();
        if (request.hasBasket()) {
            requireTrained(ruleMiner.isTrained(), BASKET_MODEL_NAME);
            basketScores = ruleMiner.getBasketRecommendations(request.getBasket());
        }

        List<ScoredProduct> ranked = ranker.rank(itemScores, basketScores, config.getTopNRecommendations());
        return toResult(request, ranked, RecommendationType.HYBRID, describeHybrid(request, ranked.isEmpty()));
    }

    // ========================================
    // Helpers
    // ========================================

    private static RecommendationResult toResult(
            RecommendationRequest request,
            List<ScoredProduct> ranked,
            RecommendationType type,
            String explanation) {
        List<RecommendedProduct> products = ranked.stream()
            .map(scored -> RecommendedProduct.of(scored, type))
            .collect(Collectors.toList());
        return RecommendationResult.of(request.getCustomerId(), products, type, explanation);
    }

    private String describeHybrid(RecommendationRequest request, boolean empty) {
        StringBuilder inputs = new StringBuilder();
        if (request.hasProductId()) {
            inputs.append("item similarity to ").append(request.getProductId());
        }
        if (request.hasBasket()) {
            if (inputs.length() > 0) {
                inputs.append(" and ");
            }
            inputs.append("basket rules for ").append(request.getBasket());
        }
        if (empty) {
            return "No hybrid recommendations found using " + inputs;
        }
        return String.format(Locale.ROOT, "Hybrid recommendations blending %s (weights %.1f / %.1f)",
            inputs, ranker.getItemBasedWeight(), ranker.getBasketWeight());
    }

    private static void requireTrained(boolean trained, String modelName) {
        if (!trained) {
            throw new ModelNotTrainedException(modelName);
        }
    }

    private static void validateBasketEntries(RecommendationRequest request) {
        if (request.getBasket() == null) {
            return;
        }
        for (String item : request.getBasket()) {
            if (item == null || item.trim().isEmpty()) {
                throw new DataValidationException("Basket contains a blank product id: " + request.getBasket());
            }
        }
    }
}
