package com.ververica.hybrid_recommender.core.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ververica.hybrid_recommender.core.LedgerFixtures;
import com.ververica.hybrid_recommender.core.ml.BasketRuleMiner;
import com.ververica.hybrid_recommender.core.ml.SimilarityModel;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.error.DataValidationException;
import com.ververica.hybrid_recommender.core.shared.error.ModelNotTrainedException;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationResult;
import com.ververica.hybrid_recommender.core.shared.model.RecommendationType;
import com.ververica.hybrid_recommender.core.shared.model.RecommendedProduct;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RecommendationServiceTest {

    private RecommenderConfig config;
    private SimilarityModel similarityModel;
    private BasketRuleMiner ruleMiner;
    private RecommendationService service;

    @BeforeEach
    public void setUp() {
        config = RecommenderConfig.builder()
            .withMinSupport(0.01)
            .withMinConfidence(0.1)
            .build();
        similarityModel = new SimilarityModel();
        ruleMiner = new BasketRuleMiner(config);
        service = new RecommendationService(config, similarityModel, ruleMiner);
    }

    private void train(List<Transaction> ledger) {
        similarityModel.build(ledger);
        ruleMiner.build(ledger);
    }

    @Test
    public void marketBasketReturnsFrequentlyBoughtTogether() {
        train(LedgerFixtures.abLedger());

        RecommendationResult result = service.getRecommendations("C9", null, List.of("A"), RecommendationType.MARKET_BASKET);

        assertEquals("C9", result.getCustomerId());
        assertEquals(RecommendationType.MARKET_BASKET, result.getRecommendationType());
        assertEquals(1, result.getRecommendedProducts().size());
        RecommendedProduct product = result.getRecommendedProducts().get(0);
        assertEquals("B", product.getProductId());
        assertEquals(2.0 / 3, product.getScore(), 1e-12);
        assertEquals("frequently purchased together", product.getReason());
        assertEquals(2.0 / 3, result.getConfidenceScore(), 1e-12);
    }

    @Test
    public void itemBasedReturnsMostSimilarProducts() {
        train(LedgerFixtures.abLedger());

        RecommendationResult result = service.getRecommendations("C1", "A", null, RecommendationType.ITEM_BASED);

        assertEquals(1, result.getRecommendedProducts().size());
        RecommendedProduct product = result.getRecommendedProducts().get(0);
        assertEquals("B", product.getProductId());
        assertEquals(2 / Math.sqrt(6), product.getScore(), 1e-12);
        assertEquals("similar item purchase pattern", product.getReason());
    }

    @Test
    public void hybridBlendsItemAndBasketScores() {
        train(LedgerFixtures.hybridLedger());

        RecommendationResult result = service.getRecommendations("C1", "A", List.of("B"), RecommendationType.HYBRID);

        // item: C 2/3, D 1/√3, B 1/√6; basket [B]: C 1·4/3, A 0.5·2/3
        List<String> ids = result.getRecommendedProducts().stream()
            .map(RecommendedProduct::getProductId)
            .collect(Collectors.toList());
        assertEquals(Arrays.asList("C", "D", "B", "A"), ids);

        List<RecommendedProduct> products = result.getRecommendedProducts();
        assertEquals(0.6 * (2.0 / 3) + 0.4 * (4.0 / 3), products.get(0).getScore(), 1e-12);
        assertEquals(0.6 / Math.sqrt(3), products.get(1).getScore(), 1e-12);
        assertEquals(0.6 / Math.sqrt(6), products.get(2).getScore(), 1e-12);
        assertEquals(0.4 * (1.0 / 3), products.get(3).getScore(), 1e-12);
        for (RecommendedProduct product : products) {
            assertEquals("hybrid", product.getReason());
        }
        assertEquals(RecommendationType.HYBRID, result.getRecommendationType());
    }

    @Test
    public void hybridWorksWithOnlyOneInput() {
        train(LedgerFixtures.hybridLedger());

        RecommendationResult itemOnly = service.getRecommendations(null, "D", null, RecommendationType.HYBRID);
        assertEquals("A", itemOnly.getRecommendedProducts().get(0).getProductId());
        assertEquals(0.6 / Math.sqrt(3), itemOnly.getRecommendedProducts().get(0).getScore(), 1e-12);

        RecommendationResult basketOnly = service.getRecommendations(null, null, List.of("B"), RecommendationType.HYBRID);
        assertEquals("C", basketOnly.getRecommendedProducts().get(0).getProductId());
        assertEquals(0.4 * (4.0 / 3), basketOnly.getRecommendedProducts().get(0).getScore(), 1e-12);
    }

    @Test
    public void topNBoundsTheMarketBasketResult() {
        RecommenderConfig topFive = RecommenderConfig.builder()
            .withMinSupport(0.01)
            .withMinConfidence(0.01)
            .withTopNRecommendations(5)
            .build();
        RecommendationEngine engine = new RecommendationEngine(topFive);
        engine.train(LedgerFixtures.eightCandidateLedger());

        RecommendationResult result = engine.getService()
            .getRecommendations("C1", null, List.of("X"), RecommendationType.MARKET_BASKET);

        List<String> ids = result.getRecommendedProducts().stream()
            .map(RecommendedProduct::getProductId)
            .collect(Collectors.toList());
        assertEquals(Arrays.asList("P8", "P7", "P6", "P5", "P4"), ids);
    }

    @Test
    public void missingInputIsRejected() {
        train(LedgerFixtures.abLedger());

        assertThrows(DataValidationException.class,
            () -> service.getRecommendations("C1", null, null, RecommendationType.ITEM_BASED));
        assertThrows(DataValidationException.class,
            () -> service.getRecommendations("C1", null, Collections.emptyList(), RecommendationType.MARKET_BASKET));
        assertThrows(DataValidationException.class,
            () -> service.getRecommendations("C1", "  ", null, RecommendationType.HYBRID));
        assertThrows(DataValidationException.class,
            () -> service.getRecommendations("C1", null, Arrays.asList("A", ""), RecommendationType.MARKET_BASKET));
    }

    @Test
    public void untrainedModelIsReported() {
        ModelNotTrainedException itemError = assertThrows(ModelNotTrainedException.class,
            () -> service.getRecommendations("C1", "A", null, RecommendationType.ITEM_BASED));
        assertTrue(itemError.getMessage().contains(RecommendationService.ITEM_MODEL_NAME));

        assertThrows(ModelNotTrainedException.class,
            () -> service.getRecommendations("C1", null, List.of("A"), RecommendationType.MARKET_BASKET));

        similarityModel.build(LedgerFixtures.abLedger());
        ModelNotTrainedException basketError = assertThrows(ModelNotTrainedException.class,
            () -> service.getRecommendations("C1", "A", List.of("A"), RecommendationType.HYBRID));
        assertTrue(basketError.getMessage().contains(RecommendationService.BASKET_MODEL_NAME));
    }

    @Test
    public void noMatchIsAnEmptyResultNotAnError() {
        train(LedgerFixtures.abLedger());

        RecommendationResult result = service.getRecommendations(null, "Z", null, RecommendationType.ITEM_BASED);

        assertTrue(result.isEmpty());
        assertEquals(0.0, result.getConfidenceScore(), 0.0);
        assertEquals(RecommendationResult.UNKNOWN_CUSTOMER, result.getCustomerId());
        assertFalse(result.getExplanation().isEmpty());
    }

    @Test
    public void resultSerializesToSnakeCaseContract() throws Exception {
        train(LedgerFixtures.abLedger());
        ObjectMapper mapper = new ObjectMapper();

        RecommendationResult result = service.getRecommendations("C1", null, List.of("A"), RecommendationType.MARKET_BASKET);
        JsonNode json = mapper.readTree(mapper.writeValueAsString(result));

        assertEquals("C1", json.get("customer_id").asText());
        assertEquals("market_basket", json.get("recommendation_type").asText());
        assertEquals(2.0 / 3, json.get("confidence_score").asDouble(), 1e-12);
        assertTrue(json.has("explanation"));
        assertFalse(json.has("empty"));

        JsonNode product = json.get("recommended_products").get(0);
        assertEquals("B", product.get("product_id").asText());
        assertEquals("frequently purchased together", product.get("reason").asText());

        RecommendationResult roundTripped = mapper.readValue(mapper.writeValueAsString(result), RecommendationResult.class);
        assertEquals(result.getRecommendedProducts(), roundTripped.getRecommendedProducts());
    }

    @Test
    public void identicalLedgersGiveIdenticalAnswers() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        RecommendationEngine first = new RecommendationEngine(config);
        RecommendationEngine second = new RecommendationEngine(config.toBuilder().withMiningParallelism(3).build());
        first.train(LedgerFixtures.hybridLedger());
        second.train(LedgerFixtures.hybridLedger());

        for (RecommendationType mode : RecommendationType.values()) {
            String a = mapper.writeValueAsString(
                first.getService().getRecommendations("C1", "A", List.of("B"), mode));
            String b = mapper.writeValueAsString(
                second.getService().getRecommendations("C1", "A", List.of("B"), mode));
            assertEquals(a, b);
        }
    }
}
