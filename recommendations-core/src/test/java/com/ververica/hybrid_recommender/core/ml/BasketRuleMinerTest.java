package com.ververica.hybrid_recommender.core.ml;

import com.ververica.hybrid_recommender.core.LedgerFixtures;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.error.DataValidationException;
import com.ververica.hybrid_recommender.core.shared.model.ScoredProduct;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.ververica.hybrid_recommender.core.LedgerFixtures.line;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class BasketRuleMinerTest {

    private static final RecommenderConfig CONFIG = RecommenderConfig.builder()
        .withMinSupport(0.01)
        .withMinConfidence(0.1)
        .build();

    @Test
    public void minesBothDirectionsOfAPair() {
        BasketRuleMiner miner = new BasketRuleMiner(CONFIG);
        // baskets {A,B} {A,B} {A}
        RuleSet ruleSet = miner.build(List.of(
            line("T1", "C1", "A", 1),
            line("T1", "C1", "B", 1),
            line("T2", "C2", "A", 1),
            line("T2", "C2", "B", 1),
            line("T3", "C3", "A", 1)));

        assertEquals(3, ruleSet.getTotalBaskets());
        assertEquals(1.0, ruleSet.getFrequentItemSupport().get("A"), 1e-12);
        assertEquals(2.0 / 3, ruleSet.getFrequentItemSupport().get("B"), 1e-12);
        assertEquals(2, ruleSet.size());

        AssociationRule aToB = ruleSet.rulesFrom("A").get(0);
        assertEquals("B", aToB.getConsequent());
        assertEquals(2.0 / 3, aToB.getSupport(), 1e-12);
        assertEquals(2.0 / 3, aToB.getConfidence(), 1e-12);
        assertEquals(1.0, aToB.getLift(), 1e-12);

        AssociationRule bToA = ruleSet.rulesFrom("B").get(0);
        assertEquals("A", bToA.getConsequent());
        assertEquals(1.0, bToA.getConfidence(), 1e-12);
        assertEquals(1.0, bToA.getLift(), 1e-12);

        List<ScoredProduct> recommendations = miner.getBasketRecommendations(List.of("A"));
        assertEquals(1, recommendations.size());
        assertEquals("B", recommendations.get(0).getProductId());
        assertEquals(2.0 / 3, recommendations.get(0).getScore(), 1e-12);
    }

    @Test
    public void dropsDirectionsBelowMinConfidence() {
        RecommenderConfig strict = RecommenderConfig.builder().withMinConfidence(0.9).build();
        BasketRuleMiner miner = new BasketRuleMiner(strict);
        miner.build(List.of(
            line("T1", "C1", "A", 1),
            line("T1", "C1", "B", 1),
            line("T2", "C2", "A", 1),
            line("T2", "C2", "B", 1),
            line("T3", "C3", "A", 1)));

        List<AssociationRule> rules = miner.getRules();
        assertEquals(1, rules.size());
        assertEquals("B", rules.get(0).getAntecedent());
        for (AssociationRule rule : rules) {
            assertTrue(rule.getConfidence() >= 0.9);
            assertNotEquals(rule.getAntecedent(), rule.getConsequent());
        }
    }

    @Test
    public void infrequentItemsProduceNoRules() {
        RecommenderConfig config = RecommenderConfig.builder().withMinSupport(0.5).build();
        BasketRuleMiner miner = new BasketRuleMiner(config);
        // C appears in 1 of 3 baskets
        miner.build(List.of(
            line("T1", "C1", "A", 1),
            line("T1", "C1", "C", 1),
            line("T2", "C2", "A", 1),
            line("T2", "C2", "B", 1),
            line("T3", "C3", "B", 1),
            line("T3", "C3", "A", 1)));

        for (AssociationRule rule : miner.getRules()) {
            assertNotEquals("C", rule.getAntecedent());
            assertNotEquals("C", rule.getConsequent());
        }
        assertFalse(miner.getRuleSet().getFrequentItemSupport().containsKey("C"));
    }

    @Test
    public void neverRecommendsBasketItemsAndKeepsMaxScorePerConsequent() {
        BasketRuleMiner miner = new BasketRuleMiner(CONFIG);
        miner.build(LedgerFixtures.hybridLedger());

        List<ScoredProduct> recommendations = miner.getBasketRecommendations(List.of("A", "B"));

        Set<String> basket = Set.of("A", "B");
        for (ScoredProduct recommendation : recommendations) {
            assertFalse(basket.contains(recommendation.getProductId()));
        }
        // C is reachable from A and from B; B → C is stronger
        double fromA = miner.getRuleSet().rulesFrom("A").stream()
            .filter(rule -> rule.getConsequent().equals("C")).findFirst().orElseThrow().getScore();
        double fromB = miner.getRuleSet().rulesFrom("B").stream()
            .filter(rule -> rule.getConsequent().equals("C")).findFirst().orElseThrow().getScore();
        ScoredProduct c = recommendations.stream()
            .filter(r -> r.getProductId().equals("C")).findFirst().orElseThrow();
        assertEquals(Math.max(fromA, fromB), c.getScore(), 1e-12);
    }

    @Test
    public void truncatesToTopNSortedDescending() {
        RecommenderConfig config = RecommenderConfig.builder()
            .withMinSupport(0.01)
            .withMinConfidence(0.01)
            .withTopNRecommendations(5)
            .build();
        BasketRuleMiner miner = new BasketRuleMiner(config);
        miner.build(LedgerFixtures.eightCandidateLedger());

        List<ScoredProduct> recommendations = miner.getBasketRecommendations(List.of("X"));

        assertEquals(5, recommendations.size());
        assertEquals(List.of("P8", "P7", "P6", "P5", "P4"),
            recommendations.stream().map(ScoredProduct::getProductId).collect(Collectors.toList()));
        assertEquals(8.0 / 36, recommendations.get(0).getScore(), 1e-12);
    }

    @Test
    public void parallelMiningMatchesSequentialMining() {
        List<Transaction> ledger = syntheticLedger();

        BasketRuleMiner sequential = new BasketRuleMiner(CONFIG);
        BasketRuleMiner parallel = new BasketRuleMiner(CONFIG.toBuilder().withMiningParallelism(4).build());

        List<AssociationRule> expected = sequential.build(ledger).getRules();
        List<AssociationRule> actual = parallel.build(ledger).getRules();

        assertEquals(expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            assertEquals(expected.get(i), actual.get(i));
            assertEquals(expected.get(i).getConfidence(), actual.get(i).getConfidence(), 0.0);
            assertEquals(expected.get(i).getLift(), actual.get(i).getLift(), 0.0);
        }
    }

    @Test
    public void partitionCoversEveryIndexOnce() {
        List<int[]> ranges = BasketRuleMiner.partition(50, 8);

        int next = 0;
        for (int[] range : ranges) {
            assertEquals(next, range[0]);
            assertTrue(range[1] > range[0]);
            next = range[1];
        }
        assertEquals(50, next);
    }

    @Test
    public void unbuiltMinerReturnsNothingAndEmptyLedgerIsRejected() {
        BasketRuleMiner miner = new BasketRuleMiner(CONFIG);

        assertFalse(miner.isTrained());
        assertTrue(miner.getBasketRecommendations(List.of("A")).isEmpty());
        assertTrue(miner.getRules().isEmpty());
        assertThrows(DataValidationException.class, () -> miner.build(Collections.emptyList()));
    }

    private static List<Transaction> syntheticLedger() {
        List<Transaction> lines = new ArrayList<>();
        for (int t = 0; t < 300; t++) {
            for (int p = 0; p < 30; p++) {
                if ((t * 31 + p * 17) % 11 < 3 || (p % 5 == t % 5)) {
                    lines.add(line("T" + t, "C" + (t % 40), "P" + p, 1));
                }
            }
        }
        return lines;
    }
}
