package com.ververica.hybrid_recommender.flink.recommendations;

import com.ververica.hybrid_recommender.core.ledger.TransactionValidator;
import com.ververica.hybrid_recommender.core.ml.AssociationRule;
import com.ververica.hybrid_recommender.core.ml.BasketRuleMiner;
import com.ververica.hybrid_recommender.core.shared.config.RecommenderConfig;
import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class SyntheticLedgerGeneratorTest {

    private static final long START = 1_700_000_000_000L;

    @Test
    public void sameSeedGivesSameLedger() {
        List<Transaction> first = new SyntheticLedgerGenerator(new Random(42), START).generate(100);
        List<Transaction> second = new SyntheticLedgerGenerator(new Random(42), START).generate(100);
        List<Transaction> other = new SyntheticLedgerGenerator(new Random(43), START).generate(100);

        assertEquals(first, second);
        assertNotEquals(first, other);
    }

    @Test
    public void generatesValidLinesInsideTheHistoryWindow() {
        List<Transaction> ledger = new SyntheticLedgerGenerator(new Random(1), START).generate(200);

        assertDoesNotThrow(() -> TransactionValidator.validateLedger(ledger));
        assertEquals(200, ledger.stream().map(Transaction::getCustomerId).distinct().count());

        long end = START + TimeUnit.DAYS.toMillis(SyntheticLedgerGenerator.DAYS_HISTORY);
        for (Transaction transaction : ledger) {
            assertTrue(transaction.getTimestamp() >= START && transaction.getTimestamp() < end);
        }
    }

    @Test
    public void templateCompanionsBecomeStrongRules() {
        List<Transaction> ledger = new SyntheticLedgerGenerator(new Random(42), START).generate(2000);
        BasketRuleMiner miner = new BasketRuleMiner(RecommenderConfig.defaults());

        List<AssociationRule> fromPhone = miner.build(ledger).rulesFrom("prod_phone_001");

        AssociationRule charger = fromPhone.stream()
            .filter(rule -> rule.getConsequent().equals("prod_charger_001"))
            .collect(Collectors.toList())
            .get(0);
        assertTrue(charger.getConfidence() > 0.6, "confidence was " + charger.getConfidence());
        assertTrue(charger.getLift() > 1.0);
    }
}
