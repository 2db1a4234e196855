package com.ververica.hybrid_recommender.core.evaluation;

import com.ververica.hybrid_recommender.core.shared.model.Transaction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ververica.hybrid_recommender.core.LedgerFixtures.line;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HoldoutSplitTest {

    @Test
    public void withholdsTheMostRecentLinesPerCustomer() {
        List<Transaction> ledger = List.of(
            line("T2", "C1", "C", 1, 2_000L),
            line("T1", "C1", "B", 1, 1_000L),
            line("T1", "C1", "A", 1, 1_000L),
            line("T3", "C2", "A", 1, 1_000L));

        HoldoutSplit split = HoldoutSplit.of(ledger, 1);

        assertEquals(1, split.getHoldouts().size());
        assertEquals(1, split.getSkippedCustomers());

        HoldoutSplit.CustomerHoldout holdout = split.getHoldouts().get("C1");
        assertEquals(1, holdout.getHidden().size());
        assertEquals("C", holdout.getHidden().get(0).getProductId());
        assertEquals("A", holdout.getVisible().get(0).getProductId());
        assertEquals("B", holdout.lastVisibleProduct());
        assertEquals(List.of("A", "B"), holdout.lastVisibleBasket());

        // visible C1 lines plus every line of the skipped customer
        assertEquals(3, split.getTraining().size());
        assertFalse(split.getTraining().contains(line("T2", "C1", "C", 1, 2_000L)));
        assertTrue(split.getTraining().contains(line("T3", "C2", "A", 1, 1_000L)));
    }

    @Test
    public void lastVisibleBasketOnlyCoversTheLatestTransaction() {
        List<Transaction> ledger = List.of(
            line("T1", "C1", "A", 1, 1_000L),
            line("T2", "C1", "B", 1, 2_000L),
            line("T2", "C1", "D", 1, 2_000L),
            line("T3", "C1", "E", 1, 3_000L),
            line("T3", "C1", "F", 1, 3_000L));

        HoldoutSplit.CustomerHoldout holdout = HoldoutSplit.of(ledger, 2).getHoldouts().get("C1");

        assertEquals("D", holdout.lastVisibleProduct());
        assertEquals(List.of("B", "D"), holdout.lastVisibleBasket());
        assertEquals(2, holdout.getHidden().size());
    }

    @Test
    public void customersAreVisitedInIdOrder() {
        List<Transaction> ledger = List.of(
            line("T1", "C2", "A", 1),
            line("T1", "C2", "B", 1),
            line("T2", "C1", "A", 1),
            line("T2", "C1", "B", 1));

        HoldoutSplit split = HoldoutSplit.of(ledger, 1);

        assertEquals(List.of("C1", "C2"), List.copyOf(split.getHoldouts().keySet()));
    }
}
