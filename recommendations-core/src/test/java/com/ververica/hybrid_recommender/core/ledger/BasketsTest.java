package com.ververica.hybrid_recommender.core.ledger;

import com.ververica.hybrid_recommender.core.shared.model.Basket;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ververica.hybrid_recommender.core.LedgerFixtures.line;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class BasketsTest {

    @Test
    public void groupsLinesByTransaction() {
        List<Basket> baskets = Baskets.group(List.of(
            line("T2", "C2", "B", 1),
            line("T1", "C1", "A", 1),
            line("T1", "C1", "B", 1)));

        assertEquals(2, baskets.size());
        assertEquals("T1", baskets.get(0).getTransactionId());
        assertEquals(List.of("A", "B"), List.copyOf(baskets.get(0).getProductIds()));
        assertEquals("T2", baskets.get(1).getTransactionId());
    }

    @Test
    public void mergesDuplicateProductLines() {
        List<Basket> baskets = Baskets.group(List.of(
            line("T1", "C1", "A", 2, 2_000L),
            line("T1", "C1", "A", 3, 1_000L)));

        Basket basket = baskets.get(0);
        assertEquals(1, basket.size());
        assertEquals(5, (int) basket.getQuantities().get("A"));
    }
}
