package com.ververica.hybrid_recommender.core.shared.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class RecommendationTypeTest {

    @Test
    public void parsesWireNamesLeniently() {
        assertEquals(RecommendationType.ITEM_BASED, RecommendationType.fromWireName("item_based"));
        assertEquals(RecommendationType.MARKET_BASKET, RecommendationType.fromWireName(" Market_Basket "));
        assertEquals(RecommendationType.HYBRID, RecommendationType.fromWireName("HYBRID"));
    }

    @Test
    public void rejectsUnknownModes() {
        assertThrows(IllegalArgumentException.class, () -> RecommendationType.fromWireName("collaborative"));
        assertThrows(IllegalArgumentException.class, () -> RecommendationType.fromWireName(null));
    }

    @Test
    public void serializesAsWireName() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertEquals("\"market_basket\"", mapper.writeValueAsString(RecommendationType.MARKET_BASKET));
        assertEquals(RecommendationType.ITEM_BASED, mapper.readValue("\"item_based\"", RecommendationType.class));
    }

    @Test
    public void reasonsFollowTheMode() {
        assertEquals("similar item purchase pattern", RecommendationType.ITEM_BASED.getReason());
        assertEquals("frequently purchased together", RecommendationType.MARKET_BASKET.getReason());
        assertEquals("hybrid", RecommendationType.HYBRID.getReason());
    }
}
