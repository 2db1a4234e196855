package com.ververica.hybrid_recommender.flink.recommendations;

import com.ververica.hybrid_recommender.core.shared.model.Transaction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Generates a synthetic transaction ledger for demos and local runs.
 *
 * PATTERN CATEGORIES:
 * - Electronics: laptop → mouse, keyboard, monitor, headset
 * - Home & Kitchen: coffee_maker → coffee_beans, filters
 * - Fashion: shirt → pants, shoes, belt
 * - Sports: yoga_mat → yoga_blocks, water_bottle
 *
 * Every basket starts from an anchor product; each companion of the anchor is
 * added with its template probability, so mined confidences land near those
 * probabilities. Customers stick to a preferred category most of the time,
 * which gives the item-similarity model shared purchase histories to work with.
 *
 * TEMPORAL DISTRIBUTION:
 * - Transactions spread over the DAYS_HISTORY days after startMillis
 * - Each customer's transactions are in increasing time order
 *
 * All randomness comes from the Random passed in: the same seed and start time
 * always give the same ledger.
 */
public class SyntheticLedgerGenerator {

    static final int DAYS_HISTORY = 90;

    private static final int MAX_TRANSACTIONS_PER_CUSTOMER = 4;
    private static final double PREFERRED_CATEGORY_SHARE = 0.8;
    private static final double NOISE_ITEM_PROBABILITY = 0.15;

    private static final Map<String, List<BasketTemplate>> TEMPLATES = createTemplates();

    private final Random random;
    private final long startMillis;

    public SyntheticLedgerGenerator(Random random, long startMillis) {
        this.random = random;
        this.startMillis = startMillis;
    }

    /**
     * @param customers number of distinct customers, each with 1 to 4 transactions
     * @return ledger lines ordered by timestamp, then transaction id
     */
    public List<Transaction> generate(int customers) {
        List<Transaction> ledger = new ArrayList<>();
        long historyMillis = TimeUnit.DAYS.toMillis(DAYS_HISTORY);
        int transactionSeq = 0;

        for (int c = 1; c <= customers; c++) {
            String customerId = String.format("cust_%04d", c);
            String preferredCategory = selectRandomCategory();
            int transactions = 1 + random.nextInt(MAX_TRANSACTIONS_PER_CUSTOMER);

            // increasing offsets within the history window
            long[] offsets = new long[transactions];
            for (int t = 0; t < transactions; t++) {
                offsets[t] = (long) (random.nextDouble() * historyMillis);
            }
            Arrays.sort(offsets);

            for (int t = 0; t < transactions; t++) {
                String transactionId = String.format("txn_%06d", ++transactionSeq);
                String category = random.nextDouble() < PREFERRED_CATEGORY_SHARE
                    ? preferredCategory
                    : selectRandomCategory();

                for (String productId : generateBasket(category)) {
                    int quantity = random.nextDouble() < 0.85 ? 1 : 2 + random.nextInt(2);
                    ledger.add(new Transaction(transactionId, customerId, productId, quantity, startMillis + offsets[t]));
                }
            }
        }

        ledger.sort(Comparator.comparingLong(Transaction::getTimestamp)
            .thenComparing(Transaction::getTransactionId)
            .thenComparing(Transaction::getProductId));
        return ledger;
    }

    private Set<String> generateBasket(String category) {
        List<BasketTemplate> templates = TEMPLATES.get(category);
        BasketTemplate template = templates.get(random.nextInt(templates.size()));

        Set<String> basket = new LinkedHashSet<>();
        basket.add(template.anchor);
        for (Map.Entry<String, Double> companion : template.companions.entrySet()) {
            if (random.nextDouble() < companion.getValue()) {
                basket.add(companion.getKey());
            }
        }

        if (random.nextDouble() < NOISE_ITEM_PROBABILITY) {
            List<BasketTemplate> other = TEMPLATES.get(selectRandomCategory());
            basket.add(other.get(random.nextInt(other.size())).anchor);
        }
        return basket;
    }

    /**
     * Select random category with weighted distribution.
     */
    private String selectRandomCategory() {
        // Weight: electronics (40%), fashion (25%), home_kitchen (20%), sports (15%)
        double rand = random.nextDouble();
        if (rand < 0.40) return "electronics";
        if (rand < 0.65) return "fashion";
        if (rand < 0.85) return "home_kitchen";
        return "sports";
    }

    private static Map<String, List<BasketTemplate>> createTemplates() {
        Map<String, List<BasketTemplate>> templates = new LinkedHashMap<>();

        templates.put("electronics", Arrays.asList(
            new BasketTemplate("prod_laptop_001")
                .with("prod_mouse_001", 0.75)
                .with("prod_keyboard_001", 0.68)
                .with("prod_monitor_001", 0.45)
                .with("prod_headset_001", 0.52),
            new BasketTemplate("prod_phone_001")
                .with("prod_charger_001", 0.85)
                .with("prod_case_001", 0.78),
            new BasketTemplate("prod_camera_001")
                .with("prod_sd_card_001", 0.88)
                .with("prod_tripod_001", 0.62),
            new BasketTemplate("prod_tablet_001")
                .with("prod_stylus_001", 0.71)));

        templates.put("home_kitchen", Arrays.asList(
            new BasketTemplate("prod_coffee_maker_001")
                .with("prod_coffee_beans_001", 0.89)
                .with("prod_filters_001", 0.81),
            new BasketTemplate("prod_pan_001")
                .with("prod_spatula_001", 0.74),
            new BasketTemplate("prod_knife_set_001")
                .with("prod_cutting_board_001", 0.79),
            new BasketTemplate("prod_mixer_001")
                .with("prod_mixing_bowl_001", 0.68)));

        templates.put("fashion", Arrays.asList(
            new BasketTemplate("prod_shirt_001")
                .with("prod_pants_001", 0.72)
                .with("prod_belt_001", 0.58),
            new BasketTemplate("prod_dress_001")
                .with("prod_shoes_001", 0.76),
            new BasketTemplate("prod_suit_001")
                .with("prod_tie_001", 0.83),
            new BasketTemplate("prod_sneakers_001")
                .with("prod_socks_001", 0.71)));

        templates.put("sports", Arrays.asList(
            new BasketTemplate("prod_yoga_mat_001")
                .with("prod_yoga_blocks_001", 0.67)
                .with("prod_water_bottle_001", 0.72),
            new BasketTemplate("prod_bicycle_001")
                .with("prod_helmet_001", 0.87)
                .with("prod_bike_lock_001", 0.81),
            new BasketTemplate("prod_tent_001")
                .with("prod_sleeping_bag_001", 0.73),
            new BasketTemplate("prod_tennis_racket_001")
                .with("prod_tennis_balls_001", 0.89)));

        return templates;
    }

    /**
     * Anchor product and the companions bought with it, with their probabilities.
     */
    private static class BasketTemplate {
        final String anchor;
        final Map<String, Double> companions = new LinkedHashMap<>();

        BasketTemplate(String anchor) {
            this.anchor = anchor;
        }

        BasketTemplate with(String productId, double probability) {
            companions.put(productId, probability);
            return this;
        }
    }
}
