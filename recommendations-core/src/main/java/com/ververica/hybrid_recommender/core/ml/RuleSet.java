package com.ververica.hybrid_recommender.core.ml;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable output of one mining pass.
 *
 * Rules are indexed by antecedent for O(1) lookup during basket scoring.
 */
public final class RuleSet {

    private final List<AssociationRule> rules;
    private final Map<String, List<AssociationRule>> byAntecedent;
    private final Map<String, Double> frequentItemSupport;
    private final int totalBaskets;

    RuleSet(List<AssociationRule> rules, Map<String, Double> frequentItemSupport, int totalBaskets) {
        List<AssociationRule> sorted = new ArrayList<>(rules);
        sorted.sort(AssociationRule.BY_PRODUCTS);
        this.rules = Collections.unmodifiableList(sorted);

        Map<String, List<AssociationRule>> index = new HashMap<>();
        for (AssociationRule rule : sorted) {
            index.computeIfAbsent(rule.getAntecedent(), k -> new ArrayList<>()).add(rule);
        }
        index.replaceAll((k, v) -> Collections.unmodifiableList(v));
        this.byAntecedent = Collections.unmodifiableMap(index);

        this.frequentItemSupport = Collections.unmodifiableMap(new HashMap<>(frequentItemSupport));
        this.totalBaskets = totalBaskets;
    }

    /** All retained rules, ordered by antecedent then consequent. */
    public List<AssociationRule> getRules() {
        return rules;
    }

    public List<AssociationRule> rulesFrom(String antecedent) {
        List<AssociationRule> matches = byAntecedent.get(antecedent);
        return matches != null ? matches : Collections.emptyList();
    }

    /** Support of every item that passed min_support. */
    public Map<String, Double> getFrequentItemSupport() {
        return frequentItemSupport;
    }

    public int getTotalBaskets() {
        return totalBaskets;
    }

    public int size() {
        return rules.size();
    }
}
