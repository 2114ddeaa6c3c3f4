package com.eainde.knowledge.derive;

import com.eainde.knowledge.model.Fact;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the secondary collections persisted next to the surviving facts.
 *
 * <ul>
 *   <li>patterns: one item per distinct (category, lexeme) among the raw facts</li>
 *   <li>cross references: concepts that survived in more than one document,
 *       best mean fitness first</li>
 *   <li>progression chains: adjacent progression ranks that both have survivors</li>
 * </ul>
 *
 * <p>Structural facts are left out of all three.</p>
 */
public class KnowledgeDeriver {

    /** Ranks up to this one are the mathematical part of the chain, the rest are sciences. */
    static final int LAST_MATHEMATICAL_RANK = 4;

    private final int crossReferenceLimit;

    public KnowledgeDeriver(int crossReferenceLimit) {
        this.crossReferenceLimit = crossReferenceLimit;
    }

    public List<PatternItem> patterns(List<Fact> rawFacts) {
        Map<String, PatternAccumulator> byPattern = new LinkedHashMap<>();
        for (Fact fact : rawFacts) {
            if (Fact.STRUCTURE_CATEGORY.equals(fact.categoryId())) continue;
            byPattern.computeIfAbsent(fact.categoryId() + '\u0000' + fact.object(),
                    k -> new PatternAccumulator(fact.object(), fact.categoryId())).add(fact);
        }
        return byPattern.values().stream().map(PatternAccumulator::toItem).toList();
    }

    public List<CrossReferenceItem> crossReferences(List<Fact> survivors) {
        Map<String, List<Fact>> byConcept = new LinkedHashMap<>();
        for (Fact fact : survivors) {
            if (Fact.STRUCTURE_CATEGORY.equals(fact.categoryId())) continue;
            byConcept.computeIfAbsent(fact.object(), k -> new ArrayList<>()).add(fact);
        }

        List<CrossReferenceItem> references = new ArrayList<>();
        byConcept.forEach((concept, facts) -> {
            TreeSet<String> origins = new TreeSet<>();
            TreeSet<String> categories = new TreeSet<>();
            double fitnessSum = 0;
            boolean external = true;
            for (Fact fact : facts) {
                origins.addAll(fact.origins());
                categories.add(fact.categoryId());
                fitnessSum += fact.fitness();
                external &= fact.externallyValidated();
            }
            if (origins.size() > 1) {
                references.add(new CrossReferenceItem(concept, origins, List.copyOf(categories),
                        facts.size(), fitnessSum / facts.size(), external));
            }
        });

        return references.stream()
                .sorted(Comparator.comparingDouble(CrossReferenceItem::fitness).reversed()
                        .thenComparing(CrossReferenceItem::concept))
                .limit(crossReferenceLimit)
                .toList();
    }

    public List<ProgressionChainItem> progressionChains(List<Fact> survivors) {
        TreeMap<Integer, Integer> countsByRank = new TreeMap<>();
        for (Fact fact : survivors) {
            if (fact.progressionRank() > 0) {
                countsByRank.merge(fact.progressionRank(), 1, Integer::sum);
            }
        }

        List<ProgressionChainItem> chains = new ArrayList<>();
        countsByRank.forEach((rank, count) -> {
            Integer next = countsByRank.get(rank + 1);
            if (next != null) {
                chains.add(new ProgressionChainItem(rank, rank + 1, count, next,
                        Math.min(count, next), rank <= LAST_MATHEMATICAL_RANK ? "mathematical" : "scientific"));
            }
        });
        return chains;
    }

    private static final class PatternAccumulator {
        private final String pattern;
        private final String categoryId;
        private final TreeSet<String> origins = new TreeSet<>();
        private boolean validated;
        private int occurrences;
        private double confidence;
        private Instant timestamp;

        private PatternAccumulator(String pattern, String categoryId) {
            this.pattern = pattern;
            this.categoryId = categoryId;
        }

        void add(Fact fact) {
            occurrences++;
            validated |= fact.validated();
            confidence = Math.max(confidence, fact.confidence());
            origins.addAll(fact.origins());
            if (fact.timestamp() != null && (timestamp == null || fact.timestamp().isAfter(timestamp))) {
                timestamp = fact.timestamp();
            }
        }

        PatternItem toItem() {
            return new PatternItem(pattern, categoryId, validated, occurrences, confidence, origins, timestamp);
        }
    }
}
