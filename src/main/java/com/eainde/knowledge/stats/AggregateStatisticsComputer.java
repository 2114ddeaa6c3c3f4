package com.eainde.knowledge.stats;

import com.eainde.knowledge.model.Fact;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Read-only aggregation over surviving, deduplicated facts.
 */
public class AggregateStatisticsComputer {

    private final double coherenceScale;

    public AggregateStatisticsComputer(double coherenceScale) {
        this.coherenceScale = coherenceScale;
    }

    public KnowledgeStatistics compute(List<Fact> facts) {
        Map<String, GroupStatistics> categories = group(facts, Fact::categoryId);
        Map<String, GroupStatistics> formats = group(facts, Fact::format);

        // List.sort is stable, so equal averages keep first-appearance order
        List<GroupStatistics> ranked = new ArrayList<>(categories.values());
        ranked.sort(Comparator.comparingDouble(GroupStatistics::averageFitness).reversed());

        int n = facts.size();
        double meanFitness = n == 0 ? 0.0 : facts.stream().mapToDouble(Fact::fitness).sum() / n;
        long validated = facts.stream().filter(Fact::validated).count();
        long external = facts.stream().filter(Fact::externallyValidated).count();

        return new KnowledgeStatistics(
                n,
                categories,
                formats,
                Collections.unmodifiableList(ranked),
                meanFitness * coherenceScale,
                ratio(validated, n),
                ratio(external, n));
    }

    private static Map<String, GroupStatistics> group(List<Fact> facts, Function<Fact, String> key) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        for (Fact fact : facts) {
            String k = key.apply(fact) == null ? "unknown" : key.apply(fact);
            // [count, fitness sum, validated count]
            double[] acc = sums.computeIfAbsent(k, x -> new double[3]);
            acc[0]++;
            acc[1] += fact.fitness();
            if (fact.validated()) acc[2]++;
        }
        Map<String, GroupStatistics> out = new LinkedHashMap<>();
        sums.forEach((k, acc) -> out.put(k,
                new GroupStatistics(k, (int) acc[0], acc[1] / acc[0], (int) acc[2])));
        return Collections.unmodifiableMap(out);
    }

    private static double ratio(long part, int total) {
        return total == 0 ? 0.0 : (double) part / total;
    }
}
