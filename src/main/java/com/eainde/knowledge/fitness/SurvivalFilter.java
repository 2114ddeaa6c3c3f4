package com.eainde.knowledge.fitness;

import com.eainde.knowledge.graph.ConnectionGraphBuilder;
import com.eainde.knowledge.model.Fact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Discards low-fitness facts using a neighbour-count selection rule.
 *
 * <h3>Generation 1</h3>
 * <pre>
 * k     = neighbour count within the whole raw population
 * final = clip(baseFitness x selection(k))
 * keep iff final &gt; survivalThreshold
 * </pre>
 *
 * <h3>Further generations (optional)</h3>
 * <p>With {@code maxGenerations > 1} the survivors are filtered again: neighbour
 * counts are recomputed among the survivors only and each survivor's current
 * fitness is multiplied by the selection factor for its new count. Iteration
 * stops when a generation removes nothing or the limit is reached. The default
 * of one generation matches the historical behaviour.</p>
 */
public class SurvivalFilter {

    private static final Logger log = LoggerFactory.getLogger(SurvivalFilter.class);

    private final FitnessScorer scorer;
    private final ConnectionGraphBuilder graphBuilder;
    private final int maxGenerations;

    public SurvivalFilter(FitnessScorer scorer, ConnectionGraphBuilder graphBuilder) {
        this(scorer, graphBuilder, 1);
    }

    public SurvivalFilter(FitnessScorer scorer, ConnectionGraphBuilder graphBuilder, int maxGenerations) {
        if (maxGenerations < 1) {
            throw new IllegalArgumentException("maxGenerations must be >= 1, got " + maxGenerations);
        }
        this.scorer = scorer;
        this.graphBuilder = graphBuilder;
        this.maxGenerations = maxGenerations;
    }

    public SurvivalResult apply(List<Fact> population) {
        int evaluated = population.size();

        List<Fact> survivors = firstGeneration(population);
        int generation = 1;
        log.info("Generation 1: {} -> {} facts survived", evaluated, survivors.size());

        while (generation < maxGenerations && !survivors.isEmpty()) {
            List<Fact> next = nextGeneration(survivors, generation + 1);
            generation++;
            log.info("Generation {}: {} -> {} facts survived", generation, survivors.size(), next.size());
            boolean stable = next.size() == survivors.size();
            survivors = next;
            if (stable) break;
        }

        return new SurvivalResult(List.copyOf(survivors), evaluated, evaluated - survivors.size(), generation);
    }

    public int getMaxGenerations() {
        return maxGenerations;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    private List<Fact> firstGeneration(List<Fact> population) {
        int[] neighbors = graphBuilder.countNeighbors(population);
        List<Fact> survivors = new ArrayList<>();
        for (int i = 0; i < population.size(); i++) {
            Fact fact = population.get(i);
            double fitness = scorer.select(scorer.baseFitness(fact), neighbors[i]);
            if (scorer.getTable().selection().survives(fitness)) {
                survivors.add(fact.withScore(fitness, neighbors[i], 1));
            }
        }
        return survivors;
    }

    private List<Fact> nextGeneration(List<Fact> current, int generation) {
        int[] neighbors = graphBuilder.countNeighbors(current);
        List<Fact> survivors = new ArrayList<>();
        for (int i = 0; i < current.size(); i++) {
            Fact fact = current.get(i);
            double fitness = scorer.select(fact.fitness(), neighbors[i]);
            if (scorer.getTable().selection().survives(fitness)) {
                survivors.add(fact.withScore(fitness, neighbors[i], generation));
            }
        }
        return survivors;
    }
}
