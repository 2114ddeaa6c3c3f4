package com.eainde.knowledge.fitness;

import com.eainde.knowledge.model.Fact;

/**
 * Neighbour-independent part of a fact's fitness.
 *
 * <pre>
 * base = clip(confidence x category x validated x externallyValidated x format)
 * </pre>
 *
 * <p>Depends only on the fact's category, validation flags and format.</p>
 */
public class FitnessScorer {

    private final ScoringTable table;

    public FitnessScorer(ScoringTable table) {
        this.table = table;
    }

    public double baseFitness(Fact fact) {
        double fitness = fact.confidence();
        fitness *= table.categoryMultiplier(fact.categoryId());
        if (fact.validated()) fitness *= table.validatedMultiplier();
        if (fact.externallyValidated()) fitness *= table.externallyValidatedMultiplier();
        fitness *= table.formatMultiplier(fact.format());
        return table.selection().clip(fitness);
    }

    /** Applies the selection rule for {@code neighborCount} to an already-scored value. */
    public double select(double fitness, int neighborCount) {
        SelectionRule rule = table.selection();
        return rule.clip(fitness * rule.multiplierFor(neighborCount));
    }

    public ScoringTable getTable() {
        return table;
    }
}
