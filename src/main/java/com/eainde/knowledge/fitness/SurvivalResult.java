package com.eainde.knowledge.fitness;

import com.eainde.knowledge.model.Fact;

import java.util.List;

/**
 * @param survivors   facts that passed the filter, in input order, with fitness and neighbour count stamped
 * @param evaluated   facts entering the first generation
 * @param discarded   facts removed across all generations
 * @param generations generations actually run
 */
public record SurvivalResult(List<Fact> survivors, int evaluated, int discarded, int generations) {

    public double survivalRate() {
        return evaluated == 0 ? 0.0 : (double) survivors.size() / evaluated;
    }
}
