package com.eainde.knowledge.fitness;

import com.eainde.knowledge.exception.InvariantViolationException;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Neighbour-count selection rule and survival bounds.
 *
 * @param isolatedBelow      k below this is isolated
 * @param crowdedAbove       k above this is overcrowded
 * @param isolatedMultiplier applied when isolated
 * @param healthyMultiplier  applied when {@code isolatedBelow <= k <= crowdedAbove}
 * @param crowdedMultiplier  applied when overcrowded
 * @param survivalThreshold  a fact survives iff its final fitness is strictly above this
 * @param minFitness         lower clip bound, never negative
 * @param maxFitness         upper clip bound
 */
public record SelectionRule(
        @JsonProperty("isolatedBelow")      int isolatedBelow,
        @JsonProperty("crowdedAbove")       int crowdedAbove,
        @JsonProperty("isolatedMultiplier") double isolatedMultiplier,
        @JsonProperty("healthyMultiplier")  double healthyMultiplier,
        @JsonProperty("crowdedMultiplier")  double crowdedMultiplier,
        @JsonProperty("survivalThreshold")  double survivalThreshold,
        @JsonProperty("minFitness")         double minFitness,
        @JsonProperty("maxFitness")         double maxFitness
) {

    public SelectionRule {
        if (isolatedBelow > crowdedAbove + 1) {
            throw new InvariantViolationException("isolatedBelow (" + isolatedBelow
                    + ") must not exceed crowdedAbove + 1 (" + (crowdedAbove + 1) + ")");
        }
        if (minFitness < 0 || maxFitness < minFitness) {
            throw new InvariantViolationException("fitness bounds must satisfy 0 <= min (" + minFitness
                    + ") <= max (" + maxFitness + ")");
        }
        if (isolatedMultiplier < 0 || healthyMultiplier < 0 || crowdedMultiplier < 0) {
            throw new InvariantViolationException("selection multipliers must be non-negative");
        }
    }

    public static SelectionRule defaults() {
        return new SelectionRule(2, 5, 0.7, 1.4, 0.8, 0.25, 0.0, 1.5);
    }

    public double multiplierFor(int neighborCount) {
        if (neighborCount < isolatedBelow) return isolatedMultiplier;
        if (neighborCount <= crowdedAbove) return healthyMultiplier;
        return crowdedMultiplier;
    }

    public double clip(double fitness) {
        return Math.max(minFitness, Math.min(maxFitness, fitness));
    }

    public boolean survives(double fitness) {
        return fitness > survivalThreshold;
    }

    public SelectionRule withSurvivalThreshold(double threshold) {
        return new SelectionRule(isolatedBelow, crowdedAbove, isolatedMultiplier, healthyMultiplier,
                crowdedMultiplier, threshold, minFitness, maxFitness);
    }

    public SelectionRule withMultipliers(double isolated, double healthy, double crowded) {
        return new SelectionRule(isolatedBelow, crowdedAbove, isolated, healthy, crowded,
                survivalThreshold, minFitness, maxFitness);
    }
}
