package com.eainde.knowledge.graph;

import com.eainde.knowledge.model.Fact;

import java.util.Objects;

/**
 * The neighbour relation between two facts. Symmetric: every clause is checked
 * in both directions.
 *
 * <p>a and b are neighbours if any holds:</p>
 * <ol>
 *   <li>they share a term: subject or object of one equals subject or object of the other</li>
 *   <li>both are oracle-validated and belong to the same category</li>
 *   <li>either one's category appears in the other's dependency list</li>
 *   <li>same format tag, disjoint origins</li>
 *   <li>same category, disjoint origins</li>
 * </ol>
 */
public final class NeighborRule {

    private NeighborRule() {
    }

    public static boolean areNeighbors(Fact a, Fact b) {
        if (linkedRegardlessOfOrigin(a, b)) return true;
        return linkedWhenOriginsDisjoint(a, b) && !a.sharesOriginWith(b);
    }

    /** Clauses 1-3: they never look at origins. */
    static boolean linkedRegardlessOfOrigin(Fact a, Fact b) {
        if (sharesTerm(a, b)) return true;
        if (a.validated() && b.validated() && Objects.equals(a.categoryId(), b.categoryId())) return true;
        return a.dependencies().contains(b.categoryId()) || b.dependencies().contains(a.categoryId());
    }

    /** Clauses 4-5 without their origin condition. */
    static boolean linkedWhenOriginsDisjoint(Fact a, Fact b) {
        return Objects.equals(a.format(), b.format()) || Objects.equals(a.categoryId(), b.categoryId());
    }

    static boolean sharesTerm(Fact a, Fact b) {
        return Objects.equals(a.subject(), b.subject())
                || Objects.equals(a.object(), b.object())
                || Objects.equals(a.subject(), b.object())
                || Objects.equals(a.object(), b.subject());
    }
}
