package com.eainde.knowledge.fitness;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Declarative fitness multipliers, loaded from {@code scoring-table.yml}.
 *
 * @param defaultCategoryMultiplier     used for categories missing from {@code categoryMultipliers}
 * @param categoryMultipliers           category id to priority multiplier
 * @param validatedMultiplier           applied to oracle-corroborated facts
 * @param externallyValidatedMultiplier applied to facts of externally-validated categories
 * @param defaultFormatMultiplier       used for formats missing from {@code formatMultipliers}
 * @param formatMultipliers             format tag to multiplier
 * @param selection                     neighbour-count rule and bounds
 */
public record ScoringTable(
        @JsonProperty("defaultCategoryMultiplier")     double defaultCategoryMultiplier,
        @JsonProperty("categoryMultipliers")           Map<String, Double> categoryMultipliers,
        @JsonProperty("validatedMultiplier")           double validatedMultiplier,
        @JsonProperty("externallyValidatedMultiplier") double externallyValidatedMultiplier,
        @JsonProperty("defaultFormatMultiplier")       double defaultFormatMultiplier,
        @JsonProperty("formatMultipliers")             Map<String, Double> formatMultipliers,
        @JsonProperty("selection")                     SelectionRule selection
) {

    public ScoringTable {
        categoryMultipliers = categoryMultipliers == null ? Map.of() : Map.copyOf(categoryMultipliers);
        formatMultipliers = formatMultipliers == null ? Map.of() : Map.copyOf(formatMultipliers);
        selection = selection == null ? SelectionRule.defaults() : selection;
    }

    /** Table with every multiplier at 1.0 and the default selection rule. */
    public static ScoringTable neutral() {
        return new ScoringTable(1.0, Map.of(), 1.0, 1.0, 1.0, Map.of(), SelectionRule.defaults());
    }

    public double categoryMultiplier(String categoryId) {
        return categoryMultipliers.getOrDefault(categoryId, defaultCategoryMultiplier);
    }

    public double formatMultiplier(String format) {
        return formatMultipliers.getOrDefault(format, defaultFormatMultiplier);
    }

    public ScoringTable withSelection(SelectionRule rule) {
        return new ScoringTable(defaultCategoryMultiplier, categoryMultipliers, validatedMultiplier,
                externallyValidatedMultiplier, defaultFormatMultiplier, formatMultipliers, rule);
    }
}
