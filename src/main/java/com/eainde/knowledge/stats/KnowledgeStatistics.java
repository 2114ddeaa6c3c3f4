package com.eainde.knowledge.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over the final fact population.
 *
 * @param factCount               facts aggregated
 * @param categories              per-category statistics, in first-appearance order
 * @param formats                 per-format statistics, in first-appearance order
 * @param rankedCategories        category statistics by descending average fitness, ties in first-appearance order
 * @param overallCoherence        mean fitness x coherence scale
 * @param validationRatio         share of oracle-validated facts
 * @param externalValidationRatio share of facts from externally-validated categories
 */
public record KnowledgeStatistics(
        @JsonProperty("factCount")               int factCount,
        @JsonProperty("categories")              Map<String, GroupStatistics> categories,
        @JsonProperty("formats")                 Map<String, GroupStatistics> formats,
        @JsonProperty("rankedCategories")        List<GroupStatistics> rankedCategories,
        @JsonProperty("overallCoherence")        double overallCoherence,
        @JsonProperty("validationRatio")         double validationRatio,
        @JsonProperty("externalValidationRatio") double externalValidationRatio
) {}
