package com.eainde.knowledge.stats;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param key            category id or format tag
 * @param count          facts in the group
 * @param averageFitness mean fitness of the group
 * @param validatedCount oracle-validated facts in the group
 */
public record GroupStatistics(
        @JsonProperty("key")            String key,
        @JsonProperty("count")          int count,
        @JsonProperty("averageFitness") double averageFitness,
        @JsonProperty("validatedCount") int validatedCount
) {}
