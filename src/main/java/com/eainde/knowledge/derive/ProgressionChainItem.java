package com.eainde.knowledge.derive;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A link between two adjacent progression ranks that both have surviving facts.
 */
public record ProgressionChainItem(
        @JsonProperty("fromRank")     int fromRank,
        @JsonProperty("toRank")       int toRank,
        @JsonProperty("fromConcepts") int fromConcepts,
        @JsonProperty("toConcepts")   int toConcepts,
        @JsonProperty("strength")     int strength,
        @JsonProperty("type")         String type
) {}
