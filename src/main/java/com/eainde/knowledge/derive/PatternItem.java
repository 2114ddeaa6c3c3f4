package com.eainde.knowledge.derive;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.SortedSet;

/**
 * A distinct (category, lexeme) pair with how often it matched.
 */
public record PatternItem(
        @JsonProperty("pattern")     String pattern,
        @JsonProperty("categoryId")  String categoryId,
        @JsonProperty("validated")   boolean validated,
        @JsonProperty("occurrences") int occurrences,
        @JsonProperty("confidence")  double confidence,
        @JsonProperty("origins")     SortedSet<String> origins,
        @JsonProperty("timestamp")   Instant timestamp
) {}
