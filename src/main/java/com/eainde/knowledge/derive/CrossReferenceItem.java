package com.eainde.knowledge.derive;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.SortedSet;

/**
 * A concept that survived filtering in more than one document.
 *
 * @param concept             the shared fact object
 * @param origins             documents the concept was seen in
 * @param categories          categories it was matched under, sorted
 * @param strength            number of surviving facts carrying the concept
 * @param fitness             mean fitness of those facts
 * @param externallyValidated every contributing fact belongs to an externally-validated category
 */
public record CrossReferenceItem(
        @JsonProperty("concept")             String concept,
        @JsonProperty("origins")             SortedSet<String> origins,
        @JsonProperty("categories")          List<String> categories,
        @JsonProperty("strength")            int strength,
        @JsonProperty("fitness")             double fitness,
        @JsonProperty("externallyValidated") boolean externallyValidated
) {}
