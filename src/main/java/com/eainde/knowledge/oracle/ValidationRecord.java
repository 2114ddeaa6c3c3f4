package com.eainde.knowledge.oracle;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Corroborating concepts for one category.
 *
 * @param categoryId category the concepts corroborate
 * @param concepts   lower-cased corroborated concepts
 * @param relevance  weight of the corroboration, 0 when nothing is known
 */
public record ValidationRecord(
        @JsonProperty("categoryId") String categoryId,
        @JsonProperty("concepts")   Set<String> concepts,
        @JsonProperty("relevance")  double relevance
) {

    public ValidationRecord {
        Set<String> normalized = new LinkedHashSet<>();
        if (concepts != null) {
            concepts.stream()
                    .filter(c -> c != null && !c.isBlank())
                    .map(c -> c.trim().toLowerCase(Locale.ROOT))
                    .forEach(normalized::add);
        }
        concepts = Set.copyOf(normalized);
    }

    public static ValidationRecord empty(String categoryId) {
        return new ValidationRecord(categoryId, Set.of(), 0.0);
    }

    public static ValidationRecord of(String categoryId, List<String> concepts, double relevance) {
        return new ValidationRecord(categoryId, new LinkedHashSet<>(concepts), relevance);
    }

    public boolean isEmpty() {
        return concepts.isEmpty();
    }

    /**
     * A lexeme is corroborated when some concept contains it or it contains some
     * concept, case-insensitively.
     */
    public boolean corroborates(String lexeme) {
        if (lexeme == null || lexeme.isBlank()) return false;
        String needle = lexeme.trim().toLowerCase(Locale.ROOT);
        for (String concept : concepts) {
            if (concept.contains(needle) || needle.contains(concept)) {
                return true;
            }
        }
        return false;
    }

    /** Union of concepts, max of relevance. */
    public ValidationRecord combine(ValidationRecord other) {
        Set<String> union = new LinkedHashSet<>(concepts);
        union.addAll(other.concepts());
        return new ValidationRecord(categoryId, union, Math.max(relevance, other.relevance()));
    }
}
