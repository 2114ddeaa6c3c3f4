package com.eainde.knowledge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * A (subject, predicate, object) triple with its scoring metadata.
 *
 * <p>Instances are immutable; scoring and filtering return copies.</p>
 *
 * @param subject             category label or structure label
 * @param predicate           implements, implements_validated, contains, ...
 * @param object              normalised lexeme or structure key
 * @param confidence          extraction confidence
 * @param categoryId          owning category, {@value #STRUCTURE_CATEGORY} for structural facts
 * @param origins             sorted document references the fact was seen in
 * @param format              format tag of the originating document
 * @param progressionRank     rank of the category in its refinement chain, 0 if none
 * @param dependencies        dependency ids of the category
 * @param validated           corroborated by the validation oracle
 * @param externallyValidated the category is flagged as externally validated
 * @param fitness             fitness after filtering, 0 before scoring
 * @param neighborCount       neighbour count at the last filtering generation
 * @param generation          number of filtering generations survived
 * @param timestamp           modification time of the originating document
 */
public record Fact(
        @JsonProperty("subject")             String subject,
        @JsonProperty("predicate")           String predicate,
        @JsonProperty("object")              String object,
        @JsonProperty("confidence")          double confidence,
        @JsonProperty("categoryId")          String categoryId,
        @JsonProperty("origins")             SortedSet<String> origins,
        @JsonProperty("format")              String format,
        @JsonProperty("progressionRank")     int progressionRank,
        @JsonProperty("dependencies")        List<String> dependencies,
        @JsonProperty("validated")           boolean validated,
        @JsonProperty("externallyValidated") boolean externallyValidated,
        @JsonProperty("fitness")             double fitness,
        @JsonProperty("neighborCount")       int neighborCount,
        @JsonProperty("generation")          int generation,
        @JsonProperty("timestamp")           Instant timestamp
) {

    public static final String STRUCTURE_CATEGORY = "structure";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public Fact {
        origins = origins == null ? new TreeSet<>() : new TreeSet<>(origins);
        dependencies = dependencies == null ? List.of() : List.copyOf(dependencies);
    }

    /** Trim, collapse internal whitespace, lower-case. */
    public static String normalizeTerm(String term) {
        if (term == null) return "";
        return WHITESPACE.matcher(term.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    /** Normalised "subject|predicate|object", the material a fact's identity hash is computed from. */
    public static String identityKey(String subject, String predicate, String object) {
        return normalizeTerm(subject) + "|" + normalizeTerm(predicate) + "|" + normalizeTerm(object);
    }

    @JsonIgnore
    public String identityKey() {
        return identityKey(subject, predicate, object);
    }

    /** First origin, used where a fact is known to come from a single document. */
    @JsonIgnore
    public String primaryOrigin() {
        return origins.isEmpty() ? "" : origins.first();
    }

    public boolean sharesOriginWith(Fact other) {
        for (String origin : origins) {
            if (other.origins.contains(origin)) return true;
        }
        return false;
    }


    public Fact withScore(double newFitness, int newNeighborCount, int newGeneration) {
        return new Fact(subject, predicate, object, confidence, categoryId, origins, format,
                progressionRank, dependencies, validated, externallyValidated,
                newFitness, newNeighborCount, newGeneration, timestamp);
    }
}
