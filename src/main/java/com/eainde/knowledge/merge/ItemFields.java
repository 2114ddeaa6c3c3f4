package com.eainde.knowledge.merge;

import java.util.List;
import java.util.Set;

/**
 * Field names with merge semantics. Every other field is descriptive.
 */
public final class ItemFields {

    public static final String ID = "id";
    public static final String ORIGINS = "origins";
    public static final String TIMESTAMP = "timestamp";

    public static final String SUBJECT = "subject";
    public static final String PREDICATE = "predicate";
    public static final String OBJECT = "object";
    public static final String PATTERN = "pattern";
    public static final String CONCEPT = "concept";

    public static final String CONFIDENCE = "confidence";
    public static final String FITNESS = "fitness";
    public static final String RELEVANCE = "relevance";

    /** Monotonic quality fields: merging keeps the maximum. */
    public static final List<String> QUALITY = List.of(CONFIDENCE, FITNESS, RELEVANCE, "revolutionaryValue");

    /** Fields excluded from the descriptive payload and from canonical-content hashing. */
    public static final Set<String> MERGED = Set.of(
            ID, ORIGINS, TIMESTAMP, CONFIDENCE, FITNESS, RELEVANCE, "revolutionaryValue");

    private ItemFields() {
    }
}
