package com.eainde.knowledge.catalog;

import lombok.Builder;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * One named pattern-matching rule set.
 *
 * <p>The matcher is compiled once from the keyword list: a case-insensitive,
 * word-bounded alternation (longest keyword first) with an optional trailing
 * "s". A space inside a keyword matches a single whitespace, "_", "-", "." or
 * "/" character, so "data structure" also matches "data_structure".</p>
 */
@Getter
public final class PatternCategory {

    private static final String KEYWORD_SEPARATOR = "[\\s_./-]";

    private final String id;
    private final String label;
    private final List<String> keywords;
    private final List<String> dependencies;
    /** Position in the refinement chain, 0 when the category is not part of one. */
    private final int progressionRank;
    private final boolean externallyValidated;
    private final Pattern matcher;

    @Builder
    private PatternCategory(String id,
                            String label,
                            List<String> keywords,
                            List<String> dependencies,
                            int progressionRank,
                            boolean externallyValidated) {
        this.id = Objects.requireNonNull(id, "id");
        this.label = label == null || label.isBlank() ? defaultLabel(id) : label;
        // null and blank entries are kept so catalog validation can report them
        this.keywords = keywords == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(keywords));
        this.dependencies = dependencies == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(dependencies));
        this.progressionRank = progressionRank;
        this.externallyValidated = externallyValidated;
        this.matcher = compileMatcher(this.keywords);
    }

    public Matcher matcher(CharSequence content) {
        if (matcher == null) {
            throw new IllegalStateException("Category " + id + " has no usable keywords");
        }
        return matcher.matcher(content);
    }

    public boolean dependsOn(String categoryId) {
        return dependencies.contains(categoryId);
    }

    /** "coreCS" becomes "CoreCS System". */
    static String defaultLabel(String id) {
        if (id.isEmpty()) return " System";
        return Character.toUpperCase(id.charAt(0)) + id.substring(1) + " System";
    }

    /** Null when no keyword is usable; an empty alternation would match at every word boundary. */
    static Pattern compileMatcher(List<String> keywords) {
        List<String> usable = keywords.stream()
                .filter(Objects::nonNull)
                .map(k -> k.trim().toLowerCase(Locale.ROOT))
                .filter(k -> !k.isEmpty())
                .distinct()
                .toList();
        if (usable.isEmpty()) return null;
        String alternation = usable.stream()
                .sorted(Comparator.comparingInt(String::length).reversed()
                        .thenComparing(Comparator.naturalOrder()))
                .map(PatternCategory::keywordRegex)
                .collect(Collectors.joining("|"));
        return Pattern.compile("\\b(?:" + alternation + ")s?\\b",
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
    }

    private static String keywordRegex(String keyword) {
        return Arrays.stream(keyword.split("\\s+"))
                .map(Pattern::quote)
                .collect(Collectors.joining(KEYWORD_SEPARATOR));
    }

    @Override
    public String toString() {
        return "PatternCategory{" + id + ", rank=" + progressionRank + ", deps=" + dependencies + "}";
    }
}
