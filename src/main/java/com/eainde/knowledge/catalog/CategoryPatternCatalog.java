package com.eainde.knowledge.catalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable registry of {@link PatternCategory} instances, in declaration order.
 *
 * <p>Construction validates the whole catalog and fails with a
 * {@link CatalogValidationException} listing every violation found:</p>
 * <ul>
 *   <li>blank or duplicate ids</li>
 *   <li>categories without keywords</li>
 *   <li>self-dependencies and dependencies on ids that do not exist</li>
 *   <li>negative progression ranks</li>
 * </ul>
 */
public final class CategoryPatternCatalog {

    private static final Logger log = LoggerFactory.getLogger(CategoryPatternCatalog.class);

    private final Map<String, PatternCategory> categories;

    private CategoryPatternCatalog(Map<String, PatternCategory> categories) {
        this.categories = Collections.unmodifiableMap(categories);
    }

    public static CategoryPatternCatalog of(Collection<PatternCategory> categories) {
        List<String> violations = new ArrayList<>();
        Map<String, PatternCategory> byId = new LinkedHashMap<>();

        for (PatternCategory category : categories) {
            String id = category.getId();
            if (id.isBlank()) {
                violations.add("category with blank id");
                continue;
            }
            if (byId.putIfAbsent(id, category) != null) {
                violations.add("duplicate category id '" + id + "'");
            }
            if (category.getKeywords().isEmpty()) {
                violations.add("category '" + id + "' declares no keywords");
            } else if (category.getKeywords().stream().anyMatch(CategoryPatternCatalog::isBlank)) {
                violations.add("category '" + id + "' has a null or blank keyword");
            }
            if (category.getDependencies().stream().anyMatch(CategoryPatternCatalog::isBlank)) {
                violations.add("category '" + id + "' has a null or blank dependency");
            }
            if (category.getProgressionRank() < 0) {
                violations.add("category '" + id + "' has negative progression rank");
            }
        }

        Set<String> known = new HashSet<>(byId.keySet());
        for (PatternCategory category : byId.values()) {
            for (String dependency : category.getDependencies()) {
                if (isBlank(dependency)) continue;
                if (dependency.equals(category.getId())) {
                    violations.add("category '" + category.getId() + "' depends on itself");
                } else if (!known.contains(dependency)) {
                    violations.add("category '" + category.getId()
                            + "' depends on unknown category '" + dependency + "'");
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new CatalogValidationException(violations);
        }
        log.info("Category catalog loaded: {} categories", byId.size());
        return new CategoryPatternCatalog(byId);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public Collection<PatternCategory> categories() {
        return categories.values();
    }

    public Optional<PatternCategory> find(String id) {
        return Optional.ofNullable(categories.get(id));
    }

    public PatternCategory get(String id) {
        PatternCategory category = categories.get(id);
        if (category == null) {
            throw new IllegalArgumentException("Unknown category id: " + id);
        }
        return category;
    }

    public boolean contains(String id) {
        return categories.containsKey(id);
    }

    public int size() {
        return categories.size();
    }

    public int maxProgressionRank() {
        return categories.values().stream()
                .mapToInt(PatternCategory::getProgressionRank)
                .max()
                .orElse(0);
    }
}
