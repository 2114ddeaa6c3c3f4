package com.eainde.knowledge.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Reads a category catalog from YAML.
 *
 * <pre>
 * categories:
 *   - id: coreCS
 *     dependencies: [algebraicFoundations]
 *     keywords: [algorithm, data structure]
 * </pre>
 */
public class CategoryCatalogLoader {

    private final ObjectMapper yamlMapper;

    public CategoryCatalogLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * @param in          YAML stream, closed by the caller
     * @param description used in error messages
     * @throws CatalogValidationException if the content violates a catalog invariant
     */
    public CategoryPatternCatalog load(InputStream in, String description) {
        CatalogDefinition definition;
        try {
            definition = yamlMapper.readValue(in, CatalogDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read category catalog " + description, e);
        }
        if (definition == null || definition.categories() == null) {
            throw new CatalogValidationException(List.of(description + " declares no 'categories' list"));
        }
        return CategoryPatternCatalog.of(definition.categories().stream()
                .map(CategoryDefinition::toCategory)
                .toList());
    }

    record CatalogDefinition(@JsonProperty("categories") List<CategoryDefinition> categories) {}

    record CategoryDefinition(
            @JsonProperty("id")                  String id,
            @JsonProperty("label")               String label,
            @JsonProperty("keywords")            List<String> keywords,
            @JsonProperty("dependencies")        List<String> dependencies,
            @JsonProperty("progressionRank")     int progressionRank,
            @JsonProperty("externallyValidated") boolean externallyValidated
    ) {
        PatternCategory toCategory() {
            return PatternCategory.builder()
                    .id(id == null ? "" : id.trim())
                    .label(label)
                    .keywords(keywords)
                    .dependencies(dependencies)
                    .progressionRank(progressionRank)
                    .externallyValidated(externallyValidated)
                    .build();
        }
    }
}
