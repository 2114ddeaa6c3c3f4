package com.eainde.knowledge.catalog;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CategoryPatternCatalogTest {

    private static PatternCategory category(String id, List<String> keywords, String... dependencies) {
        return PatternCategory.builder()
                .id(id)
                .keywords(keywords)
                .dependencies(List.of(dependencies))
                .build();
    }

    private static List<String> matches(PatternCategory category, String text) {
        List<String> out = new ArrayList<>();
        Matcher m = category.matcher(text);
        while (m.find()) out.add(m.group());
        return out;
    }

    // =========================================================================
    //  Validation
    // =========================================================================

    @Nested
    @DisplayName("Load-time validation")
    class Validation {

        @Test
        @DisplayName("should reject a dependency on a category that does not exist")
        void danglingDependency() {
            List<PatternCategory> categories = List.of(
                    category("coreCS", List.of("algorithm"), "algebraicFoundations"));

            assertThatThrownBy(() -> CategoryPatternCatalog.of(categories))
                    .isInstanceOf(CatalogValidationException.class)
                    .hasMessageContaining("coreCS")
                    .hasMessageContaining("algebraicFoundations");
        }

        @Test
        @DisplayName("should report every violation, not only the first")
        void allViolationsReported() {
            List<PatternCategory> categories = List.of(
                    category("a", List.of("x"), "a"),
                    category("a", List.of("y")),
                    category("b", List.of()),
                    category(" ", List.of("z")));

            assertThatThrownBy(() -> CategoryPatternCatalog.of(categories))
                    .isInstanceOfSatisfying(CatalogValidationException.class, e ->
                            assertThat(e.getViolations()).hasSize(4)
                                    .anyMatch(v -> v.contains("duplicate"))
                                    .anyMatch(v -> v.contains("no keywords"))
                                    .anyMatch(v -> v.contains("itself"))
                                    .anyMatch(v -> v.contains("blank")));
        }

        @Test
        @DisplayName("should reject blank and null keywords instead of matching every word boundary")
        void blankKeywords() {
            List<String> withNull = new ArrayList<>();
            withNull.add("algorithm");
            withNull.add(null);
            List<PatternCategory> categories = List.of(
                    category("onlyBlank", List.of(" ")),
                    category("mixed", List.of("matrix", "")),
                    category("withNull", withNull));

            assertThatThrownBy(() -> CategoryPatternCatalog.of(categories))
                    .isInstanceOfSatisfying(CatalogValidationException.class, e ->
                            assertThat(e.getViolations()).hasSize(3)
                                    .allMatch(v -> v.contains("null or blank keyword")));
        }

        @Test
        @DisplayName("should not compile a matcher from blank keywords")
        void noEmptyAlternation() {
            PatternCategory blank = category("onlyBlank", List.of(" ", "\t"));

            assertThatThrownBy(() -> blank.matcher("hello world foo"))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("should reject a null dependency")
        void nullDependency() {
            List<String> dependencies = new ArrayList<>();
            dependencies.add(null);
            PatternCategory bad = PatternCategory.builder().id("x").keywords(List.of("k"))
                    .dependencies(dependencies).build();

            assertThatThrownBy(() -> CategoryPatternCatalog.of(List.of(bad)))
                    .isInstanceOf(CatalogValidationException.class)
                    .hasMessageContaining("null or blank dependency");
        }

        @Test
        @DisplayName("should reject negative progression ranks")
        void negativeRank() {
            PatternCategory bad = PatternCategory.builder().id("x").keywords(List.of("k")).progressionRank(-1).build();

            assertThatThrownBy(() -> CategoryPatternCatalog.of(List.of(bad)))
                    .isInstanceOf(CatalogValidationException.class)
                    .hasMessageContaining("negative progression rank");
        }

        @Test
        @DisplayName("should accept a consistent catalog and keep declaration order")
        void validCatalog() {
            CategoryPatternCatalog catalog = CategoryPatternCatalog.of(List.of(
                    category("algebraicFoundations", List.of("matrix")),
                    category("coreCS", List.of("algorithm"), "algebraicFoundations")));

            assertThat(catalog.size()).isEqualTo(2);
            assertThat(catalog.categories()).extracting(PatternCategory::getId)
                    .containsExactly("algebraicFoundations", "coreCS");
            assertThat(catalog.get("coreCS").dependsOn("algebraicFoundations")).isTrue();
            assertThat(catalog.find("missing")).isEmpty();
            assertThatThrownBy(() -> catalog.get("missing")).isInstanceOf(IllegalArgumentException.class);
        }
    }

    // =========================================================================
    //  Matching
    // =========================================================================

    @Nested
    @DisplayName("Keyword matching")
    class Matching {

        @Test
        @DisplayName("should match case-insensitively on word boundaries")
        void wordBoundaries() {
            PatternCategory c = category("coreCS", List.of("sort"));

            assertThat(matches(c, "Sort the list, then SORT again; resorting is not a match"))
                    .containsExactly("Sort", "SORT");
        }

        @Test
        @DisplayName("should accept a trailing plural s")
        void plural() {
            PatternCategory c = category("coreCS", List.of("algorithm"));

            assertThat(matches(c, "algorithms and one algorithm")).containsExactly("algorithms", "algorithm");
        }

        @Test
        @DisplayName("should match multi-word keywords across separators")
        void separators() {
            PatternCategory c = category("coreCS", List.of("data structure"));

            assertThat(matches(c, "data structure, data_structure, data-structure, data.structure"))
                    .hasSize(4);
        }

        @Test
        @DisplayName("should prefer the longest keyword at a position")
        void longestFirst() {
            PatternCategory c = category("modernCS", List.of("learning", "machine learning"));

            assertThat(matches(c, "machine learning")).containsExactly("machine learning");
        }

        @Test
        @DisplayName("should derive the label from the id")
        void defaultLabel() {
            assertThat(category("coreCS", List.of("x")).getLabel()).isEqualTo("CoreCS System");
            assertThat(PatternCategory.builder().id("physics").label("Physics Domain")
                    .keywords(List.of("x")).build().getLabel()).isEqualTo("Physics Domain");
        }
    }
}
