package com.eainde.knowledge.merge;

import com.eainde.knowledge.exception.CorruptKnowledgeCollectionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KnowledgeCollectionNormalizerTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final KnowledgeCollectionNormalizer normalizer = new KnowledgeCollectionNormalizer();

    private JsonNode json(String text) throws JsonProcessingException {
        return mapper.readTree(text);
    }

    private static List<String> texts(JsonNode array) {
        List<String> out = new ArrayList<>();
        array.forEach(n -> out.add(n.asText()));
        return out;
    }

    // =========================================================================
    //  Layouts
    // =========================================================================

    @Nested
    @DisplayName("Recognised layouts")
    class Layouts {

        @Test
        @DisplayName("current layout: metadata plus named collections")
        void current() throws JsonProcessingException {
            KnowledgeCollection c = normalizer.normalize(json("""
                    {"metadata": {"sourceId": "run-7", "generatedAt": "2024-05-01T00:00:00Z"},
                     "collections": {"triples": [{"subject": "S", "predicate": "p", "object": "o"}],
                                     "crossReferences": [{"concept": "energy"}]}}
                    """), "file.json");

            assertThat(c.sourceId()).isEqualTo("run-7");
            assertThat(c.generatedAt()).isEqualTo("2024-05-01T00:00:00Z");
            assertThat(c.collections()).containsOnlyKeys("triples", "crossReferences");
            assertThat(c.itemCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("legacy top-level arrays map onto canonical kinds")
        void legacyArrays() throws JsonProcessingException {
            KnowledgeCollection c = normalizer.normalize(json("""
                    {"topTriples": [{"subject": "S", "predicate": "p", "object": "o"}],
                     "enhancedPatterns": [{"pattern": "fractal"}],
                     "mathematicalChains": [{"fromRank": 1, "toRank": 2}],
                     "scienceValidations": [{"concept": "dna"}]}
                    """), "legacy.json");

            assertThat(c.sourceId()).isEqualTo("legacy.json");
            assertThat(c.collections().get("triples")).hasSize(1);
            assertThat(c.collections().get("patterns")).hasSize(1);
            assertThat(c.collections().get("progressionChains")).hasSize(1);
            assertThat(c.collections().get("crossReferences")).hasSize(1);
        }

        @Test
        @DisplayName("nested legacy arrays are read as triples")
        void nestedLegacy() throws JsonProcessingException {
            KnowledgeCollection c = normalizer.normalize(json("""
                    {"extractedKnowledge": {"triples": [{"subject": "A", "predicate": "p", "object": "x"}]},
                     "ultimateIntegration": {"strongestValidations": [{"subject": "B", "predicate": "p", "object": "y"}]}}
                    """), "nested.json");

            assertThat(c.collections().get("triples")).hasSize(2);
        }

        @Test
        @DisplayName("trie layout: triples gathered from every level")
        void trie() throws JsonProcessingException {
            KnowledgeCollection c = normalizer.normalize(json("""
                    {"root": {"children": {
                        "a": {"triples": [{"subject": "A", "predicate": "p", "object": "x"}],
                              "children": {"b": {"triples": [{"subject": "B", "predicate": "p", "object": "y"}],
                                                 "children": {}}}},
                        "c": {"children": {}}}}}
                    """), "trie.json");

            assertThat(c.collections().get("triples"))
                    .extracting(t -> t.get("subject").asText())
                    .containsExactlyInAnyOrder("A", "B");
        }

        @Test
        @DisplayName("manuscript layout: sections become patterns")
        void sections() throws JsonProcessingException {
            String longContent = "z".repeat(800);
            KnowledgeCollection c = normalizer.normalize(json("""
                    {"sections": [{"title": "Introduction", "content": "%s"}, {"content": "untitled"}]}
                    """.formatted(longContent)), "book.json");

            assertThat(c.collections().get("patterns")).singleElement().satisfies(p -> {
                assertThat(p.get("pattern").asText()).isEqualTo("Introduction");
                assertThat(p.get("content").asText()).hasSize(500);
                assertThat(p.get("confidence").doubleValue()).isEqualTo(0.9);
                assertThat(p.get("type").asText()).isEqualTo("manuscript_section");
            });
        }

        @Test
        @DisplayName("non-object entries are ignored")
        void nonObjectEntries() throws JsonProcessingException {
            KnowledgeCollection c = normalizer.normalize(json("""
                    {"triples": [1, "text", {"subject": "S", "predicate": "p", "object": "o"}]}
                    """), "mixed.json");

            assertThat(c.collections().get("triples")).hasSize(1);
        }

        @Test
        @DisplayName("trie layout: levels past the depth bound are ignored")
        void deepTrie() {
            ObjectNode document = mapper.createObjectNode();
            ObjectNode node = document.putObject("root");
            for (int depth = 0; depth < 5000; depth++) {
                node.putArray("triples").addObject()
                        .put("subject", "L" + depth)
                        .put("predicate", "p")
                        .put("object", "o");
                node = node.putObject("children").putObject("next");
            }

            KnowledgeCollection c = normalizer.normalize(document, "deep.json");

            assertThat(c.collections().get("triples"))
                    .hasSize(KnowledgeCollectionNormalizer.MAX_TRIE_DEPTH + 1)
                    .extracting(t -> t.get("subject").asText())
                    .contains("L0", "L64")
                    .doesNotContain("L65");
        }

        @Test
        @DisplayName("harmonic signatures are their own kind")
        void harmonicSignatures() throws JsonProcessingException {
            KnowledgeCollection top = normalizer.normalize(json("""
                    {"harmonicSignatures": [{"type": "overall_system_web_correlation",
                                             "concept": "Universal Life Protocol System",
                                             "coherence": 0.68}]}
                    """), "harmonics.json");
            KnowledgeCollection nested = normalizer.normalize(json("""
                    {"extractedKnowledge": {"harmonicSignatures": [{"type": "sacred_geometry_web_correlation"}]},
                     "harmonicAnalysis": [{"type": "overall_system_web_correlation"}]}
                    """), "report.json");

            assertThat(top.collections()).containsOnlyKeys("harmonicSignatures");
            assertThat(top.collections().get("harmonicSignatures")).singleElement()
                    .satisfies(h -> assertThat(h.get("concept").asText()).isEqualTo("Universal Life Protocol System"));
            assertThat(nested.collections()).containsOnlyKeys("harmonicSignatures");
            assertThat(nested.collections().get("harmonicSignatures")).hasSize(2);
        }
    }

    // =========================================================================
    //  Item canonicalisation
    // =========================================================================

    @Nested
    @DisplayName("Item canonicalisation")
    class Canonicalisation {

        @Test
        @DisplayName("legacy field names are renamed")
        void legacyFields() throws JsonProcessingException {
            ObjectNode item = normalizer.canonicalItem((ObjectNode) json("""
                    {"subject": "S", "predicate": "p", "object": "o", "survivalFitness": "1.2",
                     "csCategory": "coreCS", "fileType": "markdown", "progressionLevel": 3,
                     "webValidated": true, "scientificValidation": false, "connections": 4,
                     "evolutionGeneration": 2, "sourceFile": "x.md"}
                    """), "run");

            assertThat(item.get("fitness").doubleValue()).isEqualTo(1.2);
            assertThat(item.get("categoryId").asText()).isEqualTo("coreCS");
            assertThat(item.get("format").asText()).isEqualTo("markdown");
            assertThat(item.get("progressionRank").asInt()).isEqualTo(3);
            assertThat(item.get("validated").asBoolean()).isTrue();
            assertThat(item.get("externallyValidated").asBoolean()).isFalse();
            assertThat(item.get("neighborCount").asInt()).isEqualTo(4);
            assertThat(item.get("generation").asInt()).isEqualTo(2);
            assertThat(texts(item.get("origins"))).containsExactly("x.md");
            assertThat(item.has("survivalFitness")).isFalse();
            assertThat(item.has("sourceFile")).isFalse();
        }

        @Test
        @DisplayName("all origin fields are merged into one sorted array")
        void origins() throws JsonProcessingException {
            ObjectNode item = normalizer.canonicalItem((ObjectNode) json("""
                    {"origins": ["c.md"], "sourceFiles": ["b.md", "a.md"], "files": "d.md", "id": "abc"}
                    """), "run");

            assertThat(texts(item.get("origins"))).containsExactly("a.md", "b.md", "c.md", "d.md");
            assertThat(item.has("id")).isFalse();
        }

        @Test
        @DisplayName("items without origins fall back to the source id")
        void fallbackOrigin() throws JsonProcessingException {
            ObjectNode item = normalizer.canonicalItem((ObjectNode) json("{\"pattern\": \"phi\"}"), "run-3");

            assertThat(texts(item.get("origins"))).containsExactly("run-3");
        }

        @Test
        @DisplayName("non-numeric quality values are dropped")
        void badQuality() throws JsonProcessingException {
            ObjectNode item = normalizer.canonicalItem((ObjectNode) json("""
                    {"pattern": "phi", "confidence": "high", "relevance": 7}
                    """), "run");

            assertThat(item.has("confidence")).isFalse();
            assertThat(item.get("relevance").isDouble()).isTrue();
        }
    }

    // =========================================================================
    //  Rejection
    // =========================================================================

    @Nested
    @DisplayName("Corrupt input")
    class Corrupt {

        @Test
        @DisplayName("a non-object root is rejected")
        void nonObjectRoot() throws JsonProcessingException {
            JsonNode root = json("[1, 2]");

            assertThatThrownBy(() -> normalizer.normalize(root, "list.json"))
                    .isInstanceOfSatisfying(CorruptKnowledgeCollectionException.class,
                            e -> assertThat(e.getSourceId()).isEqualTo("list.json"));
        }

        @Test
        @DisplayName("an object without a recognised layout is rejected")
        void unknownLayout() throws JsonProcessingException {
            JsonNode root = json("{\"foo\": [1], \"bar\": {}}");

            assertThatThrownBy(() -> normalizer.normalize(root, "odd.json"))
                    .isInstanceOf(CorruptKnowledgeCollectionException.class)
                    .hasMessageContaining("foo");
        }

        @Test
        @DisplayName("a collections field that is not an object is rejected")
        void collectionsNotObject() throws JsonProcessingException {
            JsonNode root = json("{\"collections\": [1]}");

            assertThatThrownBy(() -> normalizer.normalize(root, "bad.json"))
                    .isInstanceOf(CorruptKnowledgeCollectionException.class);
        }
    }
}
