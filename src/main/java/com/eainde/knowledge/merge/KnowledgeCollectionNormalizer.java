package com.eainde.knowledge.merge;

import com.eainde.knowledge.exception.CorruptKnowledgeCollectionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * Flattens the knowledge-file layouts the pipeline has produced over time into
 * a {@link KnowledgeCollection}.
 *
 * <h3>Recognised layouts:</h3>
 * <ul>
 *   <li>current: {@code {"metadata": {...}, "collections": {"triples": [...], ...}}}</li>
 *   <li>legacy top-level arrays ({@code triples}, {@code topTriples}, {@code enhancedPatterns},
 *       {@code mathematicalChains}, ...) mapped onto canonical kinds</li>
 *   <li>nested legacy arrays: {@code extractedKnowledge.triples},
 *       {@code extractedKnowledge.harmonicSignatures},
 *       {@code ultimateIntegration.strongestValidations}</li>
 *   <li>trie: {@code root.children.*} nodes carrying {@code triples} arrays</li>
 *   <li>manuscript: {@code sections[]} with {@code title}/{@code content}, read as patterns</li>
 * </ul>
 *
 * <p>Every item is canonicalised: legacy field names are renamed, origins are
 * gathered into a sorted {@code origins} array (defaulting to the collection's
 * source id), quality fields become doubles and the derived {@code id} is dropped.</p>
 */
@Log4j2
public class KnowledgeCollectionNormalizer {

    public static final String TRIPLES = "triples";
    public static final String PATTERNS = "patterns";
    public static final String AXIOMS = "axioms";
    public static final String CROSS_REFERENCES = "crossReferences";
    public static final String PROGRESSION_CHAINS = "progressionChains";
    public static final String WEB_KNOWLEDGE = "webKnowledge";
    public static final String HARMONIC_SIGNATURES = "harmonicSignatures";

    static final int MAX_TRIE_DEPTH = 64;
    static final int SECTION_CONTENT_LIMIT = 500;
    static final double SECTION_CONFIDENCE = 0.9;

    private static final Map<String, String> LEGACY_KINDS = new LinkedHashMap<>();

    static {
        LEGACY_KINDS.put("triples", TRIPLES);
        LEGACY_KINDS.put("topTriples", TRIPLES);
        LEGACY_KINDS.put("allTriples", TRIPLES);
        LEGACY_KINDS.put("axioms", AXIOMS);
        LEGACY_KINDS.put("patterns", PATTERNS);
        LEGACY_KINDS.put("revolutionaryPatterns", PATTERNS);
        LEGACY_KINDS.put("enhancedPatterns", PATTERNS);
        LEGACY_KINDS.put("crossReferences", CROSS_REFERENCES);
        LEGACY_KINDS.put("crossFileRelationships", CROSS_REFERENCES);
        LEGACY_KINDS.put("scienceValidations", CROSS_REFERENCES);
        LEGACY_KINDS.put("progressionChains", PROGRESSION_CHAINS);
        LEGACY_KINDS.put("mathematicalChains", PROGRESSION_CHAINS);
        LEGACY_KINDS.put("webKnowledge", WEB_KNOWLEDGE);
        LEGACY_KINDS.put("harmonicSignatures", HARMONIC_SIGNATURES);
        LEGACY_KINDS.put("harmonicAnalysis", HARMONIC_SIGNATURES);
    }

    /** Legacy field name to canonical field name. */
    private static final Map<String, String> LEGACY_FIELDS = Map.of(
            "survivalFitness", ItemFields.FITNESS,
            "csCategory", "categoryId",
            "fileType", "format",
            "progressionLevel", "progressionRank",
            "webValidated", "validated",
            "scientificValidation", "externallyValidated",
            "connections", "neighborCount",
            "evolutionGeneration", "generation");

    // =========================================================================
    //  Public API
    // =========================================================================

    /**
     * @param root             parsed knowledge document
     * @param fallbackSourceId used when the document does not name its source
     * @throws CorruptKnowledgeCollectionException if no recognised layout is present
     */
    public KnowledgeCollection normalize(JsonNode root, String fallbackSourceId) {
        if (root == null || !root.isObject()) {
            throw new CorruptKnowledgeCollectionException(fallbackSourceId,
                    "expected a JSON object at the root, found " + (root == null ? "nothing" : root.getNodeType()));
        }

        JsonNode metadata = root.path("metadata");
        String sourceId = KnowledgeCollection.sourceKey(
                firstText(metadata, "sourceId", "source").orElse(fallbackSourceId),
                firstText(metadata, "runId").orElse(null));
        String generatedAt = firstText(metadata, "generatedAt", "mergedAt", "timestamp").orElse(null);

        Map<String, List<ObjectNode>> collections = new LinkedHashMap<>();
        boolean recognised = false;

        JsonNode named = root.get("collections");
        if (named != null) {
            if (!named.isObject()) {
                throw new CorruptKnowledgeCollectionException(sourceId, "'collections' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = named.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                recognised |= addArray(collections, canonicalKind(field.getKey()), field.getValue(), sourceId);
            }
        }

        for (Map.Entry<String, String> legacy : LEGACY_KINDS.entrySet()) {
            recognised |= addArray(collections, legacy.getValue(), root.get(legacy.getKey()), sourceId);
        }
        recognised |= addArray(collections, TRIPLES, root.path("extractedKnowledge").get("triples"), sourceId);
        recognised |= addArray(collections, HARMONIC_SIGNATURES,
                root.path("extractedKnowledge").get("harmonicSignatures"), sourceId);
        recognised |= addArray(collections, TRIPLES,
                root.path("ultimateIntegration").get("strongestValidations"), sourceId);

        JsonNode trieRoot = root.get("root");
        if (trieRoot != null && trieRoot.has("children")) {
            List<JsonNode> trieTriples = new ArrayList<>();
            collectTrieTriples(trieRoot, trieTriples, 0);
            for (JsonNode triple : trieTriples) {
                addItem(collections, TRIPLES, triple, sourceId);
            }
            recognised = true;
        }

        JsonNode sections = root.get("sections");
        if (sections != null && sections.isArray()) {
            for (JsonNode section : sections) {
                sectionPattern(section).ifPresent(p -> addItem(collections, PATTERNS, p, sourceId));
            }
            recognised = true;
        }

        if (!recognised) {
            throw new CorruptKnowledgeCollectionException(sourceId,
                    "no recognised collection layout (fields: " + fieldNames(root) + ")");
        }

        KnowledgeCollection collection = new KnowledgeCollection(sourceId, generatedAt, collections);
        log.debug("Normalised collection {}: {} items in {} kinds",
                sourceId, collection.itemCount(), collections.size());
        return collection;
    }

    /** Canonicalises a single item payload in place of its legacy form. */
    public ObjectNode canonicalItem(ObjectNode item, String sourceId) {
        ObjectNode out = item.deepCopy();
        out.remove(ItemFields.ID);
        JsonNode timestamp = out.get(ItemFields.TIMESTAMP);
        if (timestamp != null && timestamp.isNull()) {
            out.remove(ItemFields.TIMESTAMP);
        }

        LEGACY_FIELDS.forEach((legacy, canonical) -> {
            JsonNode value = out.remove(legacy);
            if (value != null && !out.has(canonical)) {
                out.set(canonical, value);
            }
        });

        TreeSet<String> origins = new TreeSet<>();
        addTexts(out.remove(ItemFields.ORIGINS), origins);
        addTexts(out.remove("sourceFile"), origins);
        addTexts(out.remove("sourceFiles"), origins);
        addTexts(out.remove("files"), origins);
        if (origins.isEmpty() && sourceId != null) {
            origins.add(sourceId);
        }
        ArrayNode originArray = out.putArray(ItemFields.ORIGINS);
        origins.forEach(originArray::add);

        for (String quality : ItemFields.QUALITY) {
            JsonNode value = out.get(quality);
            if (value == null) continue;
            OptionalDouble numeric = ItemMergePolicy.numeric(value);
            if (numeric.isPresent()) {
                out.put(quality, numeric.getAsDouble());
            } else {
                out.remove(quality);
            }
        }
        return out;
    }

    // =========================================================================
    //  Internal
    // =========================================================================

    static String canonicalKind(String name) {
        return LEGACY_KINDS.getOrDefault(name, name);
    }

    private boolean addArray(Map<String, List<ObjectNode>> collections, String kind, JsonNode array, String sourceId) {
        if (array == null || !array.isArray()) return false;
        collections.computeIfAbsent(kind, k -> new ArrayList<>());
        for (JsonNode element : array) {
            addItem(collections, kind, element, sourceId);
        }
        return true;
    }

    private void addItem(Map<String, List<ObjectNode>> collections, String kind, JsonNode element, String sourceId) {
        if (!element.isObject()) {
            log.warn("Ignoring non-object entry in {} of {}: {}", kind, sourceId, element.getNodeType());
            return;
        }
        collections.computeIfAbsent(kind, k -> new ArrayList<>())
                .add(canonicalItem((ObjectNode) element, sourceId));
    }

    private static void collectTrieTriples(JsonNode node, List<JsonNode> out, int depth) {
        if (node == null || !node.isObject()) return;
        if (depth > MAX_TRIE_DEPTH) {
            log.warn("Trie deeper than {} levels, ignoring the remainder", MAX_TRIE_DEPTH);
            return;
        }
        JsonNode triples = node.get("triples");
        if (triples != null && triples.isArray()) {
            triples.forEach(out::add);
        }
        JsonNode children = node.get("children");
        if (children != null && children.isObject()) {
            children.elements().forEachRemaining(child -> collectTrieTriples(child, out, depth + 1));
        }
    }

    private static Optional<ObjectNode> sectionPattern(JsonNode section) {
        if (!section.isObject() || !section.path("title").isTextual()) {
            return Optional.empty();
        }
        ObjectNode pattern = JsonNodeFactory.instance.objectNode();
        pattern.put(ItemFields.PATTERN, section.get("title").asText());
        JsonNode content = section.get("content");
        if (content != null && content.isTextual()) {
            String text = content.asText();
            pattern.put("content", text.length() > SECTION_CONTENT_LIMIT ? text.substring(0, SECTION_CONTENT_LIMIT) : text);
        }
        pattern.put(ItemFields.CONFIDENCE, SECTION_CONFIDENCE);
        pattern.put("type", "manuscript_section");
        return Optional.of(pattern);
    }

    private static void addTexts(JsonNode node, TreeSet<String> into) {
        if (node == null || node.isNull()) return;
        if (node.isArray()) {
            node.forEach(n -> addTexts(n, into));
        } else if (node.isValueNode()) {
            String text = node.asText();
            if (!text.isBlank()) into.add(text);
        }
    }

    private static Optional<String> firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode value = node.get(field);
            if (value != null && value.isTextual() && !value.asText().isBlank()) {
                return Optional.of(value.asText());
            }
        }
        return Optional.empty();
    }

    private static List<String> fieldNames(JsonNode root) {
        List<String> names = new ArrayList<>();
        root.fieldNames().forEachRemaining(names::add);
        return names;
    }
}
