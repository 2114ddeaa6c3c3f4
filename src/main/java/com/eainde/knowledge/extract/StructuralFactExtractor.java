package com.eainde.knowledge.extract;

import com.eainde.knowledge.model.Fact;
import com.eainde.knowledge.scan.Document;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Emits (StructureLabel, relation, key) facts from a parsed JSON/YAML tree.
 *
 * <table>
 *   <caption>Relations</caption>
 *   <tr><th>value shape</th><th>predicate</th><th>confidence</th></tr>
 *   <tr><td>non-blank string shorter than 200 chars</td><td>contains</td><td>0.75</td></tr>
 *   <tr><td>number</td><td>has_numeric_value</td><td>0.7</td></tr>
 *   <tr><td>array</td><td>contains_array</td><td>0.8</td></tr>
 *   <tr><td>object</td><td>(recurse one level deeper)</td><td></td></tr>
 * </table>
 *
 * <p>The root object is depth 1. Objects deeper than {@code maxDepth} are not
 * visited, so extraction terminates on arbitrarily deep input. Object elements
 * of arrays are visited one level deeper than the array's owner.</p>
 */
public class StructuralFactExtractor {

    public static final String CONTAINS = "contains";
    public static final String HAS_NUMERIC_VALUE = "has_numeric_value";
    public static final String CONTAINS_ARRAY = "contains_array";

    static final int MAX_STRING_LENGTH = 200;

    private final int maxDepth;

    public StructuralFactExtractor(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be >= 1, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public List<Fact> extract(JsonNode root, Document document) {
        List<Fact> facts = new ArrayList<>();
        String label = document.format().toUpperCase(Locale.ROOT) + " Structure";
        visit(root, 1, label, document, facts);
        return facts;
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    private void visit(JsonNode node, int depth, String label, Document document, List<Fact> out) {
        if (depth > maxDepth || node == null) return;

        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isObject()) visit(element, depth + 1, label, document, out);
            }
            return;
        }
        if (!node.isObject()) return;

        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();

            if (value.isTextual()) {
                String text = value.asText();
                if (!text.isBlank() && text.length() < MAX_STRING_LENGTH) {
                    out.add(structureFact(label, CONTAINS, key, 0.75, document));
                }
            } else if (value.isNumber()) {
                out.add(structureFact(label, HAS_NUMERIC_VALUE, key, 0.7, document));
            } else if (value.isArray()) {
                out.add(structureFact(label, CONTAINS_ARRAY, key, 0.8, document));
                visit(value, depth, label, document, out);
            } else if (value.isObject()) {
                visit(value, depth + 1, label, document, out);
            }
        }
    }

    private static Fact structureFact(String label, String predicate, String key,
                                      double confidence, Document document) {
        TreeSet<String> origins = new TreeSet<>();
        origins.add(document.originId());
        return new Fact(label, predicate, Fact.normalizeTerm(key), confidence, Fact.STRUCTURE_CATEGORY,
                origins, document.format(), 0, List.of(), false, false,
                0.0, 0, 0, document.lastModified());
    }
}
