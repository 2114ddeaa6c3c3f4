package com.eainde.knowledge.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;

/**
 * Sorted-key JSON rendering used for hashing and for deterministic output.
 * Array element order is preserved.
 */
public final class CanonicalJson {

    private CanonicalJson() {
    }

    /** Deep copy of {@code node} with object keys in ascending order. */
    public static JsonNode sorted(JsonNode node) {
        if (node == null) return JsonNodeFactory.instance.nullNode();
        if (node.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            names.sort(null);
            for (String name : names) {
                out.set(name, sorted(node.get(name)));
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            node.forEach(element -> out.add(sorted(element)));
            return out;
        }
        return node.deepCopy();
    }

    public static String render(JsonNode node) {
        return sorted(node).toString();
    }

    /** Canonical rendering of {@code node} with the given top-level fields left out. */
    public static String renderWithout(ObjectNode node, Collection<String> excludedFields) {
        ObjectNode copy = node.deepCopy();
        copy.remove(excludedFields);
        return render(copy);
    }
}
