package com.eainde.knowledge.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.OptionalDouble;
import java.util.TreeSet;

/**
 * Combines two payloads that share an identity.
 *
 * <ul>
 *   <li>quality fields ({@link ItemFields#QUALITY}): maximum of the numeric values present</li>
 *   <li>{@code origins}: sorted set union</li>
 *   <li>{@code timestamp}: latest parseable instant</li>
 *   <li>every other field: taken from the preferred payload, which is the one
 *       with the later timestamp, ties broken by the smaller canonical rendering
 *       of the descriptive fields</li>
 * </ul>
 *
 * <p>Each rule is a max or a union over a total order, so the combination is
 * associative and commutative.</p>
 */
public final class ItemMergePolicy {

    private static final Comparator<ObjectNode> PREFERENCE = Comparator
            .comparing(ItemMergePolicy::timestampOf, Comparator.reverseOrder())
            .thenComparing(ItemMergePolicy::timestampText)
            .thenComparing(ItemMergePolicy::descriptive);

    private ItemMergePolicy() {
    }

    public static ObjectNode merge(ObjectNode left, ObjectNode right) {
        ObjectNode preferred = PREFERENCE.compare(left, right) <= 0 ? left : right;

        ObjectNode merged = JsonNodeFactory.instance.objectNode();
        preferred.fields().forEachRemaining(field -> {
            if (!ItemFields.MERGED.contains(field.getKey())) {
                merged.set(field.getKey(), field.getValue().deepCopy());
            }
        });

        for (String field : ItemFields.QUALITY) {
            OptionalDouble max = max(numeric(left.get(field)), numeric(right.get(field)));
            if (max.isPresent()) merged.put(field, max.getAsDouble());
        }

        TreeSet<String> origins = new TreeSet<>();
        collectOrigins(left, origins);
        collectOrigins(right, origins);
        ArrayNode originArray = merged.putArray(ItemFields.ORIGINS);
        origins.forEach(originArray::add);

        // the preferred payload carries the latest timestamp
        JsonNode timestamp = preferred.get(ItemFields.TIMESTAMP);
        if (timestamp != null && !timestamp.isNull()) {
            merged.set(ItemFields.TIMESTAMP, timestamp.deepCopy());
        }
        return merged;
    }

    // =========================================================================
    //  Field helpers
    // =========================================================================

    static OptionalDouble numeric(JsonNode node) {
        if (node == null || node.isNull()) return OptionalDouble.empty();
        if (node.isNumber()) return OptionalDouble.of(node.doubleValue());
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    private static OptionalDouble max(OptionalDouble a, OptionalDouble b) {
        if (a.isEmpty()) return b;
        if (b.isEmpty()) return a;
        return OptionalDouble.of(Math.max(a.getAsDouble(), b.getAsDouble()));
    }

    private static void collectOrigins(ObjectNode node, TreeSet<String> into) {
        JsonNode origins = node.get(ItemFields.ORIGINS);
        if (origins == null) return;
        if (origins.isArray()) {
            origins.forEach(o -> {
                if (o.isValueNode() && !o.isNull()) into.add(o.asText());
            });
        } else if (origins.isValueNode() && !origins.isNull()) {
            into.add(origins.asText());
        }
    }

    /** Parsed timestamp, {@link Instant#MIN} when absent or unparseable. */
    static Instant timestampOf(ObjectNode node) {
        JsonNode ts = node.get(ItemFields.TIMESTAMP);
        if (ts == null || ts.isNull()) return Instant.MIN;
        if (ts.isNumber()) return Instant.ofEpochMilli(ts.longValue());
        if (!ts.isTextual()) return Instant.MIN;
        String text = ts.asText().trim();
        try {
            return Instant.parse(text);
        } catch (DateTimeParseException e) {
            try {
                return OffsetDateTime.parse(text).toInstant();
            } catch (DateTimeParseException ignored) {
                return Instant.MIN;
            }
        }
    }

    /** Absent and explicit null render alike: {@link #merge} drops a null timestamp. */
    private static String timestampText(ObjectNode node) {
        JsonNode ts = node.get(ItemFields.TIMESTAMP);
        return ts == null || ts.isNull() ? "" : ts.toString();
    }

    private static String descriptive(ObjectNode node) {
        return CanonicalJson.renderWithout(node, ItemFields.MERGED);
    }
}
