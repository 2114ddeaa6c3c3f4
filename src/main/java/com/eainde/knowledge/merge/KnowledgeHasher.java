package com.eainde.knowledge.merge;

import com.eainde.knowledge.model.Fact;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.codec.digest.DigestUtils;

import java.util.function.UnaryOperator;

/**
 * Computes the deduplication key of an item.
 *
 * <ol>
 *   <li>items with subject, predicate and object: md5 of the normalised
 *       "subject|predicate|object", so a fact hashes the same whichever document
 *       or collection it came from</li>
 *   <li>items with a {@code pattern} field: md5 of the normalised pattern</li>
 *   <li>items with a {@code concept} field: md5 of the normalised concept</li>
 *   <li>anything else: md5 of the sorted-key JSON of the item without its merged fields</li>
 * </ol>
 */
public class KnowledgeHasher {

    private final UnaryOperator<String> digest;

    public KnowledgeHasher() {
        this(DigestUtils::md5Hex);
    }

    /** Alternative digest, mainly to force collisions in tests. */
    public KnowledgeHasher(UnaryOperator<String> digest) {
        this.digest = digest;
    }

    public static String factHash(String subject, String predicate, String object) {
        return DigestUtils.md5Hex(Fact.identityKey(subject, predicate, object));
    }

    public KnowledgeItem keyed(String kind, ObjectNode payload) {
        String identityKey = identityKey(payload);
        return new KnowledgeItem(kind, digest.apply(identityKey), identityKey, payload);
    }

    String identityKey(ObjectNode payload) {
        String subject = text(payload, ItemFields.SUBJECT);
        String predicate = text(payload, ItemFields.PREDICATE);
        String object = text(payload, ItemFields.OBJECT);
        if (subject != null && predicate != null && object != null) {
            return Fact.identityKey(subject, predicate, object);
        }
        String pattern = text(payload, ItemFields.PATTERN);
        if (pattern != null) {
            return Fact.normalizeTerm(pattern);
        }
        String concept = text(payload, ItemFields.CONCEPT);
        if (concept != null) {
            return Fact.normalizeTerm(concept);
        }
        return CanonicalJson.renderWithout(payload, ItemFields.MERGED);
    }

    private static String text(ObjectNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isValueNode() || node.isNull()) return null;
        String value = node.asText();
        return value.isBlank() ? null : value;
    }
}
