package com.eainde.knowledge.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * One flat item of a named collection, keyed for deduplication.
 *
 * @param kind        canonical collection name (triples, patterns, ...)
 * @param hash        content hash the item is deduplicated on
 * @param identityKey the material that was hashed; two items with the same hash but
 *                    different identity keys are a collision
 * @param payload     item fields, including {@code origins}
 */
public record KnowledgeItem(String kind, String hash, String identityKey, ObjectNode payload) {
}
