package com.eainde.knowledge.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;
import java.util.Map;

/**
 * @param collections kind to merged items, kinds and items both in hash order, each item carrying its {@code id}
 * @param summary     added/merged counts and failure counts
 * @param coherence   min(1, mean quality x coherence scale)
 */
public record MergeResult(Map<String, List<ObjectNode>> collections, MergeSummary summary, double coherence) {

    public List<ObjectNode> items(String kind) {
        return collections.getOrDefault(kind, List.of());
    }
}
