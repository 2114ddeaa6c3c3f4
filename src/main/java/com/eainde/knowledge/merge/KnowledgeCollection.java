package com.eainde.knowledge.merge;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A self-describing set of named item collections, as produced by one run.
 *
 * @param sourceId    identifier of the producing run or file, see {@link #sourceKey(String, String)}
 * @param generatedAt generation timestamp as written by the producer, may be null
 * @param collections canonical kind name to flat items
 */
public record KnowledgeCollection(String sourceId, String generatedAt, Map<String, List<ObjectNode>> collections) {

    public KnowledgeCollection {
        Map<String, List<ObjectNode>> copy = new LinkedHashMap<>();
        if (collections != null) {
            collections.forEach((kind, items) -> copy.put(kind, List.copyOf(items)));
        }
        collections = Collections.unmodifiableMap(copy);
    }

    /**
     * "sourceId@runId", or the bare source id when the producer recorded no run id.
     * Runs sharing a configured source id stay distinct in {@link MergeSummary#consumedSources()}.
     */
    public static String sourceKey(String sourceId, String runId) {
        return runId == null || runId.isBlank() ? sourceId : sourceId + "@" + runId;
    }

    public int itemCount() {
        return collections.values().stream().mapToInt(List::size).sum();
    }
}
