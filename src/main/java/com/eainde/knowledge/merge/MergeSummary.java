package com.eainde.knowledge.merge;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Counts reported by a merge.
 *
 * @param kinds              per-kind added/merged counts
 * @param hashCollisions     items dropped because their hash matched an item with a different identity
 * @param corruptCollections inputs skipped because their layout was not recognised
 * @param consumedSources    source ids of every collection folded in, sorted
 */
public record MergeSummary(
        @JsonProperty("kinds")              Map<String, KindCounts> kinds,
        @JsonProperty("hashCollisions")     int hashCollisions,
        @JsonProperty("corruptCollections") int corruptCollections,
        @JsonProperty("consumedSources")    List<String> consumedSources
) {

    /**
     * @param added  distinct items of this kind in the result
     * @param merged incoming items folded into an existing item, counting duplicates
     *               within one input as well as across inputs (received - added - collisions)
     */
    public record KindCounts(
            @JsonProperty("added")  int added,
            @JsonProperty("merged") int merged
    ) {}

    public int totalAdded() {
        return kinds.values().stream().mapToInt(KindCounts::added).sum();
    }

    public int totalMerged() {
        return kinds.values().stream().mapToInt(KindCounts::merged).sum();
    }
}
