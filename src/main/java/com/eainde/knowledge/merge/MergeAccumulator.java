package com.eainde.knowledge.merge;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.stream.Collector;

/**
 * Mutable fold state of a merge: deduplicated items per kind plus counters.
 *
 * <p>Collections are folded in with {@link #add(KnowledgeCollection)}; two
 * partial accumulators built independently (e.g. one per partition of the
 * inputs) are joined with {@link #combine(MergeAccumulator)}. Without hash
 * collisions the final {@link #result(double)} does not depend on the order in
 * which collections were added or accumulators combined.</p>
 *
 * <p>Not thread-safe; use one accumulator per thread and combine.</p>
 */
@Log4j2
public final class MergeAccumulator {

    private final KnowledgeHasher hasher;
    private final Map<String, Map<String, KnowledgeItem>> items = new TreeMap<>();
    private final Map<String, Integer> received = new TreeMap<>();
    private final Map<String, Integer> collisions = new TreeMap<>();
    private final SortedSet<String> consumedSources = new TreeSet<>();
    private int corruptCollections;

    public MergeAccumulator(KnowledgeHasher hasher) {
        this.hasher = hasher;
    }

    public static Collector<KnowledgeCollection, MergeAccumulator, MergeAccumulator> collector(KnowledgeHasher hasher) {
        return Collector.of(
                () -> new MergeAccumulator(hasher),
                MergeAccumulator::add,
                MergeAccumulator::combine);
    }

    // =========================================================================
    //  Fold
    // =========================================================================

    public MergeAccumulator add(KnowledgeCollection collection) {
        consumedSources.add(collection.sourceId());
        collection.collections().forEach((kind, payloads) -> {
            items.computeIfAbsent(kind, k -> new TreeMap<>());
            for (ObjectNode payload : payloads) {
                received.merge(kind, 1, Integer::sum);
                accept(hasher.keyed(kind, payload));
            }
        });
        return this;
    }

    public MergeAccumulator combine(MergeAccumulator other) {
        other.items.forEach((kind, bucket) -> {
            items.computeIfAbsent(kind, k -> new TreeMap<>());
            bucket.values().forEach(this::accept);
        });
        other.received.forEach((kind, count) -> received.merge(kind, count, Integer::sum));
        other.collisions.forEach((kind, count) -> collisions.merge(kind, count, Integer::sum));
        consumedSources.addAll(other.consumedSources);
        corruptCollections += other.corruptCollections;
        return this;
    }

    public void recordCorruptCollection(String sourceId) {
        corruptCollections++;
        log.debug("Corrupt collection {} recorded ({} so far)", sourceId, corruptCollections);
    }

    private void accept(KnowledgeItem incoming) {
        Map<String, KnowledgeItem> bucket = items.computeIfAbsent(incoming.kind(), k -> new TreeMap<>());
        KnowledgeItem existing = bucket.get(incoming.hash());
        if (existing == null) {
            bucket.put(incoming.hash(), incoming);
            return;
        }
        if (!existing.identityKey().equals(incoming.identityKey())) {
            collisions.merge(incoming.kind(), 1, Integer::sum);
            log.warn("Hash collision in {} on {}: keeping '{}', dropping '{}'",
                    incoming.kind(), incoming.hash(), existing.identityKey(), incoming.identityKey());
            return;
        }
        bucket.put(incoming.hash(), new KnowledgeItem(incoming.kind(), incoming.hash(), existing.identityKey(),
                ItemMergePolicy.merge(existing.payload(), incoming.payload())));
    }

    // =========================================================================
    //  Result
    // =========================================================================

    /**
     * @param coherenceScale multiplier applied to the mean quality of all items
     */
    public MergeResult result(double coherenceScale) {
        Map<String, List<ObjectNode>> collections = new LinkedHashMap<>();
        Map<String, MergeSummary.KindCounts> kinds = new LinkedHashMap<>();
        int totalCollisions = 0;
        double qualitySum = 0;
        int qualityCount = 0;

        for (Map.Entry<String, Map<String, KnowledgeItem>> entry : items.entrySet()) {
            String kind = entry.getKey();
            List<ObjectNode> out = new ArrayList<>(entry.getValue().size());
            for (KnowledgeItem item : entry.getValue().values()) {
                ObjectNode payload = item.payload().deepCopy();
                payload.put(ItemFields.ID, item.hash());
                out.add((ObjectNode) CanonicalJson.sorted(payload));

                OptionalDouble quality = quality(item.payload());
                if (quality.isPresent()) {
                    qualitySum += quality.getAsDouble();
                    qualityCount++;
                }
            }
            collections.put(kind, Collections.unmodifiableList(out));

            int kindCollisions = collisions.getOrDefault(kind, 0);
            totalCollisions += kindCollisions;
            int distinct = out.size();
            int merged = received.getOrDefault(kind, 0) - distinct - kindCollisions;
            kinds.put(kind, new MergeSummary.KindCounts(distinct, Math.max(0, merged)));
        }

        double mean = qualityCount == 0 ? 0.0 : qualitySum / qualityCount;
        double coherence = Math.min(1.0, mean * coherenceScale);

        MergeSummary summary = new MergeSummary(Collections.unmodifiableMap(kinds), totalCollisions,
                corruptCollections, List.copyOf(consumedSources));
        return new MergeResult(Collections.unmodifiableMap(collections), summary, coherence);
    }

    /** Fitness when present, otherwise confidence. */
    private static OptionalDouble quality(ObjectNode payload) {
        JsonNode fitness = payload.get(ItemFields.FITNESS);
        if (fitness != null && fitness.isNumber()) return OptionalDouble.of(fitness.doubleValue());
        JsonNode confidence = payload.get(ItemFields.CONFIDENCE);
        if (confidence != null && confidence.isNumber()) return OptionalDouble.of(confidence.doubleValue());
        return OptionalDouble.empty();
    }
}
