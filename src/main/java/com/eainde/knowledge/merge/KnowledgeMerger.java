package com.eainde.knowledge.merge;

import com.eainde.knowledge.exception.CorruptKnowledgeCollectionException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Deduplicates and merges knowledge collections from independent runs.
 *
 * <p>Raw documents go through the {@link KnowledgeCollectionNormalizer} first.
 * A document that cannot be read or whose layout is not recognised is logged,
 * counted in {@link MergeSummary#corruptCollections()} and skipped; the rest of
 * the merge proceeds.</p>
 *
 * <pre>
 * MergeResult result = merger.merge(List.of(runA, runB, runC));
 * result.items("triples");           // one entry per distinct fact
 * result.summary().kinds();          // added vs merged per kind
 * </pre>
 */
@Log4j2
public class KnowledgeMerger {

    private final KnowledgeCollectionNormalizer normalizer;
    private final KnowledgeHasher hasher;
    private final ObjectMapper objectMapper;
    private final double coherenceScale;

    public KnowledgeMerger(KnowledgeCollectionNormalizer normalizer,
                           KnowledgeHasher hasher,
                           ObjectMapper objectMapper,
                           double coherenceScale) {
        this.normalizer = normalizer;
        this.hasher = hasher;
        this.objectMapper = objectMapper;
        this.coherenceScale = coherenceScale;
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public MergeAccumulator newAccumulator() {
        return new MergeAccumulator(hasher);
    }

    public MergeResult merge(List<KnowledgeCollection> collections) {
        MergeAccumulator accumulator = collections.stream()
                .collect(MergeAccumulator.collector(hasher));
        return finish(accumulator);
    }

    /**
     * Folds the current run's collection together with previously persisted knowledge files.
     */
    public MergeResult mergeWithPrior(KnowledgeCollection current, List<Path> priorFiles) {
        MergeAccumulator accumulator = newAccumulator().add(current);
        for (Path file : priorFiles) {
            fold(accumulator, file);
        }
        return finish(accumulator);
    }

    /**
     * Reads, normalises and adds one knowledge file. Returns false if it was skipped.
     */
    public boolean fold(MergeAccumulator accumulator, Path file) {
        String fallbackSourceId = file.getFileName() == null ? file.toString() : file.getFileName().toString();
        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(file));
        } catch (IOException e) {
            log.warn("Skipping knowledge file {}: {}", file, e.getMessage());
            accumulator.recordCorruptCollection(fallbackSourceId);
            return false;
        }
        return fold(accumulator, root, fallbackSourceId);
    }

    /**
     * Normalises and adds one parsed knowledge document. Returns false if it was skipped.
     */
    public boolean fold(MergeAccumulator accumulator, JsonNode document, String fallbackSourceId) {
        try {
            KnowledgeCollection collection = normalizer.normalize(document, fallbackSourceId);
            accumulator.add(collection);
            log.info("Folded {} items from {}", collection.itemCount(), collection.sourceId());
            return true;
        } catch (CorruptKnowledgeCollectionException e) {
            log.warn("Skipping knowledge collection: {}", e.getMessage());
            accumulator.recordCorruptCollection(e.getSourceId());
            return false;
        }
    }

    public MergeResult finish(MergeAccumulator accumulator) {
        MergeResult result = accumulator.result(coherenceScale);
        MergeSummary summary = result.summary();
        summary.kinds().forEach((kind, counts) ->
                log.info("   {}: {} distinct, {} merged", kind, counts.added(), counts.merged()));
        log.info("Merge complete: {} sources, {} collisions, {} corrupt inputs, coherence {}",
                summary.consumedSources().size(), summary.hashCollisions(),
                summary.corruptCollections(), String.format("%.3f", result.coherence()));
        return result;
    }

    public KnowledgeCollectionNormalizer getNormalizer() {
        return normalizer;
    }
}
