package com.eainde.knowledge.pipeline;

import com.eainde.knowledge.derive.KnowledgeDeriver;
import com.eainde.knowledge.exception.KnowledgeExtractionException;
import com.eainde.knowledge.extract.ExtractionResult;
import com.eainde.knowledge.extract.TripleExtractor;
import com.eainde.knowledge.fitness.SurvivalFilter;
import com.eainde.knowledge.fitness.SurvivalResult;
import com.eainde.knowledge.merge.KnowledgeCollection;
import com.eainde.knowledge.merge.KnowledgeCollectionNormalizer;
import com.eainde.knowledge.merge.KnowledgeMerger;
import com.eainde.knowledge.merge.MergeResult;
import com.eainde.knowledge.model.Fact;
import com.eainde.knowledge.scan.FileCorpusScanner;
import com.eainde.knowledge.scan.ScanResult;
import com.eainde.knowledge.stats.AggregateStatisticsComputer;
import com.eainde.knowledge.stats.KnowledgeStatistics;
import com.eainde.knowledge.thread.MdcAwareExecutor;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.log4j.Log4j2;
import org.slf4j.MDC;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one batch: scan, extract, filter, derive, merge, aggregate, persist.
 *
 * <h3>Stages:</h3>
 * <pre>
 * FileCorpusScanner      → documents (sorted by path)
 * TripleExtractor        → raw facts (one worker per document)
 * SurvivalFilter         → surviving facts
 * KnowledgeDeriver       → patterns, cross references, progression chains
 * KnowledgeMerger        → this run + prior knowledge files, deduplicated
 * AggregateStatistics    → statistics over the merged triples
 * </pre>
 *
 * <p>No stage starts before the previous one has produced its full output.
 * Unreadable documents, malformed structured documents and corrupt prior files
 * are counted in {@link FailureCounts}; the run still produces a document.</p>
 */
@Log4j2
public class KnowledgePipeline {

    public static final String MDC_RUN_ID = "runId";

    private final FileCorpusScanner scanner;
    private final TripleExtractor extractor;
    private final SurvivalFilter survivalFilter;
    private final KnowledgeDeriver deriver;
    private final KnowledgeMerger merger;
    private final AggregateStatisticsComputer statisticsComputer;
    private final ObjectMapper objectMapper;
    private final ObjectReader factReader;

    public KnowledgePipeline(FileCorpusScanner scanner,
                             TripleExtractor extractor,
                             SurvivalFilter survivalFilter,
                             KnowledgeDeriver deriver,
                             KnowledgeMerger merger,
                             AggregateStatisticsComputer statisticsComputer,
                             ObjectMapper objectMapper) {
        this.scanner = scanner;
        this.extractor = extractor;
        this.survivalFilter = survivalFilter;
        this.deriver = deriver;
        this.merger = merger;
        this.statisticsComputer = statisticsComputer;
        this.objectMapper = objectMapper;
        this.factReader = objectMapper.readerFor(Fact.class)
                .without(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    // =========================================================================
    //  Public API
    // =========================================================================

    public KnowledgeBaseDocument run(PipelineSettings settings) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MDC.put(MDC_RUN_ID, runId);
        try {
            return execute(settings, runId);
        } finally {
            MDC.remove(MDC_RUN_ID);
        }
    }

    // =========================================================================
    //  Stages
    // =========================================================================

    private KnowledgeBaseDocument execute(PipelineSettings settings, String runId) {
        Instant generatedAt = Instant.now();
        log.info("Knowledge pipeline run {} started: root={}, priors={}",
                runId, settings.scanRoot(), settings.priorFiles().size());

        // ── STEP 1: Discover documents ──────────────────────────────────
        ScanResult scan = scanner.scan(settings.scanRoot());

        // ── STEP 2: Extract raw facts, one task per document ────────────
        ExtractionResult extraction;
        try (MdcAwareExecutor executor = new MdcAwareExecutor(settings.effectiveWorkers(), "extract-" + runId)) {
            extraction = extractor.extractAll(scan.documents(), executor);
        }

        // ── STEP 3: Neighbour counts + survival filter ──────────────────
        SurvivalResult survival = survivalFilter.apply(extraction.facts());
        log.info("Survival: {} -> {} facts ({} discarded, {} generation(s), rate {})",
                survival.evaluated(), survival.survivors().size(), survival.discarded(),
                survival.generations(), String.format("%.1f%%", survival.survivalRate() * 100));

        // ── STEP 4: Derived collections ─────────────────────────────────
        KnowledgeCollection current = currentCollection(
                KnowledgeCollection.sourceKey(settings.sourceId(), runId), generatedAt,
                extraction.facts(), survival.survivors());

        // ── STEP 5: Merge with prior knowledge bases ────────────────────
        MergeResult merged = merger.mergeWithPrior(current, settings.priorFiles());

        // ── STEP 6: Aggregate statistics over the merged triples ────────
        List<Fact> mergedFacts = toFacts(merged.items(KnowledgeCollectionNormalizer.TRIPLES));
        KnowledgeStatistics statistics = statisticsComputer.compute(mergedFacts);

        // ── STEP 7: Assemble and persist ────────────────────────────────
        FailureCounts failures = new FailureCounts(
                scan.skipped(),
                scan.unreadable() + extraction.unreadableDocuments(),
                extraction.malformedDocuments(),
                merged.summary().corruptCollections(),
                merged.summary().hashCollisions());

        Map<String, Integer> itemCounts = new LinkedHashMap<>();
        merged.collections().forEach((kind, items) -> itemCounts.put(kind, items.size()));

        KnowledgeBaseDocument document = new KnowledgeBaseDocument(
                new KnowledgeBaseDocument.Metadata(
                        settings.sourceId(),
                        runId,
                        generatedAt,
                        scan.documents().size(),
                        extraction.facts().size(),
                        survival.survivors().size(),
                        survival.generations(),
                        itemCounts,
                        statistics.validationRatio(),
                        statistics.externalValidationRatio(),
                        merged.summary().consumedSources(),
                        failures,
                        merged.summary(),
                        merged.coherence()),
                merged.collections(),
                statistics);

        if (settings.outputPath() != null) {
            write(document, settings.outputPath());
        }
        log.info("Knowledge pipeline run {} finished: {} triples, coherence {}, {} recoverable failures",
                runId, itemCounts.getOrDefault(KnowledgeCollectionNormalizer.TRIPLES, 0),
                String.format("%.3f", statistics.overallCoherence()), failures.total());
        return document;
    }

    private KnowledgeCollection currentCollection(String sourceId, Instant generatedAt,
                                                  List<Fact> rawFacts, List<Fact> survivors) {
        KnowledgeCollectionNormalizer normalizer = merger.getNormalizer();
        Map<String, List<ObjectNode>> collections = new LinkedHashMap<>();
        collections.put(KnowledgeCollectionNormalizer.TRIPLES, toNodes(survivors, sourceId, normalizer));
        collections.put(KnowledgeCollectionNormalizer.PATTERNS,
                toNodes(deriver.patterns(rawFacts), sourceId, normalizer));
        collections.put(KnowledgeCollectionNormalizer.CROSS_REFERENCES,
                toNodes(deriver.crossReferences(survivors), sourceId, normalizer));
        collections.put(KnowledgeCollectionNormalizer.PROGRESSION_CHAINS,
                toNodes(deriver.progressionChains(survivors), sourceId, normalizer));
        return new KnowledgeCollection(sourceId, generatedAt.toString(), collections);
    }

    private List<ObjectNode> toNodes(List<?> items, String sourceId, KnowledgeCollectionNormalizer normalizer) {
        List<ObjectNode> nodes = new ArrayList<>(items.size());
        for (Object item : items) {
            nodes.add(normalizer.canonicalItem(objectMapper.valueToTree(item), sourceId));
        }
        return nodes;
    }

    private List<Fact> toFacts(List<ObjectNode> triples) {
        List<Fact> facts = new ArrayList<>(triples.size());
        int unreadable = 0;
        for (ObjectNode node : triples) {
            try {
                facts.add(factReader.readValue(node));
            } catch (IOException | IllegalArgumentException e) {
                unreadable++;
                log.debug("Triple {} left out of statistics: {}", node.path("id").asText(), e.getMessage());
            }
        }
        if (unreadable > 0) {
            log.warn("{} merged triples could not be read back as facts and were left out of statistics", unreadable);
        }
        return facts;
    }

    private void write(KnowledgeBaseDocument document, Path outputPath) {
        try {
            Path parent = outputPath.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(outputPath.toFile(), document);
            log.info("Knowledge base written to {}", outputPath);
        } catch (IOException e) {
            throw new KnowledgeExtractionException("Failed to write knowledge base to " + outputPath, e);
        }
    }
}
