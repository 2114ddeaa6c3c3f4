package com.eainde.knowledge.pipeline;

import com.eainde.knowledge.merge.MergeSummary;
import com.eainde.knowledge.stats.KnowledgeStatistics;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * The persisted knowledge base. Readable again as a prior collection by the merger.
 *
 * @param metadata    run description and counts
 * @param collections deduplicated items per kind
 * @param statistics  aggregates over the deduplicated triples
 */
public record KnowledgeBaseDocument(
        @JsonProperty("metadata")    Metadata metadata,
        @JsonProperty("collections") Map<String, List<ObjectNode>> collections,
        @JsonProperty("statistics")  KnowledgeStatistics statistics
) {

    /**
     * @param sourceId                identifier of the producing pipeline
     * @param runId                   identifier of this run, also present in the log MDC
     * @param generatedAt             generation time
     * @param documentsScanned        documents accepted by the scanner
     * @param rawFacts                facts before filtering
     * @param survivingFacts          facts after filtering
     * @param generations             filtering generations run
     * @param itemCounts              items per kind after merging
     * @param validationRatio         share of oracle-validated triples
     * @param externalValidationRatio share of triples from externally-validated categories
     * @param consumedSources         sources folded into this document
     * @param failures                recoverable failure counts
     * @param mergeSummary            added/merged counts per kind
     * @param coherence               merge coherence scalar
     */
    public record Metadata(
            @JsonProperty("sourceId")                String sourceId,
            @JsonProperty("runId")                   String runId,
            @JsonProperty("generatedAt")             Instant generatedAt,
            @JsonProperty("documentsScanned")        int documentsScanned,
            @JsonProperty("rawFacts")                int rawFacts,
            @JsonProperty("survivingFacts")          int survivingFacts,
            @JsonProperty("generations")             int generations,
            @JsonProperty("itemCounts")              Map<String, Integer> itemCounts,
            @JsonProperty("validationRatio")         double validationRatio,
            @JsonProperty("externalValidationRatio") double externalValidationRatio,
            @JsonProperty("consumedSources")         List<String> consumedSources,
            @JsonProperty("failures")                FailureCounts failures,
            @JsonProperty("mergeSummary")            MergeSummary mergeSummary,
            @JsonProperty("coherence")               double coherence
    ) {}
}
