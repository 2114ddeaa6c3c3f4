package com.eainde.knowledge.pipeline;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Recoverable failures met during one run. Surfaced in the output metadata.
 *
 * @param skippedDocuments             files rejected by the extension allow-list or size bounds
 * @param unreadableDocuments          paths that could not be inspected or read
 * @param malformedStructuredDocuments JSON/YAML documents that fell back to raw-text extraction
 * @param corruptCollections           prior knowledge files skipped by the merger
 * @param hashCollisions               merge inputs dropped on a hash collision
 */
public record FailureCounts(
        @JsonProperty("skippedDocuments")             int skippedDocuments,
        @JsonProperty("unreadableDocuments")          int unreadableDocuments,
        @JsonProperty("malformedStructuredDocuments") int malformedStructuredDocuments,
        @JsonProperty("corruptCollections")           int corruptCollections,
        @JsonProperty("hashCollisions")               int hashCollisions
) {

    public int total() {
        return unreadableDocuments + malformedStructuredDocuments + corruptCollections + hashCollisions;
    }
}
