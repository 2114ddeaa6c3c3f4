package com.eainde.knowledge.extract;

import com.eainde.knowledge.model.Fact;

import java.util.List;

/**
 * Raw facts from a whole corpus, concatenated in document order.
 *
 * @param facts               raw facts
 * @param documentsProcessed  documents handed to the extractor
 * @param unreadableDocuments documents skipped because they could not be read
 * @param malformedDocuments  structured documents that fell back to raw-text extraction
 */
public record ExtractionResult(
        List<Fact> facts,
        int documentsProcessed,
        int unreadableDocuments,
        int malformedDocuments
) {

    static ExtractionResult aggregate(List<DocumentExtraction> extractions) {
        List<Fact> facts = extractions.stream()
                .flatMap(e -> e.facts().stream())
                .toList();
        int unreadable = (int) extractions.stream().filter(DocumentExtraction::unreadable).count();
        int malformed = (int) extractions.stream().filter(DocumentExtraction::malformed).count();
        return new ExtractionResult(facts, extractions.size(), unreadable, malformed);
    }
}
