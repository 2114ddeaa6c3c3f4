package com.eainde.knowledge.extract;

import com.eainde.knowledge.model.Fact;
import com.eainde.knowledge.scan.Document;

import java.util.List;

/**
 * Facts produced from one document, plus the recoverable failures met on the way.
 *
 * @param document   the source document
 * @param facts      facts in match order
 * @param unreadable the document could not be read; {@code facts} is empty
 * @param malformed  structured parsing failed and raw-text matching was used instead
 */
public record DocumentExtraction(Document document, List<Fact> facts, boolean unreadable, boolean malformed) {

    static DocumentExtraction unreadable(Document document) {
        return new DocumentExtraction(document, List.of(), true, false);
    }
}
