package com.eainde.knowledge.scan;

import java.util.List;

/**
 * Output of one scan pass.
 *
 * @param documents  accepted documents, sorted by path
 * @param unreadable entries that could not be inspected or opened
 * @param skipped    files rejected by the extension allow-list or the size bounds
 */
public record ScanResult(List<Document> documents, int unreadable, int skipped) {

    public static ScanResult empty() {
        return new ScanResult(List.of(), 0, 0);
    }
}
