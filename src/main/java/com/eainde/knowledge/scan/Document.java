package com.eainde.knowledge.scan;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A candidate document discovered by one scan pass.
 *
 * @param path         absolute path of the file
 * @param sizeBytes    file size at scan time
 * @param lastModified modification time at scan time
 * @param format       format/language tag derived from the extension (json, markdown, python, ...)
 * @param extension    lower-cased file extension without the dot
 */
public record Document(
        Path path,
        long sizeBytes,
        Instant lastModified,
        String format,
        String extension
) {

    /** Stable reference recorded as a fact's origin. */
    public String originId() {
        return path.toString();
    }

    public boolean isStructured() {
        return DocumentFormats.isStructured(format);
    }
}
