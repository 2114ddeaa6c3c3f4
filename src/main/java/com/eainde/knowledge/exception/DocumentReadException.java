package com.eainde.knowledge.exception;

import java.nio.file.Path;

/**
 * A document could not be read. The extractor skips it and counts the failure.
 */
public class DocumentReadException extends KnowledgeExtractionException {

    private final transient Path path;

    public DocumentReadException(Path path, Throwable cause) {
        super("Failed to read document " + path + ": " + cause.getMessage(), cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
