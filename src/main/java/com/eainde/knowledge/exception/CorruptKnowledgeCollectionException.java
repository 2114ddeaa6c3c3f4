package com.eainde.knowledge.exception;

/**
 * A knowledge collection handed to the merger has a shape no reader recognises.
 */
public class CorruptKnowledgeCollectionException extends KnowledgeExtractionException {

    private final String sourceId;

    public CorruptKnowledgeCollectionException(String sourceId, String message) {
        super("Corrupt knowledge collection '" + sourceId + "': " + message);
        this.sourceId = sourceId;
    }

    public CorruptKnowledgeCollectionException(String sourceId, String message, Throwable cause) {
        super("Corrupt knowledge collection '" + sourceId + "': " + message, cause);
        this.sourceId = sourceId;
    }

    public String getSourceId() {
        return sourceId;
    }
}
