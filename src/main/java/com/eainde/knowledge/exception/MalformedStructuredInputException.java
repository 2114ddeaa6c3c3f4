package com.eainde.knowledge.exception;

/**
 * A JSON or YAML document failed to parse. Extraction falls back to raw-text
 * matching on the same content.
 */
public class MalformedStructuredInputException extends KnowledgeExtractionException {

    private final String origin;

    public MalformedStructuredInputException(String origin, String format, Throwable cause) {
        super("Malformed " + format + " document " + origin + ": " + cause.getMessage(), cause);
        this.origin = origin;
    }

    public String getOrigin() {
        return origin;
    }
}
