package com.eainde.knowledge.exception;

/**
 * Root of the pipeline's unchecked exception hierarchy.
 *
 * <p>Subclasses mark the recovery policy: document and collection failures are
 * caught by the stage that raised them and counted, invariant violations are
 * fatal unless the merge stage downgrades them.</p>
 */
public class KnowledgeExtractionException extends RuntimeException {

    public KnowledgeExtractionException(String message) {
        super(message);
    }

    public KnowledgeExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
