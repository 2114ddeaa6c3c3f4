package com.eainde.knowledge.exception;

/**
 * A structural invariant does not hold (dangling category dependency, hash
 * collision between incompatible payloads, out-of-range scoring constant).
 */
public class InvariantViolationException extends KnowledgeExtractionException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
