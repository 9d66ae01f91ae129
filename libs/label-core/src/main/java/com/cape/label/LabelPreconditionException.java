package com.cape.label;

/**
 * Thrown when an operation is invoked on an entity that was never persisted or is already gone,
 * e.g. deleting a token-set id the store does not know.
 *
 * <p>A misuse of the engine rather than a user error: fatal, never retried.
 */
public class LabelPreconditionException extends IllegalStateException {

    public LabelPreconditionException(String entity, long id) {
        super("%s %d does not exist".formatted(entity, id));
    }
}
