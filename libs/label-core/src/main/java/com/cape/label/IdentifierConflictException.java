package com.cape.label;

/**
 * Thrown when a caller-supplied object uuid is already assigned to a live object.
 *
 * <p>Generated uuids never surface this; they are regenerated until a free one is found.
 */
public class IdentifierConflictException extends RuntimeException {

    private final String uuid;

    public IdentifierConflictException(String uuid) {
        super("Object identifier '%s' is already assigned".formatted(uuid));
        this.uuid = uuid;
    }

    public String uuid() {
        return uuid;
    }
}
