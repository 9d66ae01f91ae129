package com.cape.label.model;

/**
 * A named, mutable token-set shared by reference from any number of levels.
 *
 * <p>The {@code tokenSetId} never changes for the lifetime of the group; updates mutate the
 * membership of that set in place.
 *
 * @param id group identifier
 * @param name globally unique group name
 * @param tokenSetId the owned token-set
 */
public record SecurityGroup(long id, String name, long tokenSetId) {

    /** Longest accepted name, in characters. */
    public static final int MAX_NAME_LENGTH = 255;

    public SecurityGroup {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
    }
}
