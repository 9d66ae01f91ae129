package com.cape.label.model;

/**
 * An identified resource carrying exactly one security level. Many objects may share a level.
 *
 * @param id object row identifier
 * @param uuid globally unique, caller-opaque identifier
 * @param levelId the level attached to the object
 */
public record SecurityObject(long id, String uuid, long levelId) {

    /** Longest accepted identifier, in characters. */
    public static final int MAX_UUID_LENGTH = 255;

    public SecurityObject {
        if (uuid == null || uuid.isBlank()) {
            throw new IllegalArgumentException("uuid must not be null or blank");
        }
    }
}
