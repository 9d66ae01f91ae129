package com.cape.label.model;

/**
 * An atomic label. Tokens have no meaning beyond whatever the policy author assigns to them.
 *
 * @param id stable identifier assigned on first intern
 * @param value globally unique label text
 */
public record Token(long id, String value) {

    /** Longest accepted value, in characters. */
    public static final int MAX_VALUE_LENGTH = 255;

    public Token {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("value must not be null or blank");
        }
    }
}
