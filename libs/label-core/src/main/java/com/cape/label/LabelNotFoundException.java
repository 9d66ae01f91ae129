package com.cape.label;

/**
 * Thrown when a lookup by unique key (group name, object uuid, token value) or by id finds no row.
 *
 * <p>Not retried. The API layer maps it to a 404-equivalent response.
 */
public class LabelNotFoundException extends RuntimeException {

    private final String entity;
    private final String key;

    public LabelNotFoundException(String entity, Object key) {
        super("%s '%s' not found".formatted(entity, key));
        this.entity = entity;
        this.key = String.valueOf(key);
    }

    public String entity() {
        return entity;
    }

    public String key() {
        return key;
    }
}
