package com.cape.label.model;

import java.util.Set;

/**
 * A stored set of tokens.
 *
 * <p>Sets created through the canonicalizer carry a {@code canonicalKey} derived from their sorted
 * membership. Group-owned sets, and canonical sets that have since been mutated in place, have no
 * key and are never returned by a canonical lookup.
 *
 * @param id token-set identifier
 * @param canonicalKey membership signature, or {@code null} for non-canonical sets
 * @param tokenIds ids of the member tokens
 */
public record TokenSet(long id, String canonicalKey, Set<Long> tokenIds) {

    public TokenSet {
        tokenIds = tokenIds == null ? Set.of() : Set.copyOf(tokenIds);
    }

    public boolean isCanonical() {
        return canonicalKey != null;
    }
}
