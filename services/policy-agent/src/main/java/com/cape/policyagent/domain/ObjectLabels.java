package com.cape.policyagent.domain;

import java.util.List;

/**
 * An object's tokens and the names of its level's groups, both sorted. Groups deleted since the
 * level was composed are left out.
 *
 * <p>Right after creation {@code tokens} holds the level's own token values; on later reads it holds
 * the effective values, which add the tokens of every live group.
 *
 * @param uuid object identifier
 * @param tokens own token values on creation, effective token values on reads
 * @param groups names of the level's groups
 */
public record ObjectLabels(String uuid, List<String> tokens, List<String> groups) {

    public ObjectLabels {
        tokens = List.copyOf(tokens);
        groups = List.copyOf(groups);
    }
}
