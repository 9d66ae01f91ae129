package com.cape.policyagent.domain;

import java.util.List;

/**
 * A security group with its token values, sorted.
 *
 * @param name group name
 * @param tokens member token values
 */
public record GroupLabels(String name, List<String> tokens) {

    public GroupLabels {
        tokens = List.copyOf(tokens);
    }
}
