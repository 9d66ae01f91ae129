package com.cape.policyagent.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * A level given by its own token values and group names.
 *
 * @param tokens token values; missing means none
 * @param groups group names; missing means none
 */
public record LevelResource(
        List<@NotBlank @Size(max = 255) String> tokens,
        List<@NotBlank @Size(max = 255) String> groups) {

    public LevelResource {
        tokens = tokens == null ? List.of() : tokens;
        groups = groups == null ? List.of() : groups;
    }
}
