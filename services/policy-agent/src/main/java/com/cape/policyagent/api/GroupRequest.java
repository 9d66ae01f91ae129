package com.cape.policyagent.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Body of {@code POST /api/v1/group}.
 *
 * @param name group name
 * @param tokens token values of the group; missing means none
 */
public record GroupRequest(
        @NotBlank @Size(max = 255) String name, List<@NotBlank @Size(max = 255) String> tokens) {

    public GroupRequest {
        tokens = tokens == null ? List.of() : tokens;
    }
}
