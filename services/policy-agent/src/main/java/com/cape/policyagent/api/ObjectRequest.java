package com.cape.policyagent.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/v1/object}.
 *
 * @param uuid requested identifier; generated when absent
 * @param level the object's level
 */
public record ObjectRequest(
        @Size(min = 1, max = 255) String uuid, @NotNull @Valid LevelResource level) {}
