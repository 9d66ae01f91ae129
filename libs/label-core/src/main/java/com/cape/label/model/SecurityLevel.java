package com.cape.label.model;

import java.util.List;

/**
 * A composition of one token-set and an ordered set of groups.
 *
 * <p>{@code groupIds} is the link set recorded at creation time, ascending. It may name groups that
 * were deleted afterwards; such links are ignored when computing effective sets.
 *
 * @param id level identifier
 * @param tokenSetId the token-set the level was created with
 * @param groupIds linked group ids, ascending
 */
public record SecurityLevel(long id, long tokenSetId, List<Long> groupIds) {

    public SecurityLevel {
        groupIds = groupIds == null ? List.of() : List.copyOf(groupIds);
    }
}
