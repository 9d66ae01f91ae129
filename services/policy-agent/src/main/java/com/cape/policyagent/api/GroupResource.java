package com.cape.policyagent.api;

import com.cape.policyagent.domain.GroupLabels;
import java.util.List;

/** A group as returned by the API. */
public record GroupResource(String name, List<String> tokens) {

    static GroupResource from(GroupLabels group) {
        return new GroupResource(group.name(), group.tokens());
    }
}
