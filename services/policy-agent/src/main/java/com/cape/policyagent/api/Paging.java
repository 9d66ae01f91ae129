package com.cape.policyagent.api;

import com.cape.label.store.PageRequest;
import com.cape.policyagent.config.PolicyAgentProperties;

/** Turns {@code limit}/{@code offset} query parameters into a {@link PageRequest}. */
final class Paging {

    private Paging() {}

    static PageRequest of(Integer limit, Integer offset, PolicyAgentProperties properties) {
        return PageRequest.of(limit != null ? limit : properties.defaultPageSize(), offset);
    }
}
