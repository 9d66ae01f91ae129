package com.cape.policyagent.api;

import com.cape.policyagent.config.PolicyAgentProperties;
import com.cape.policyagent.domain.LabelService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/** Security groups: named token-sets that levels include by reference. */
@RestController
@RequestMapping("/api/v1/group")
public class GroupController {

    private final LabelService labels;
    private final PolicyAgentProperties properties;

    public GroupController(LabelService labels, PolicyAgentProperties properties) {
        this.labels = labels;
        this.properties = properties;
    }

    @GetMapping
    public List<String> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return labels.groupNames(Paging.of(limit, offset, properties));
    }

    @PostMapping
    public GroupResource upsert(@Valid @RequestBody GroupRequest request) {
        return GroupResource.from(labels.upsertGroup(request.name(), request.tokens()));
    }

    @GetMapping("/{name}")
    public GroupResource get(@PathVariable String name) {
        return GroupResource.from(labels.group(name));
    }

    @GetMapping("/{name}/ids")
    public List<Long> ids(@PathVariable String name) {
        return labels.groupTokenIds(name);
    }

    @DeleteMapping("/{name}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String name) {
        labels.deleteGroup(name);
    }
}
