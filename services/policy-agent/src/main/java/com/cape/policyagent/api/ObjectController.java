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

/**
 * Labelled objects.
 *
 * <p>{@code POST} echoes the level as written (own tokens and group names). {@code GET /{uuid}}
 * returns the effective token values, which add every token of the level's groups, next to the
 * group names; {@code /{uuid}/ids} and {@code /{uuid}/values} return the effective set alone.
 */
@RestController
@RequestMapping("/api/v1/object")
public class ObjectController {

    private final LabelService labels;
    private final PolicyAgentProperties properties;

    public ObjectController(LabelService labels, PolicyAgentProperties properties) {
        this.labels = labels;
        this.properties = properties;
    }

    @GetMapping
    public List<String> list(
            @RequestParam(required = false) Integer limit,
            @RequestParam(required = false) Integer offset) {
        return labels.objectUuids(Paging.of(limit, offset, properties));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public ObjectResource create(@Valid @RequestBody ObjectRequest request) {
        LevelResource level = request.level();
        return ObjectResource.from(
                labels.createObject(request.uuid(), level.tokens(), level.groups()));
    }

    @GetMapping("/{uuid}")
    public ObjectResource get(@PathVariable String uuid) {
        return ObjectResource.from(labels.object(uuid));
    }

    @GetMapping("/{uuid}/ids")
    public List<Long> ids(@PathVariable String uuid) {
        return labels.effectiveTokenIds(uuid);
    }

    @GetMapping("/{uuid}/values")
    public List<String> values(@PathVariable String uuid) {
        return labels.effectiveTokenValues(uuid);
    }

    @DeleteMapping("/{uuid}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String uuid) {
        labels.deleteObject(uuid);
    }
}
