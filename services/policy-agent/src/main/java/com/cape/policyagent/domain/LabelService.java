package com.cape.policyagent.domain;

import com.cape.label.LabelEngine;
import com.cape.label.model.SecurityGroup;
import com.cape.label.model.SecurityLevel;
import com.cape.label.model.SecurityObject;
import com.cape.label.store.PageRequest;
import com.cape.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Group and object flows of the policy agent.
 *
 * <p>Each public method is one database transaction around a sequence of {@link LabelEngine}
 * calls. Deleting an unknown group or object is a no-op; reading one fails with {@code
 * LabelNotFoundException}.
 */
@Service
@Transactional
public class LabelService {

    private static final Logger log = LoggerFactory.getLogger(LabelService.class);

    private final LabelEngine engine;
    private final Counter groupsUpserted;
    private final Counter groupsDeleted;
    private final Counter objectsCreated;
    private final Counter objectsDeleted;
    private final Timer effectiveTimer;

    public LabelService(LabelEngine engine, MetricFactory metrics) {
        this.engine = engine;
        this.groupsUpserted =
                metrics.counter("labels.groups.upserted", "Groups created or updated");
        this.groupsDeleted = metrics.counter("labels.groups.deleted", "Groups deleted");
        this.objectsCreated = metrics.counter("labels.objects.created", "Objects created");
        this.objectsDeleted = metrics.counter("labels.objects.deleted", "Objects deleted");
        this.effectiveTimer =
                metrics.timer(
                        "labels.effective.duration", "Time to compute a level's effective tokens");
    }

    // ── Groups ──

    @Transactional(readOnly = true)
    public List<String> groupNames(PageRequest page) {
        return engine.groupNames(page);
    }

    /** Creates the group, or replaces the token membership of an existing one. */
    public GroupLabels upsertGroup(String name, Collection<String> tokens) {
        Set<Long> tokenIds = engine.internTokens(tokens);
        long groupId = engine.createOrUpdateGroup(name, tokenIds);
        groupsUpserted.increment();
        log.debug("Group '{}' now holds {} token(s)", name, tokenIds.size());
        return new GroupLabels(name, sorted(engine.groupValues(groupId)));
    }

    @Transactional(readOnly = true)
    public GroupLabels group(String name) {
        SecurityGroup group = engine.requireGroup(name);
        return new GroupLabels(name, sorted(engine.groupValues(group.id())));
    }

    @Transactional(readOnly = true)
    public List<Long> groupTokenIds(String name) {
        return sorted(engine.groupIds(engine.requireGroup(name).id()));
    }

    public void deleteGroup(String name) {
        Optional<SecurityGroup> group = engine.findGroup(name);
        if (group.isEmpty()) {
            log.debug("Group '{}' does not exist, nothing to delete", name);
            return;
        }
        engine.deleteGroup(group.get().id());
        groupsDeleted.increment();
        log.info("Deleted group '{}'", name);
    }

    // ── Objects ──

    @Transactional(readOnly = true)
    public List<String> objectUuids(PageRequest page) {
        return engine.objectUuids(page);
    }

    /**
     * Labels a new object with the level composed from {@code tokens} and the named groups.
     *
     * @param uuid requested identifier, or {@code null} to generate one
     * @throws com.cape.label.LabelNotFoundException if a group name is unknown
     * @throws com.cape.label.IdentifierConflictException if {@code uuid} is already assigned
     */
    public ObjectLabels createObject(String uuid, Collection<String> tokens, Collection<String> groups) {
        Set<Long> groupIds = new LinkedHashSet<>();
        for (String groupName : groups) {
            groupIds.add(engine.requireGroup(groupName).id());
        }
        long tokenSetId = engine.getOrCreateTokenSet(engine.internTokens(tokens));
        long levelId = engine.getOrCreateLevel(tokenSetId, groupIds);
        String assigned = engine.createObject(levelId, uuid);
        objectsCreated.increment();
        log.debug("Created object {} at level {}", assigned, levelId);
        SecurityLevel level = level(levelId);
        return new ObjectLabels(
                assigned, sorted(engine.tokenSetValues(level.tokenSetId())), groupNames(level));
    }

    /** The object's effective token values together with the names of its level's groups. */
    @Transactional(readOnly = true)
    public ObjectLabels object(String uuid) {
        SecurityObject object = engine.requireObject(uuid);
        SecurityLevel level = level(object.levelId());
        List<String> tokens =
                effectiveTimer.record(() -> sorted(engine.effectiveValues(level.id())));
        return new ObjectLabels(object.uuid(), tokens, groupNames(level));
    }

    @Transactional(readOnly = true)
    public List<Long> effectiveTokenIds(String uuid) {
        long levelId = engine.requireObject(uuid).levelId();
        return effectiveTimer.record(() -> sorted(engine.effectiveIds(levelId)));
    }

    @Transactional(readOnly = true)
    public List<String> effectiveTokenValues(String uuid) {
        long levelId = engine.requireObject(uuid).levelId();
        return effectiveTimer.record(() -> sorted(engine.effectiveValues(levelId)));
    }

    public void deleteObject(String uuid) {
        if (engine.findObject(uuid).isEmpty()) {
            log.debug("Object {} does not exist, nothing to delete", uuid);
            return;
        }
        engine.deleteObject(uuid);
        objectsDeleted.increment();
        log.info("Deleted object {}", uuid);
    }

    // ── Private Helpers ──

    private SecurityLevel level(long levelId) {
        return engine.findLevel(levelId)
                .orElseThrow(() -> new IllegalStateException("level " + levelId + " is missing"));
    }

    private List<String> groupNames(SecurityLevel level) {
        List<String> names = new ArrayList<>();
        for (Long groupId : level.groupIds()) {
            engine.findGroup(groupId).map(SecurityGroup::name).ifPresent(names::add);
        }
        return sorted(names);
    }

    private static <T extends Comparable<T>> List<T> sorted(Collection<T> values) {
        return List.copyOf(new TreeSet<>(values));
    }
}
