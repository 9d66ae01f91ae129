package com.cape.label;

import com.cape.label.model.SecurityGroup;
import com.cape.label.model.SecurityLevel;
import com.cape.label.model.SecurityObject;
import com.cape.label.store.LabelStore;
import com.cape.label.store.PageRequest;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Entry point of the label engine: the operations an API layer invokes against one {@link
 * LabelStore}.
 *
 * <p>A plain object with no framework annotations. The caller runs each operation inside one unit
 * of work of the store (a database transaction for JDBC stores).
 *
 * <p>Typical flow: intern token values, canonicalize the resulting ids into a token-set, resolve
 * groups by name, compose a level from both, then attach it to an object.
 */
public class LabelEngine {

    private final TokenInterner tokens;
    private final TokenSetCanonicalizer tokenSets;
    private final GroupRegistry groups;
    private final LevelComposer levels;
    private final ObjectStore objects;

    public LabelEngine(LabelStore store) {
        this(store, new ObjectStore(store));
    }

    /** Creates an engine whose generated object identifiers come from {@code uuidGenerator}. */
    public LabelEngine(LabelStore store, Supplier<String> uuidGenerator) {
        this(store, new ObjectStore(store, uuidGenerator));
    }

    private LabelEngine(LabelStore store, ObjectStore objects) {
        this.tokens = new TokenInterner(store);
        this.tokenSets = new TokenSetCanonicalizer(store);
        this.groups = new GroupRegistry(store, tokenSets);
        this.levels = new LevelComposer(store, tokenSets);
        this.objects = objects;
    }

    // ── Tokens and token-sets ──

    public long internToken(String value) {
        return tokens.intern(value);
    }

    public Set<Long> internTokens(Collection<String> values) {
        return tokens.internAll(values);
    }

    public long getOrCreateTokenSet(Collection<Long> tokenIds) {
        return tokenSets.getOrCreate(tokenIds);
    }

    public void updateTokenSet(long tokenSetId, Collection<Long> tokenIds) {
        tokenSets.update(tokenSetId, tokenIds);
    }

    public void deleteTokenSet(long tokenSetId) {
        tokenSets.delete(tokenSetId);
    }

    public Set<String> tokenSetValues(long tokenSetId) {
        return tokenSets.values(tokenSetId);
    }

    // ── Groups ──

    public long createOrUpdateGroup(String name, Collection<Long> tokenIds) {
        return groups.createOrUpdate(name, tokenIds);
    }

    public void deleteGroup(long groupId) {
        groups.delete(groupId);
    }

    public Optional<SecurityGroup> findGroup(String name) {
        return groups.findByName(name);
    }

    /**
     * Resolves a group by name.
     *
     * @throws LabelNotFoundException if no group has that name
     */
    public SecurityGroup requireGroup(String name) {
        return groups.findByName(name).orElseThrow(() -> new LabelNotFoundException("group", name));
    }

    public Optional<SecurityGroup> findGroup(long groupId) {
        return groups.find(groupId);
    }

    public Set<Long> groupIds(long groupId) {
        return groups.ids(groupId);
    }

    public Set<String> groupValues(long groupId) {
        return groups.values(groupId);
    }

    public List<String> groupNames(PageRequest page) {
        return groups.names(page);
    }

    // ── Levels ──

    public long getOrCreateLevel(long tokenSetId, Collection<Long> groupIds) {
        return levels.getOrCreate(tokenSetId, groupIds);
    }

    public void deleteLevel(long levelId) {
        levels.delete(levelId);
    }

    public Optional<SecurityLevel> findLevel(long levelId) {
        return levels.find(levelId);
    }

    public Set<Long> effectiveIds(long levelId) {
        return levels.ids(levelId);
    }

    public Set<String> effectiveValues(long levelId) {
        return levels.values(levelId);
    }

    // ── Objects ──

    /**
     * Creates an object at {@code levelId}.
     *
     * @param uuid requested identifier, or {@code null} to generate one
     * @return the identifier assigned to the object
     * @throws IdentifierConflictException if a supplied {@code uuid} is already assigned
     */
    public String createObject(long levelId, String uuid) {
        return objects.create(levelId, uuid).uuid();
    }

    /**
     * Deletes the object; its level, token-set and groups persist.
     *
     * @throws LabelNotFoundException if no object has that identifier
     */
    public void deleteObject(String uuid) {
        objects.delete(requireObject(uuid));
    }

    public Optional<SecurityObject> findObject(String uuid) {
        return objects.findByUuid(uuid);
    }

    /**
     * Resolves an object by identifier.
     *
     * @throws LabelNotFoundException if no object has that identifier
     */
    public SecurityObject requireObject(String uuid) {
        return objects.findByUuid(uuid).orElseThrow(() -> new LabelNotFoundException("object", uuid));
    }

    public List<String> objectUuids(PageRequest page) {
        return objects.uuids(page);
    }
}
