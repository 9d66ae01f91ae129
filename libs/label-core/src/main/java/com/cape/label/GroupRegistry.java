package com.cape.label;

import com.cape.label.model.SecurityGroup;
import com.cape.label.store.LabelStore;
import com.cape.label.store.PageRequest;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Named, mutable groups of tokens.
 *
 * <p>Each group exclusively owns one token-set whose id is fixed for the group's lifetime. Updating
 * a group rewrites that set in place, so every level referencing the group sees the new membership
 * without being touched.
 */
public class GroupRegistry {

    private static final Logger log = LoggerFactory.getLogger(GroupRegistry.class);

    private final LabelStore store;
    private final TokenSetCanonicalizer tokenSets;

    public GroupRegistry(LabelStore store, TokenSetCanonicalizer tokenSets) {
        this.store = store;
        this.tokenSets = tokenSets;
    }

    /**
     * Creates the group {@code name} holding {@code tokenIds}, or converges an existing group's
     * membership to {@code tokenIds}. Idempotent.
     *
     * @return the group id, unchanged across updates
     */
    public long createOrUpdate(String name, Collection<Long> tokenIds) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("group name must not be null or blank");
        }
        if (name.length() > SecurityGroup.MAX_NAME_LENGTH) {
            throw new IllegalArgumentException(
                    "group name exceeds " + SecurityGroup.MAX_NAME_LENGTH + " characters");
        }
        var existing = store.findGroupByName(name);
        if (existing.isPresent()) {
            tokenSets.update(existing.get().tokenSetId(), tokenIds);
            return existing.get().id();
        }

        long tokenSetId = tokenSets.createOwned(tokenIds);
        var inserted = store.insertGroup(name, tokenSetId);
        if (inserted.isPresent()) {
            log.info("Created group '{}' ({}) with token-set {}", name, inserted.get(), tokenSetId);
            return inserted.get();
        }

        // another writer created the group first; drop our set and update theirs
        tokenSets.delete(tokenSetId);
        SecurityGroup winner =
                store.findGroupByName(name)
                        .orElseThrow(() -> new IllegalStateException("group '" + name + "' vanished"));
        tokenSets.update(winner.tokenSetId(), tokenIds);
        return winner.id();
    }

    /**
     * Deletes the group and its owned token-set. Level links that name the group are left in place
     * and contribute nothing to effective sets afterwards.
     *
     * @throws LabelPreconditionException if the group does not exist
     */
    public void delete(long groupId) {
        SecurityGroup group = require(groupId);
        store.deleteGroup(groupId);
        tokenSets.delete(group.tokenSetId());
        log.info("Deleted group '{}' ({})", group.name(), groupId);
    }

    public Optional<SecurityGroup> find(long groupId) {
        return store.findGroup(groupId);
    }

    public Optional<SecurityGroup> findByName(String name) {
        return store.findGroupByName(name);
    }

    /** Token ids currently in the group. */
    public Set<Long> ids(long groupId) {
        return tokenSets.ids(require(groupId).tokenSetId());
    }

    /** Token values currently in the group. */
    public Set<String> values(long groupId) {
        return tokenSets.values(require(groupId).tokenSetId());
    }

    public List<String> names(PageRequest page) {
        return store.groupNames(page);
    }

    private SecurityGroup require(long groupId) {
        return store.findGroup(groupId)
                .orElseThrow(() -> new LabelPreconditionException("group", groupId));
    }
}
