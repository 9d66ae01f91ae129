package com.cape.label;

import com.cape.label.model.SecurityGroup;
import com.cape.label.model.SecurityLevel;
import com.cape.label.store.LabelStore;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.LongFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composes levels from a token-set and a set of groups.
 *
 * <p>Levels are deduplicated by their group set alone: a request whose groups match an existing
 * level returns that level even when it names a different token-set, and the token-set stored at
 * creation time stays in effect. A level with no groups is keyed by its token-set instead, so
 * group-less levels are shared per token-set.
 *
 * <p>Effective sets are computed on every call by walking the level's token-set and the token-set
 * of every linked group that still exists. Groups hold no groups, so the walk is one level deep.
 */
public class LevelComposer {

    private static final Logger log = LoggerFactory.getLogger(LevelComposer.class);

    static final String GROUP_KEY_PREFIX = "g:";
    static final String TOKEN_SET_KEY_PREFIX = "t:";

    private final LabelStore store;
    private final TokenSetCanonicalizer tokenSets;

    public LevelComposer(LabelStore store, TokenSetCanonicalizer tokenSets) {
        this.store = store;
        this.tokenSets = tokenSets;
    }

    /**
     * Returns the level matching {@code groupIds}, creating it with {@code tokenSetId} when no level
     * has that group set.
     */
    public long getOrCreate(long tokenSetId, Collection<Long> groupIds) {
        List<Long> groups = CanonicalSignature.sortedDistinct(groupIds);
        String signature = signature(tokenSetId, groups);

        var existing = store.findLevelBySignature(signature);
        if (existing.isPresent()) {
            return existing.get();
        }
        var inserted = store.insertLevel(tokenSetId, signature);
        if (inserted.isPresent()) {
            store.linkGroups(inserted.get(), groups);
            log.debug(
                    "Created level {} (token-set {}, groups {})", inserted.get(), tokenSetId, groups);
            return inserted.get();
        }
        return store.findLevelBySignature(signature)
                .orElseThrow(() -> new IllegalStateException("level " + signature + " vanished"));
    }

    public Optional<SecurityLevel> find(long levelId) {
        return store.findLevel(levelId);
    }

    /** Union of the level's own token ids and those of every linked group. */
    public Set<Long> ids(long levelId) {
        return effective(levelId, tokenSets::ids);
    }

    /** Union of the level's own token values and those of every linked group. */
    public Set<String> values(long levelId) {
        return effective(levelId, tokenSets::values);
    }

    /**
     * Deletes the level's group links and the level row, then its token-set unless another level
     * or a group still uses it. Linked groups are not touched.
     *
     * @throws LabelPreconditionException if the level does not exist
     */
    public void delete(long levelId) {
        SecurityLevel level = require(levelId);
        store.unlinkAllGroups(levelId);
        store.deleteLevel(levelId);
        if (store.isTokenSetReferenced(level.tokenSetId())) {
            log.debug("Kept shared token-set {} of level {}", level.tokenSetId(), levelId);
        } else {
            tokenSets.delete(level.tokenSetId());
        }
        log.info("Deleted level {}", levelId);
    }

    static String signature(long tokenSetId, List<Long> sortedGroupIds) {
        if (sortedGroupIds.isEmpty()) {
            return TOKEN_SET_KEY_PREFIX + tokenSetId;
        }
        return GROUP_KEY_PREFIX + CanonicalSignature.of(sortedGroupIds);
    }

    private <T> Set<T> effective(long levelId, LongFunction<Set<T>> members) {
        SecurityLevel level = require(levelId);
        Set<T> result = new HashSet<>(members.apply(level.tokenSetId()));
        for (long groupId : level.groupIds()) {
            store.findGroup(groupId)
                    .map(SecurityGroup::tokenSetId)
                    .ifPresent(tokenSetId -> result.addAll(members.apply(tokenSetId)));
        }
        return Set.copyOf(result);
    }

    private SecurityLevel require(long levelId) {
        return store.findLevel(levelId)
                .orElseThrow(() -> new LabelPreconditionException("level", levelId));
    }
}
