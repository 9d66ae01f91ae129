package com.cape.label;

import com.cape.label.model.TokenSet;
import com.cape.label.store.LabelStore;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Canonical store of token-sets: at most one canonical set per distinct membership.
 *
 * <p>Canonical sets are registered under {@link CanonicalSignature#of(Collection)} of their member
 * ids. {@link #update(long, Collection)} mutates a set in place and never merges it with another
 * set of equal membership; a canonical set that gets mutated loses its key so that later lookups
 * never hand out a set whose membership differs from the key.
 */
public class TokenSetCanonicalizer {

    private static final Logger log = LoggerFactory.getLogger(TokenSetCanonicalizer.class);

    private final LabelStore store;

    public TokenSetCanonicalizer(LabelStore store) {
        this.store = store;
    }

    /**
     * Returns the canonical set with exactly {@code tokenIds} as members, creating and linking it
     * when none exists. Presentation order and repeats in {@code tokenIds} are irrelevant.
     */
    public long getOrCreate(Collection<Long> tokenIds) {
        List<Long> members = CanonicalSignature.sortedDistinct(tokenIds);
        String key = CanonicalSignature.of(members);

        var existing = store.findTokenSetByCanonicalKey(key);
        if (existing.isPresent()) {
            return existing.get();
        }
        var inserted = store.insertCanonicalTokenSet(key);
        if (inserted.isPresent()) {
            store.linkTokens(inserted.get(), members);
            log.debug("Created token-set {} with {} token(s)", inserted.get(), members.size());
            return inserted.get();
        }
        return store.findTokenSetByCanonicalKey(key)
                .orElseThrow(() -> new IllegalStateException("token-set " + key + " vanished"));
    }

    /**
     * Creates a set with no canonical key, linked to {@code tokenIds}. Used for sets owned
     * exclusively by one group.
     */
    public long createOwned(Collection<Long> tokenIds) {
        long tokenSetId = store.insertTokenSet();
        store.linkTokens(tokenSetId, CanonicalSignature.sortedDistinct(tokenIds));
        return tokenSetId;
    }

    /**
     * Converges the membership of an existing set to {@code tokenIds}, keeping its id.
     *
     * @throws LabelPreconditionException if the set does not exist
     */
    public void update(long tokenSetId, Collection<Long> tokenIds) {
        TokenSet current = require(tokenSetId);
        Set<Long> target = new HashSet<>(CanonicalSignature.sortedDistinct(tokenIds));

        Set<Long> removed = new HashSet<>(current.tokenIds());
        removed.removeAll(target);
        Set<Long> added = new HashSet<>(target);
        added.removeAll(current.tokenIds());

        if (removed.isEmpty() && added.isEmpty()) {
            return;
        }
        if (!removed.isEmpty()) {
            store.unlinkTokens(tokenSetId, removed);
        }
        if (!added.isEmpty()) {
            store.linkTokens(tokenSetId, CanonicalSignature.sortedDistinct(added));
        }
        if (current.isCanonical()) {
            store.clearCanonicalKey(tokenSetId);
        }
        log.debug(
                "Updated token-set {}: +{} -{}", tokenSetId, added.size(), removed.size());
    }

    /**
     * Removes all membership links, then the set itself.
     *
     * @throws LabelPreconditionException if the set does not exist
     */
    public void delete(long tokenSetId) {
        require(tokenSetId);
        store.unlinkAllTokens(tokenSetId);
        store.deleteTokenSet(tokenSetId);
        log.debug("Deleted token-set {}", tokenSetId);
    }

    /** Token ids of the set. */
    public Set<Long> ids(long tokenSetId) {
        return require(tokenSetId).tokenIds();
    }

    /** Token values of the set. */
    public Set<String> values(long tokenSetId) {
        require(tokenSetId);
        return store.tokenSetValues(tokenSetId);
    }

    private TokenSet require(long tokenSetId) {
        return store.findTokenSet(tokenSetId)
                .orElseThrow(() -> new LabelPreconditionException("token-set", tokenSetId));
    }
}
