package com.cape.label.store;

import com.cape.label.model.SecurityGroup;
import com.cape.label.model.SecurityLevel;
import com.cape.label.model.SecurityObject;
import com.cape.label.model.Token;
import com.cape.label.model.TokenSet;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence boundary of the label engine.
 *
 * <p>Six relations (token, token-set, group, level, object, plus the two junctions) with unique
 * constraints on token value, token-set canonical key, group name, level signature and object uuid.
 * Every {@code insert*} method that can hit one of those constraints returns {@link
 * Optional#empty()} instead of failing when the row already exists, and leaves the enclosing unit
 * of work usable. Find-or-create callers re-read the winning row in that case.
 *
 * <p>Implementations do not open transactions; the caller owns the unit of work.
 */
public interface LabelStore {

    // ── Tokens ──

    Optional<Token> findTokenByValue(String value);

    /** Inserts a token, or returns empty when {@code value} is already taken. */
    Optional<Long> insertToken(String value);

    // ── Token-sets ──

    Optional<TokenSet> findTokenSet(long tokenSetId);

    Optional<Long> findTokenSetByCanonicalKey(String canonicalKey);

    /** Inserts an empty set registered under {@code canonicalKey}; empty when the key is taken. */
    Optional<Long> insertCanonicalTokenSet(String canonicalKey);

    /** Inserts an empty set with no canonical key. */
    long insertTokenSet();

    void clearCanonicalKey(long tokenSetId);

    Set<String> tokenSetValues(long tokenSetId);

    void linkTokens(long tokenSetId, Collection<Long> tokenIds);

    void unlinkTokens(long tokenSetId, Collection<Long> tokenIds);

    void unlinkAllTokens(long tokenSetId);

    void deleteTokenSet(long tokenSetId);

    /** True when any level or group still points at the token-set. */
    boolean isTokenSetReferenced(long tokenSetId);

    // ── Groups ──

    Optional<SecurityGroup> findGroup(long groupId);

    Optional<SecurityGroup> findGroupByName(String name);

    /** Inserts a group owning {@code tokenSetId}; empty when {@code name} is already taken. */
    Optional<Long> insertGroup(String name, long tokenSetId);

    void deleteGroup(long groupId);

    List<String> groupNames(PageRequest page);

    // ── Levels ──

    Optional<SecurityLevel> findLevel(long levelId);

    Optional<Long> findLevelBySignature(String signature);

    /** Inserts a level; empty when {@code signature} is already taken. */
    Optional<Long> insertLevel(long tokenSetId, String signature);

    void linkGroups(long levelId, Collection<Long> groupIds);

    void unlinkAllGroups(long levelId);

    void deleteLevel(long levelId);

    // ── Objects ──

    Optional<SecurityObject> findObjectByUuid(String uuid);

    /** Inserts an object; empty when {@code uuid} is already assigned. */
    Optional<Long> insertObject(String uuid, long levelId);

    void deleteObject(long objectId);

    List<String> objectUuids(PageRequest page);
}
