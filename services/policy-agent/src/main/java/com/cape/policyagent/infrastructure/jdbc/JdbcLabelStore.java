package com.cape.policyagent.infrastructure.jdbc;

import com.cape.label.model.SecurityGroup;
import com.cape.label.model.SecurityLevel;
import com.cape.label.model.SecurityObject;
import com.cape.label.model.Token;
import com.cape.label.model.TokenSet;
import com.cape.label.store.LabelStore;
import com.cape.label.store.PageRequest;
import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * {@link LabelStore} over the relational schema shipped in {@code cape-database}.
 *
 * <p>Every insert that can hit a unique key runs in a nested transaction. On PostgreSQL a failed
 * statement aborts the whole transaction, so the insert is isolated behind a savepoint: a {@link
 * DuplicateKeyException} rolls back to the savepoint and the method returns {@link
 * Optional#empty()} while the caller's transaction stays usable.
 *
 * <p>Other constraint violations (foreign keys) are not caught and surface as Spring {@code
 * DataIntegrityViolationException}.
 */
public class JdbcLabelStore implements LabelStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcLabelStore.class);

    private static final RowMapper<SecurityGroup> GROUP_MAPPER =
            (rs, rowNum) ->
                    new SecurityGroup(
                            rs.getLong("id"), rs.getString("name"), rs.getLong("token_set_id"));

    private static final RowMapper<SecurityObject> OBJECT_MAPPER =
            (rs, rowNum) ->
                    new SecurityObject(rs.getLong("id"), rs.getString("uuid"), rs.getLong("level_id"));

    private final JdbcTemplate jdbc;
    private final TransactionTemplate savepoint;

    public JdbcLabelStore(JdbcTemplate jdbc, PlatformTransactionManager transactionManager) {
        this.jdbc = Objects.requireNonNull(jdbc, "jdbc");
        this.savepoint = new TransactionTemplate(transactionManager);
        this.savepoint.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
    }

    // ── Tokens ──

    @Override
    public Optional<Token> findTokenByValue(String value) {
        return first(
                jdbc.query(
                        "SELECT id, token_value FROM token WHERE token_value = ?",
                        (rs, rowNum) -> new Token(rs.getLong("id"), rs.getString("token_value")),
                        value));
    }

    @Override
    public Optional<Long> insertToken(String value) {
        return insertIfAbsent(
                "token " + value,
                () -> insertReturningId("INSERT INTO token (token_value) VALUES (?)", value));
    }

    // ── Token-sets ──

    @Override
    public Optional<TokenSet> findTokenSet(long tokenSetId) {
        List<String> keys =
                jdbc.query(
                        "SELECT canonical_key FROM token_set WHERE id = ?",
                        (rs, rowNum) -> rs.getString("canonical_key"),
                        tokenSetId);
        if (keys.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new TokenSet(tokenSetId, keys.get(0), tokenIds(tokenSetId)));
    }

    @Override
    public Optional<Long> findTokenSetByCanonicalKey(String canonicalKey) {
        return first(
                jdbc.queryForList(
                        "SELECT id FROM token_set WHERE canonical_key = ?", Long.class, canonicalKey));
    }

    @Override
    public Optional<Long> insertCanonicalTokenSet(String canonicalKey) {
        return insertIfAbsent(
                "token-set " + canonicalKey,
                () ->
                        insertReturningId(
                                "INSERT INTO token_set (canonical_key) VALUES (?)", canonicalKey));
    }

    @Override
    public long insertTokenSet() {
        return insertReturningId("INSERT INTO token_set (canonical_key) VALUES (NULL)");
    }

    @Override
    public void clearCanonicalKey(long tokenSetId) {
        jdbc.update("UPDATE token_set SET canonical_key = NULL WHERE id = ?", tokenSetId);
    }

    @Override
    public Set<String> tokenSetValues(long tokenSetId) {
        return new LinkedHashSet<>(
                jdbc.queryForList(
                        "SELECT t.token_value FROM token t"
                                + " JOIN token_token_set tts ON tts.token_id = t.id"
                                + " WHERE tts.token_set_id = ? ORDER BY t.id",
                        String.class,
                        tokenSetId));
    }

    @Override
    public void linkTokens(long tokenSetId, Collection<Long> tokenIds) {
        Set<Long> missing = new LinkedHashSet<>(tokenIds);
        missing.removeAll(tokenIds(tokenSetId));
        batch(
                "INSERT INTO token_token_set (token_id, token_set_id) VALUES (?, ?)",
                missing,
                tokenSetId);
    }

    @Override
    public void unlinkTokens(long tokenSetId, Collection<Long> tokenIds) {
        batch(
                "DELETE FROM token_token_set WHERE token_id = ? AND token_set_id = ?",
                new LinkedHashSet<>(tokenIds),
                tokenSetId);
    }

    @Override
    public void unlinkAllTokens(long tokenSetId) {
        jdbc.update("DELETE FROM token_token_set WHERE token_set_id = ?", tokenSetId);
    }

    @Override
    public void deleteTokenSet(long tokenSetId) {
        jdbc.update("DELETE FROM token_set WHERE id = ?", tokenSetId);
    }

    @Override
    public boolean isTokenSetReferenced(long tokenSetId) {
        return count("SELECT COUNT(*) FROM security_level WHERE token_set_id = ?", tokenSetId) > 0
                || count("SELECT COUNT(*) FROM security_group WHERE token_set_id = ?", tokenSetId)
                        > 0;
    }

    // ── Groups ──

    @Override
    public Optional<SecurityGroup> findGroup(long groupId) {
        return first(
                jdbc.query(
                        "SELECT id, name, token_set_id FROM security_group WHERE id = ?",
                        GROUP_MAPPER,
                        groupId));
    }

    @Override
    public Optional<SecurityGroup> findGroupByName(String name) {
        return first(
                jdbc.query(
                        "SELECT id, name, token_set_id FROM security_group WHERE name = ?",
                        GROUP_MAPPER,
                        name));
    }

    @Override
    public Optional<Long> insertGroup(String name, long tokenSetId) {
        return insertIfAbsent(
                "group " + name,
                () ->
                        insertReturningId(
                                "INSERT INTO security_group (name, token_set_id) VALUES (?, ?)",
                                name,
                                tokenSetId));
    }

    @Override
    public void deleteGroup(long groupId) {
        jdbc.update("DELETE FROM security_group WHERE id = ?", groupId);
    }

    @Override
    public List<String> groupNames(PageRequest page) {
        return pagedList("SELECT name FROM security_group ORDER BY id", page);
    }

    // ── Levels ──

    @Override
    public Optional<SecurityLevel> findLevel(long levelId) {
        List<Long> tokenSets =
                jdbc.queryForList(
                        "SELECT token_set_id FROM security_level WHERE id = ?", Long.class, levelId);
        if (tokenSets.isEmpty()) {
            return Optional.empty();
        }
        List<Long> groupIds =
                jdbc.queryForList(
                        "SELECT security_group_id FROM security_level_group"
                                + " WHERE security_level_id = ? ORDER BY security_group_id",
                        Long.class,
                        levelId);
        return Optional.of(new SecurityLevel(levelId, tokenSets.get(0), groupIds));
    }

    @Override
    public Optional<Long> findLevelBySignature(String signature) {
        return first(
                jdbc.queryForList(
                        "SELECT id FROM security_level WHERE group_signature = ?",
                        Long.class,
                        signature));
    }

    @Override
    public Optional<Long> insertLevel(long tokenSetId, String signature) {
        return insertIfAbsent(
                "level " + signature,
                () ->
                        insertReturningId(
                                "INSERT INTO security_level (token_set_id, group_signature)"
                                        + " VALUES (?, ?)",
                                tokenSetId,
                                signature));
    }

    @Override
    public void linkGroups(long levelId, Collection<Long> groupIds) {
        Set<Long> missing = new LinkedHashSet<>(groupIds);
        missing.removeAll(
                jdbc.queryForList(
                        "SELECT security_group_id FROM security_level_group"
                                + " WHERE security_level_id = ?",
                        Long.class,
                        levelId));
        batch(
                "INSERT INTO security_level_group (security_group_id, security_level_id)"
                        + " VALUES (?, ?)",
                missing,
                levelId);
    }

    @Override
    public void unlinkAllGroups(long levelId) {
        jdbc.update("DELETE FROM security_level_group WHERE security_level_id = ?", levelId);
    }

    @Override
    public void deleteLevel(long levelId) {
        jdbc.update("DELETE FROM security_level WHERE id = ?", levelId);
    }

    // ── Objects ──

    @Override
    public Optional<SecurityObject> findObjectByUuid(String uuid) {
        return first(
                jdbc.query(
                        "SELECT id, uuid, level_id FROM security_object WHERE uuid = ?",
                        OBJECT_MAPPER,
                        uuid));
    }

    @Override
    public Optional<Long> insertObject(String uuid, long levelId) {
        return insertIfAbsent(
                "object " + uuid,
                () ->
                        insertReturningId(
                                "INSERT INTO security_object (uuid, level_id) VALUES (?, ?)",
                                uuid,
                                levelId));
    }

    @Override
    public void deleteObject(long objectId) {
        jdbc.update("DELETE FROM security_object WHERE id = ?", objectId);
    }

    @Override
    public List<String> objectUuids(PageRequest page) {
        return pagedList("SELECT uuid FROM security_object ORDER BY id", page);
    }

    // ── Private Helpers ──

    private Optional<Long> insertIfAbsent(String description, Supplier<Long> insert) {
        try {
            return Optional.ofNullable(savepoint.execute(status -> insert.get()));
        } catch (DuplicateKeyException e) {
            log.debug("Unique key already taken for {}", description);
            return Optional.empty();
        }
    }

    private long insertReturningId(String sql, Object... args) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbc.update(
                connection -> {
                    PreparedStatement ps = connection.prepareStatement(sql, new String[] {"id"});
                    for (int i = 0; i < args.length; i++) {
                        ps.setObject(i + 1, args[i]);
                    }
                    return ps;
                },
                keys);
        return Objects.requireNonNull(keys.getKey(), "generated id").longValue();
    }

    private Set<Long> tokenIds(long tokenSetId) {
        return new HashSet<>(
                jdbc.queryForList(
                        "SELECT token_id FROM token_token_set WHERE token_set_id = ?",
                        Long.class,
                        tokenSetId));
    }

    private void batch(String sql, Collection<Long> memberIds, long ownerId) {
        if (memberIds.isEmpty()) {
            return;
        }
        List<Object[]> rows = new ArrayList<>(memberIds.size());
        for (Long memberId : memberIds) {
            rows.add(new Object[] {memberId, ownerId});
        }
        jdbc.batchUpdate(sql, rows);
    }

    private long count(String sql, long id) {
        Long count = jdbc.queryForObject(sql, Long.class, id);
        return count == null ? 0 : count;
    }

    private List<String> pagedList(String sql, PageRequest page) {
        if (page.isLimited()) {
            return jdbc.queryForList(
                    sql + " LIMIT ? OFFSET ?", String.class, page.limit(), page.offset());
        }
        if (page.offset() > 0) {
            return jdbc.queryForList(sql + " OFFSET ? ROWS", String.class, page.offset());
        }
        return jdbc.queryForList(sql, String.class);
    }

    private static <T> Optional<T> first(List<T> rows) {
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }
}
