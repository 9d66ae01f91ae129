package com.cape.policyagent.infrastructure.jdbc;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cape.database.migration.FlywayConfigProperties;
import com.cape.database.migration.LabelStoreFlywayConfig;
import com.cape.label.LabelEngine;
import com.cape.label.store.PageRequest;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/** Runs the JDBC label store against the migrated schema on H2 in PostgreSQL mode. */
@DisplayName("JdbcLabelStore")
class JdbcLabelStoreTest {

    private JdbcTemplate jdbc;
    private DataSourceTransactionManager txManager;
    private JdbcLabelStore store;
    private TransactionTemplate tx;

    @BeforeEach
    void setUp() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL(
                "jdbc:h2:mem:store-"
                        + System.nanoTime()
                        + ";MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE");
        new LabelStoreFlywayConfig()
                .labelStoreFlyway(dataSource, new FlywayConfigProperties(true, null, false));
        txManager = new DataSourceTransactionManager(dataSource);
        jdbc = new JdbcTemplate(dataSource);
        store = new JdbcLabelStore(jdbc, txManager);
        tx = new TransactionTemplate(txManager);
    }

    private <T> T inTx(Supplier<T> work) {
        return tx.execute(status -> work.get());
    }

    @Nested
    @DisplayName("insert-if-absent")
    class InsertIfAbsent {

        @Test
        @DisplayName("returns empty on a taken key and keeps the transaction usable")
        void duplicateKeepsTransactionUsable() {
            Optional<Long> again =
                    inTx(
                            () -> {
                                long first = store.insertToken("secret").orElseThrow();
                                Optional<Long> second = store.insertToken("secret");
                                assertThat(store.findTokenByValue("secret").orElseThrow().id())
                                        .isEqualTo(first);
                                store.insertToken("public").orElseThrow();
                                return second;
                            });

            assertThat(again).isEmpty();
            assertThat(inTx(() -> store.findTokenByValue("public"))).isPresent();
        }

        @Test
        @DisplayName("enforces unique canonical keys, group names, signatures and uuids")
        void uniqueKeys() {
            inTx(
                    () -> {
                        long set = store.insertCanonicalTokenSet("k1").orElseThrow();
                        assertThat(store.insertCanonicalTokenSet("k1")).isEmpty();
                        assertThat(store.insertGroup("ops", set)).isPresent();
                        assertThat(store.insertGroup("ops", set)).isEmpty();
                        long level = store.insertLevel(set, "t:" + set).orElseThrow();
                        assertThat(store.insertLevel(set, "t:" + set)).isEmpty();
                        assertThat(store.insertObject("obj-1", level)).isPresent();
                        assertThat(store.insertObject("obj-1", level)).isEmpty();
                        return null;
                    });
        }

        @Test
        @DisplayName("allows any number of sets without a canonical key")
        void keylessSets() {
            inTx(
                    () -> {
                        long a = store.insertTokenSet();
                        long b = store.insertTokenSet();
                        assertThat(a).isNotEqualTo(b);
                        assertThat(store.findTokenSet(a).orElseThrow().isCanonical()).isFalse();
                        return null;
                    });
        }
    }

    @Nested
    @DisplayName("token-set membership")
    class Membership {

        @Test
        @DisplayName("links tokens idempotently and unlinks selectively")
        void linkAndUnlink() {
            inTx(
                    () -> {
                        long a = store.insertToken("a").orElseThrow();
                        long b = store.insertToken("b").orElseThrow();
                        long set = store.insertTokenSet();

                        store.linkTokens(set, List.of(a, b));
                        store.linkTokens(set, List.of(a));
                        assertThat(store.findTokenSet(set).orElseThrow().tokenIds())
                                .containsExactlyInAnyOrder(a, b);
                        assertThat(store.tokenSetValues(set)).containsExactlyInAnyOrder("a", "b");

                        store.unlinkTokens(set, List.of(a));
                        assertThat(store.tokenSetValues(set)).containsExactly("b");

                        store.unlinkAllTokens(set);
                        store.deleteTokenSet(set);
                        assertThat(store.findTokenSet(set)).isEmpty();
                        return null;
                    });
        }

        @Test
        @DisplayName("clearing the canonical key frees it for a new set")
        void clearCanonicalKey() {
            inTx(
                    () -> {
                        long set = store.insertCanonicalTokenSet("k").orElseThrow();
                        store.clearCanonicalKey(set);

                        assertThat(store.findTokenSetByCanonicalKey("k")).isEmpty();
                        assertThat(store.insertCanonicalTokenSet("k")).isPresent();
                        return null;
                    });
        }

        @Test
        @DisplayName("reports references from groups and levels")
        void references() {
            inTx(
                    () -> {
                        long groupSet = store.insertTokenSet();
                        long levelSet = store.insertTokenSet();
                        long free = store.insertTokenSet();
                        store.insertGroup("g", groupSet).orElseThrow();
                        store.insertLevel(levelSet, "t:" + levelSet).orElseThrow();

                        assertThat(store.isTokenSetReferenced(groupSet)).isTrue();
                        assertThat(store.isTokenSetReferenced(levelSet)).isTrue();
                        assertThat(store.isTokenSetReferenced(free)).isFalse();
                        return null;
                    });
        }
    }

    @Nested
    @DisplayName("levels and objects")
    class LevelsAndObjects {

        @Test
        @DisplayName("keeps group links ascending and tolerates deleted groups")
        void groupLinks() {
            inTx(
                    () -> {
                        long set = store.insertTokenSet();
                        long g2 = store.insertGroup("g2", store.insertTokenSet()).orElseThrow();
                        long g1 = store.insertGroup("g1", store.insertTokenSet()).orElseThrow();
                        long level = store.insertLevel(set, "g:x").orElseThrow();

                        store.linkGroups(level, List.of(g2, g1));
                        store.linkGroups(level, List.of(g1));
                        store.deleteGroup(g1);

                        assertThat(store.findLevel(level).orElseThrow().groupIds())
                                .containsExactly(Math.min(g1, g2), Math.max(g1, g2));
                        assertThat(store.findLevelBySignature("g:x")).contains(level);
                        return null;
                    });
        }

        @Test
        @DisplayName("refuses to delete a level that objects still use")
        void levelInUse() {
            long level =
                    inTx(
                            () -> {
                                long set = store.insertTokenSet();
                                long id = store.insertLevel(set, "t:" + set).orElseThrow();
                                store.insertObject("obj", id).orElseThrow();
                                return id;
                            });

            assertThatThrownBy(
                            () ->
                                    inTx(
                                            () -> {
                                                store.deleteLevel(level);
                                                return null;
                                            }))
                    .isInstanceOf(DataIntegrityViolationException.class);
        }

        @Test
        @DisplayName("lists names and uuids in insertion order with paging")
        void paging() {
            inTx(
                    () -> {
                        long set = store.insertTokenSet();
                        long level = store.insertLevel(set, "t:" + set).orElseThrow();
                        for (String uuid : List.of("c", "a", "b")) {
                            store.insertObject(uuid, level).orElseThrow();
                        }
                        for (String name : List.of("zeta", "alpha")) {
                            store.insertGroup(name, store.insertTokenSet()).orElseThrow();
                        }

                        assertThat(store.objectUuids(PageRequest.unpaged()))
                                .containsExactly("c", "a", "b");
                        assertThat(store.objectUuids(PageRequest.of(2, 1)))
                                .containsExactly("a", "b");
                        assertThat(store.objectUuids(PageRequest.of(null, 2)))
                                .containsExactly("b");
                        assertThat(store.groupNames(PageRequest.of(1, null)))
                                .containsExactly("zeta");
                        return null;
                    });
        }
    }

    @Nested
    @DisplayName("concurrent writers")
    class ConcurrentWriters {

        private static final String LATE_WRITER = "late-writer";

        @Test
        @DisplayName("a writer whose insert loses to a committed row converges on it and commits")
        void lostInsertConverges() throws Exception {
            var lookedUp = new CountDownLatch(1);
            var winnerCommitted = new CountDownLatch(1);
            var racing =
                    new JdbcLabelStore(jdbc, txManager) {
                        @Override
                        public Optional<Long> insertToken(String value) {
                            if (LATE_WRITER.equals(Thread.currentThread().getName())) {
                                lookedUp.countDown();
                                await(winnerCommitted);
                            }
                            return super.insertToken(value);
                        }
                    };
            var engine = new LabelEngine(racing);
            var lateIds = new AtomicReference<List<Long>>();
            var lateFailure = new AtomicReference<Throwable>();

            Thread late =
                    new Thread(
                            () -> {
                                try {
                                    lateIds.set(
                                            inTx(
                                                    () ->
                                                            List.of(
                                                                    engine.internToken("shared"),
                                                                    engine.internToken("after"))));
                                } catch (Throwable e) {
                                    lateFailure.set(e);
                                }
                            },
                            LATE_WRITER);
            late.start();

            await(lookedUp);
            long winner = inTx(() -> engine.internToken("shared"));
            winnerCommitted.countDown();
            late.join(TimeUnit.SECONDS.toMillis(10));

            assertThat(lateFailure.get()).isNull();
            assertThat(lateIds.get()).first().isEqualTo(winner);
            assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM token", Integer.class))
                    .isEqualTo(2);
            assertThat(inTx(() -> store.findTokenByValue("after"))).isPresent();
        }

        private void await(CountDownLatch latch) {
            try {
                if (!latch.await(10, TimeUnit.SECONDS)) {
                    throw new IllegalStateException("timed out waiting for the other writer");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        }
    }

    @Test
    @DisplayName("drives the label engine end to end")
    void engineOverJdbc() {
        var engine = new LabelEngine(store);

        String uuid =
                inTx(
                        () -> {
                            long group =
                                    engine.createOrUpdateGroup(
                                            "ops", engine.internTokens(List.of("ops", "oncall")));
                            long set = engine.getOrCreateTokenSet(engine.internTokens(List.of("eu")));
                            long level = engine.getOrCreateLevel(set, Set.of(group));
                            return engine.createObject(level, "doc-1");
                        });

        Set<String> effective =
                inTx(() -> engine.effectiveValues(engine.requireObject(uuid).levelId()));
        assertThat(effective).containsExactlyInAnyOrder("eu", "ops", "oncall");

        inTx(
                () -> {
                    engine.createOrUpdateGroup("ops", engine.internTokens(List.of("ops")));
                    return null;
                });
        assertThat(inTx(() -> engine.effectiveValues(engine.requireObject(uuid).levelId())))
                .containsExactlyInAnyOrder("eu", "ops");
    }
}
