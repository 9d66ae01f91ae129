package com.cape.policyagent.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.cape.label.IdentifierConflictException;
import com.cape.label.LabelEngine;
import com.cape.label.LabelNotFoundException;
import com.cape.label.store.PageRequest;
import com.cape.label.testing.InMemoryLabelStore;
import com.cape.observability.MetricFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("LabelService")
class LabelServiceTest {

    private InMemoryLabelStore store;
    private SimpleMeterRegistry registry;
    private LabelService service;

    @BeforeEach
    void setUp() {
        store = new InMemoryLabelStore();
        registry = new SimpleMeterRegistry();
        service =
                new LabelService(new LabelEngine(store), new MetricFactory(registry, "policy-agent"));
    }

    private double count(String name) {
        return registry.get(name).tag("service", "policy-agent").counter().count();
    }

    @Nested
    @DisplayName("groups")
    class Groups {

        @Test
        @DisplayName("upsert returns the sorted token values")
        void upsert() {
            GroupLabels group = service.upsertGroup("ops", List.of("oncall", "admin", "oncall"));

            assertThat(group.name()).isEqualTo("ops");
            assertThat(group.tokens()).containsExactly("admin", "oncall");
            assertThat(count("labels.groups.upserted")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("upsert of an existing name replaces its tokens")
        void replace() {
            service.upsertGroup("ops", List.of("a", "b"));

            service.upsertGroup("ops", List.of("c"));

            assertThat(service.group("ops").tokens()).containsExactly("c");
            assertThat(service.groupNames(PageRequest.unpaged())).containsExactly("ops");
            assertThat(store.groupCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("token ids follow the interned values")
        void tokenIds() {
            service.upsertGroup("ops", List.of("a", "b"));

            assertThat(service.groupTokenIds("ops")).hasSize(2).isSorted();
        }

        @Test
        @DisplayName("reading an unknown group fails with not found")
        void unknown() {
            assertThatThrownBy(() -> service.group("nobody"))
                    .isInstanceOf(LabelNotFoundException.class);
            assertThatThrownBy(() -> service.groupTokenIds("nobody"))
                    .isInstanceOf(LabelNotFoundException.class);
        }

        @Test
        @DisplayName("deleting an unknown group is a no-op")
        void deleteUnknown() {
            service.deleteGroup("nobody");

            assertThat(count("labels.groups.deleted")).isZero();
        }

        @Test
        @DisplayName("delete removes the group and its token-set")
        void delete() {
            service.upsertGroup("ops", List.of("a"));

            service.deleteGroup("ops");

            assertThat(store.groupCount()).isZero();
            assertThat(store.tokenSetCount()).isZero();
            assertThat(count("labels.groups.deleted")).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("objects")
    class Objects {

        @Test
        @DisplayName("create composes the level and reports it as written")
        void create() {
            service.upsertGroup("ops", List.of("oncall"));

            ObjectLabels object =
                    service.createObject("doc-1", List.of("eu", "confidential"), List.of("ops"));

            assertThat(object.uuid()).isEqualTo("doc-1");
            assertThat(object.tokens()).containsExactly("confidential", "eu");
            assertThat(object.groups()).containsExactly("ops");
            assertThat(service.effectiveTokenValues("doc-1"))
                    .containsExactly("confidential", "eu", "oncall");
            assertThat(count("labels.objects.created")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("reading an object returns its effective tokens")
        void readReturnsEffectiveTokens() {
            service.upsertGroup("g", List.of("a"));

            ObjectLabels created = service.createObject("u1", List.of("b"), List.of("g"));
            ObjectLabels read = service.object("u1");

            assertThat(created.tokens()).containsExactly("b");
            assertThat(read.tokens()).containsExactly("a", "b");
            assertThat(read.groups()).containsExactly("g");
        }

        @Test
        @DisplayName("generates an identifier when none is given")
        void generatedUuid() {
            ObjectLabels object = service.createObject(null, List.of("eu"), List.of());

            assertThat(object.uuid()).isNotBlank();
            assertThat(service.objectUuids(PageRequest.unpaged())).containsExactly(object.uuid());
        }

        @Test
        @DisplayName("objects with the same labels share one level")
        void sharedLevel() {
            service.upsertGroup("ops", List.of("oncall"));

            service.createObject("a", List.of("eu"), List.of("ops"));
            service.createObject("b", List.of("eu"), List.of("ops"));

            assertThat(store.levelCount()).isEqualTo(1);
            assertThat(store.objectCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("an unknown group name fails before anything is written")
        void unknownGroup() {
            assertThatThrownBy(() -> service.createObject("a", List.of("eu"), List.of("ghost")))
                    .isInstanceOf(LabelNotFoundException.class);

            assertThat(store.tokenCount()).isZero();
            assertThat(store.objectCount()).isZero();
        }

        @Test
        @DisplayName("a caller-supplied identifier that is taken conflicts")
        void conflict() {
            service.createObject("a", List.of("eu"), List.of());

            assertThatThrownBy(() -> service.createObject("a", List.of("us"), List.of()))
                    .isInstanceOf(IdentifierConflictException.class);
        }

        @Test
        @DisplayName("effective tokens follow later group updates")
        void propagation() {
            service.upsertGroup("ops", List.of("oncall"));
            service.createObject("a", List.of("eu"), List.of("ops"));

            service.upsertGroup("ops", List.of("oncall", "pager"));

            assertThat(service.effectiveTokenValues("a")).containsExactly("eu", "oncall", "pager");
            assertThat(service.effectiveTokenIds("a")).hasSize(3);
            assertThat(service.object("a").tokens()).containsExactly("eu", "oncall", "pager");
        }

        @Test
        @DisplayName("a deleted group drops out of the object's view")
        void deletedGroup() {
            service.upsertGroup("ops", List.of("oncall"));
            service.createObject("a", List.of("eu"), List.of("ops"));

            service.deleteGroup("ops");

            assertThat(service.object("a").groups()).isEmpty();
            assertThat(service.effectiveTokenValues("a")).containsExactly("eu");
        }

        @Test
        @DisplayName("delete removes only the object and is a no-op when unknown")
        void delete() {
            service.createObject("a", List.of("eu"), List.of());

            service.deleteObject("a");
            service.deleteObject("a");

            assertThat(store.objectCount()).isZero();
            assertThat(store.levelCount()).isEqualTo(1);
            assertThat(count("labels.objects.deleted")).isEqualTo(1.0);
            assertThatThrownBy(() -> service.object("a")).isInstanceOf(LabelNotFoundException.class);
        }
    }
}
