package io.github.goodees.eventive;

/*-
 * #%L
 * eventive
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import io.github.goodees.eventive.TestEntities.Body;
import io.github.goodees.eventive.TestEntities.DatetimeBody;
import io.github.goodees.eventive.TestEntities.LegacyInitBody;
import io.github.goodees.eventive.TestEntities.State;
import io.github.goodees.eventive.TestEntities.TestClock;
import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.event.Entity;
import io.github.goodees.eventive.event.ReducerContractViolationException;
import io.github.goodees.eventive.plugin.CommitContext;
import io.github.goodees.eventive.plugin.CommitDecision;
import io.github.goodees.eventive.plugin.EventivePlugin;
import io.github.goodees.eventive.store.EventQuery;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.SnapshotQuery;
import io.github.goodees.eventive.store.SortOrder;
import io.github.goodees.eventive.store.inmemory.InMemoryEventStore;
import io.github.goodees.eventive.store.inmemory.InMemorySnapshotStore;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TestName;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static io.github.goodees.eventive.TestEntities.CURRENT_REVISION;
import static io.github.goodees.eventive.TestEntities.ENTITY;
import static io.github.goodees.eventive.TestEntities.at;
import static org.hamcrest.Matchers.containsString;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class EventiveRuntimeTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant T1 = T0.plusSeconds(60);
    private static final Instant T2 = T1.plusSeconds(60);

    @Rule
    public TestName testName = new TestName();

    private TestClock clock;
    private InMemoryEventStore<Body> store;
    private InMemorySnapshotStore<State> snapshots;
    private EventiveRuntime<Body, State> runtime;

    @Before
    public void setUp() {
        clock = new TestClock(T0);
        store = new InMemoryEventStore<>();
        snapshots = new InMemorySnapshotStore<>();
        runtime = runtime().build();
    }

    private EventiveRuntime.Builder<Body, State> runtime() {
        return EventiveRuntime.<Body, State>builder()
                .entityName(ENTITY)
                .reducer(TestEntities.reducer())
                .mapper(TestEntities.mapper())
                .initialState(State::empty)
                .eventStore(store)
                .eventLog(store)
                .currentRevision(CURRENT_REVISION)
                .clock(clock);
    }

    private String name() {
        return testName.getMethodName();
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    private static Throwable failureOf(CompletableFuture<?> future) throws Exception {
        try {
            future.get(5, TimeUnit.SECONDS);
            fail("Future should have failed");
            return null;
        } catch (ExecutionException e) {
            return e.getCause();
        }
    }

    private Entity<State> committed(String eventName, Instant datetime, String entityId) throws Exception {
        clock.set(datetime);
        PendingCommit<Body, State> pending = runtime.create(eventName, at(datetime), entityId);
        assertEquals(CommitOutcome.COMMITTED, await(pending.commit()));
        return pending.getEntity();
    }

    @Test
    public void create_projects_state_without_persisting() throws Exception {
        PendingCommit<Body, State> created = runtime.create("init", at(T0));

        Entity<State> entity = created.getEntity();
        assertEquals(new State(T0, T0), entity.getState());
        assertEquals(T0, entity.getCreatedAt());
        assertEquals(T0, entity.getUpdatedAt());
        assertEquals(ENTITY, entity.getEntityName());
        assertFalse(created.getPriorEntity().isPresent());
        assertFalse(await(runtime.findOne(entity.getEntityId())).isPresent());
        assertEquals(0, store.size());

        assertEquals(CommitOutcome.COMMITTED, await(created.commit()));

        Optional<Entity<State>> found = await(runtime.findOne(entity.getEntityId()));
        assertTrue(found.isPresent());
        assertEquals(entity, found.get());
    }

    @Test
    public void dispatch_folds_into_prior_state() throws Exception {
        PendingCommit<Body, State> created = runtime.create("init", at(T0));
        await(created.commit());

        clock.set(T1);
        PendingCommit<Body, State> updated = runtime.dispatch(created.getEntity(), "update", at(T1));
        String id = created.getEntity().getEntityId();

        assertEquals(new State(T0, T1), updated.getEntity().getState());
        assertEquals(T0, updated.getEntity().getCreatedAt());
        assertEquals(T1, updated.getEntity().getUpdatedAt());
        assertEquals(id, updated.getEntity().getEntityId());
        assertSame(created.getEntity(), updated.getPriorEntity().get());
        assertEquals(new State(T0, T0), await(runtime.findOne(id)).get().getState());

        await(updated.commit());

        Entity<State> found = await(runtime.findOne(id)).get();
        assertEquals(new State(T0, T1), found.getState());
        assertEquals(T0, found.getCreatedAt());
        assertEquals(T1, found.getUpdatedAt());
    }

    @Test
    public void create_stamps_new_event() {
        PendingCommit<Body, State> created = runtime.create("init", at(T0), name());

        DomainEvent<Body> event = created.getEvent();
        assertEquals(name(), event.getEntityId());
        assertEquals(name(), created.getEntity().getEntityId());
        assertEquals(ENTITY, event.getEntityName());
        assertEquals("init", event.getEventName());
        assertEquals(T0, event.getEventCreatedAt());
        assertEquals(Optional.of(CURRENT_REVISION), event.getRevision());
        assertNotEquals(event.getEventId(), event.getEntityId());
        assertNotEquals(event.getEventId(), runtime.create("init", at(T0), name()).getEvent().getEventId());
    }

    @Test
    public void generated_ids_come_from_id_generator() {
        AtomicInteger sequence = new AtomicInteger();
        runtime = runtime().idGenerator(() -> "id-" + sequence.incrementAndGet()).build();

        PendingCommit<Body, State> created = runtime.create("init", at(T0));

        assertEquals("id-1", created.getEntity().getEntityId());
        assertEquals("id-2", created.getEvent().getEventId());
    }

    @Test
    public void find_one_is_idempotent() throws Exception {
        Entity<State> entity = committed("init", T0, name());

        assertEquals(await(runtime.findOne(entity.getEntityId())), await(runtime.findOne(entity.getEntityId())));
    }

    @Test
    public void find_by_ids_preserves_requested_order() throws Exception {
        committed("init", T0, "a");
        committed("init", T1, "b");

        assertEquals(Arrays.asList("a", "b"), ids(await(runtime.findByIds("a", "b"))));
        assertEquals(Arrays.asList("b", "a"), ids(await(runtime.findByIds("b", "a"))));
        assertEquals(Arrays.asList("b", "a"), ids(await(runtime.findByIds("missing", "b", "a", "b"))));
        assertTrue(await(runtime.findByIds(Collections.emptyList())).isEmpty());
    }

    @Test
    public void all_projects_every_aggregate() throws Exception {
        committed("init", T0, "a");
        committed("init", T1, "b");
        clock.set(T2);
        await(runtime.dispatch(await(runtime.findOne("a")).get(), "update", at(T2)).commit());

        List<Entity<State>> all = await(runtime.all());

        assertEquals(Arrays.asList("a", "b"), ids(all));
        assertEquals(new State(T0, T2), all.get(0).getState());
        assertEquals(new State(T1, T1), all.get(1).getState());
    }

    @Test
    public void all_with_query_folds_complete_streams() throws Exception {
        committed("init", T0, "a");
        committed("init", T1, "b");
        clock.set(T2);
        await(runtime.dispatch(await(runtime.findOne("b")).get(), "update", at(T2)).commit());

        List<Entity<State>> updated = await(runtime.all(EventQuery.builder().eventName("update").build()));

        assertEquals(Collections.singletonList("b"), ids(updated));
        assertEquals(new State(T1, T2), updated.get(0).getState());
        assertTrue(await(runtime.all(EventQuery.builder().eventName("closed").build())).isEmpty());
    }

    @Test
    public void query_events_returns_stored_events() throws Exception {
        committed("init", T0, "a");
        committed("init", T1, "b");

        List<DomainEvent<Body>> events = await(runtime.queryEvents(EventQuery.builder()
                .sortOrder(SortOrder.NEWEST_FIRST)
                .limit(1)
                .build()));

        assertEquals(1, events.size());
        assertEquals("b", events.get(0).getEntityId());
    }

    @Test
    public void older_revisions_are_mapped_before_folding() throws Exception {
        store.appendEvent(new DomainEvent<>("e1", "init", T0, ENTITY, name(), new LegacyInitBody(T0.toString()), "1"));
        store.appendEvent(new DomainEvent<>("e2", "update", T1, ENTITY, name(), at(T1), CURRENT_REVISION));

        Entity<State> entity = await(runtime.findOne(name())).get();

        assertEquals(new State(T0, T1), entity.getState());
        List<DomainEvent<Body>> raw = await(runtime.queryEvents(EventQuery.builder().entityId(name()).build()));
        assertTrue(raw.get(0).getBody() instanceof LegacyInitBody);
        assertEquals(Optional.of("1"), raw.get(0).getRevision());
    }

    @Test
    public void unhandled_event_fails_the_read() throws Exception {
        store.appendEvent(new DomainEvent<>("e1", "init", T0, ENTITY, name(), at(T0), null));
        store.appendEvent(new DomainEvent<>("e2", "renamed", T1, ENTITY, name(), at(T1), null));

        Throwable failure = failureOf(runtime.findOne(name()));

        assertTrue(failure instanceof ReducerContractViolationException);
        assertEquals("e2", ((ReducerContractViolationException) failure).getEvent().getEventId());
    }

    @Test
    public void aborted_commit_persists_nothing() throws Exception {
        List<String> committed = new ArrayList<>();
        runtime = runtime()
                .plugin(EventivePlugin.gate(ctx -> CommitDecision.ABORT))
                .plugin(EventivePlugin.listener(ctx -> committed.add(ctx.getEvent().getEventId())))
                .build();

        PendingCommit<Body, State> created = runtime.create("init", at(T0));

        assertEquals(CommitOutcome.ABORTED, await(created.commit()));
        assertEquals(0, store.size());
        assertTrue(committed.isEmpty());
        assertFalse(await(runtime.findOne(created.getEntity().getEntityId())).isPresent());
    }

    @Test
    public void abort_skips_remaining_hooks() throws Exception {
        List<String> calls = new ArrayList<>();
        runtime = runtime()
                .plugin(EventivePlugin.gate(ctx -> {
                    calls.add("first");
                    return CommitDecision.ABORT;
                }))
                .plugin(EventivePlugin.gate(ctx -> {
                    calls.add("second");
                    return CommitDecision.PROCEED;
                }))
                .build();

        await(runtime.create("init", at(T0)).commit());

        assertEquals(Collections.singletonList("first"), calls);
    }

    @Test
    public void hooks_run_in_registration_order() throws Exception {
        List<String> calls = new ArrayList<>();
        runtime = runtime().plugins(Arrays.asList(recording("1", calls), recording("2", calls))).build();

        await(runtime.create("init", at(T0)).commit());

        assertEquals(Arrays.asList("before:1", "before:2", "after:1", "after:2"), calls);
    }

    private static EventivePlugin<Body, State> recording(String name, List<String> calls) {
        return new EventivePlugin<Body, State>() {
            @Override
            public CompletableFuture<CommitDecision> beforeCommit(
                    CommitContext<Body, State> context) {
                calls.add("before:" + name);
                return CompletableFuture.completedFuture(CommitDecision.PROCEED);
            }

            @Override
            public CompletableFuture<Void> onCommitted(
                    CommitContext<Body, State> context) {
                calls.add("after:" + name);
                return CompletableFuture.completedFuture(null);
            }
        };
    }

    @Test
    public void hooks_receive_mapped_event_and_both_entities() throws Exception {
        List<CommitContext<Body, State>> contexts = new ArrayList<>();
        runtime = runtime().plugin(EventivePlugin.listener(contexts::add)).build();
        Entity<State> prior = committed("init", T0, name());
        clock.set(T1);
        PendingCommit<Body, State> updated = runtime.dispatch(prior, "update", at(T1));

        await(updated.commit());

        assertEquals(2, contexts.size());
        assertFalse(contexts.get(0).getPriorEntity().isPresent());
        assertEquals(updated.getEvent(), contexts.get(1).getEvent());
        assertEquals(updated.getEntity(), contexts.get(1).getEntity());
        assertEquals(prior, contexts.get(1).getPriorEntity().get());
    }

    @Test
    public void on_committed_fires_once_per_commit_after_append() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        List<Boolean> appendedBeforeHook = new ArrayList<>();
        runtime = runtime().plugin(EventivePlugin.listener(ctx -> {
            calls.incrementAndGet();
            appendedBeforeHook.add(store.findEventsByEntityIds(ENTITY,
                Collections.singletonList(ctx.getEvent().getEntityId())).contains(ctx.getEvent()));
        })).build();

        for (int i = 0; i < 3; i++) {
            await(runtime.create("init", at(T0)).commit());
            assertEquals(i + 1, calls.get());
        }

        assertEquals(Arrays.asList(true, true, true), appendedBeforeHook);
    }

    @Test
    public void asynchronous_hooks_are_awaited() throws Exception {
        CompletableFuture<CommitDecision> decision = new CompletableFuture<>();
        CompletableFuture<Void> notified = new CompletableFuture<>();
        runtime = runtime().plugin(new EventivePlugin<Body, State>() {
            @Override
            public CompletableFuture<CommitDecision> beforeCommit(
                    CommitContext<Body, State> context) {
                return decision;
            }

            @Override
            public CompletableFuture<Void> onCommitted(
                    CommitContext<Body, State> context) {
                return notified;
            }
        }).build();

        CompletableFuture<CommitOutcome> commit = runtime.create("init", at(T0)).commit();
        assertFalse(commit.isDone());
        assertEquals(0, store.size());

        decision.complete(CommitDecision.PROCEED);
        assertEquals(1, store.size());
        assertFalse(commit.isDone());

        notified.complete(null);
        assertEquals(CommitOutcome.COMMITTED, await(commit));
    }

    @Test
    public void failing_before_commit_hook_fails_commit() throws Exception {
        IllegalStateException failure = new IllegalStateException(name());
        runtime = runtime().plugin(EventivePlugin.gate(ctx -> {
            throw failure;
        })).build();

        assertSame(failure, failureOf(runtime.create("init", at(T0)).commit()));
        assertEquals(0, store.size());
    }

    @Test
    public void storage_failure_propagates_and_skips_on_committed() throws Exception {
        AtomicInteger notified = new AtomicInteger();
        runtime = runtime()
                .eventStore(event -> {
                    throw EventStoreException.storeFailed(event.getEntityId(), new IllegalStateException("down"));
                })
                .plugin(EventivePlugin.listener(ctx -> notified.incrementAndGet()))
                .build();

        Throwable failure = failureOf(runtime.create("init", at(T0)).commit());

        assertTrue(failure instanceof EventStoreException);
        assertEquals(EventStoreException.Fault.TX_ERROR, ((EventStoreException) failure).getFault());
        assertEquals(0, notified.get());
    }

    @Test
    public void snapshot_failure_leaves_event_appended() throws Exception {
        AtomicInteger notified = new AtomicInteger();
        runtime = runtime()
                .snapshotStore(new InMemorySnapshotStore<State>() {
                    @Override
                    public synchronized void upsertSnapshot(Entity<State> entity) {
                        throw new IllegalStateException("snapshot store down");
                    }
                })
                .plugin(EventivePlugin.listener(ctx -> notified.incrementAndGet()))
                .build();
        PendingCommit<Body, State> created = runtime.create("init", at(T0));

        assertTrue(failureOf(created.commit()) instanceof IllegalStateException);

        assertEquals(1, store.size());
        assertEquals(0, notified.get());
        assertEquals(created.getEntity(), await(runtime.findOne(created.getEntity().getEntityId())).get());
    }

    @Test
    public void committing_twice_fails_with_duplicate_event() throws Exception {
        PendingCommit<Body, State> created = runtime.create("init", at(T0));
        await(created.commit());

        Throwable failure = failureOf(created.commit());

        assertEquals(EventStoreException.Fault.DUPLICATE_EVENT, ((EventStoreException) failure).getFault());
        assertEquals(1, store.size());
    }

    @Test
    public void query_snapshots_requires_snapshot_store() {
        assertFalse(runtime.isSnapshotEnabled());
        try {
            runtime.querySnapshots(SnapshotQuery.all());
            fail("Snapshots are not enabled");
        } catch (SnapshotsNotEnabledException e) {
            assertTrue(e instanceof ConfigurationException);
        }
    }

    @Test
    public void query_snapshots_returns_committed_entity() throws Exception {
        runtime = runtime().snapshotStore(snapshots).build();
        committed("init", T0, "a");
        Entity<State> b = committed("init", T1, "b");

        List<Entity<State>> found = await(runtime.querySnapshots(SnapshotQuery.where("updatedDatetime",
            T1.toString())));

        assertEquals(Collections.singletonList(b), found);
        assertEquals(2, await(runtime.querySnapshots(SnapshotQuery.all())).size());
        assertEquals(1, await(runtime.querySnapshots(SnapshotQuery.builder().limit(1).build())).size());
    }

    @Test
    public void snapshots_are_only_an_index() throws Exception {
        runtime = runtime().snapshotStore(snapshots).build();
        Entity<State> entity = committed("init", T0, name());
        snapshots.upsertSnapshot(new Entity<>(name(), ENTITY, T0, T2, new State(T0, T2)));

        List<Entity<State>> found = await(runtime.querySnapshots(SnapshotQuery.where("updatedDatetime",
            T2.toString())));

        assertEquals(Collections.singletonList(entity), found);
    }

    @Test
    public void dispatch_rejects_entity_of_other_type() {
        Entity<State> foreign = new Entity<>(name(), "other", T0, T0, new State(T0, T0));
        try {
            runtime.dispatch(foreign, "update", at(T1));
            fail("Entity of other type should be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals(0, store.size());
        }
    }

    @Test
    public void commit_rejects_event_of_other_type() throws Exception {
        DomainEvent<Body> event = new DomainEvent<>("e1", "init", T0, "other", name(), at(T0), null);
        Entity<State> entity = new Entity<>(name(), "other", T0, T0, new State(T0, T0));

        Throwable failure = failureOf(runtime.commit(event, entity, null));

        assertEquals(EventStoreException.Fault.PROGRAMMATIC_ERROR, ((EventStoreException) failure).getFault());
    }

    @Test
    public void build_requires_reducer_and_stores() {
        try {
            EventiveRuntime.<Body, State>builder().entityName(ENTITY).initialState(State::empty).eventLog(store)
                    .eventStore(store).build();
            fail("Reducer is required");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("reducer"));
        }
        try {
            EventiveRuntime.<Body, State>builder().entityName(ENTITY).reducer(TestEntities.reducer())
                    .initialState(State::empty).eventLog(store).build();
            fail("Event store is required");
        } catch (IllegalStateException e) {
            assertThat(e.getMessage(), containsString("eventStore"));
        }
    }

    @Test
    public void store_io_runs_on_executor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, name()));
        List<String> threads = Collections.synchronizedList(new ArrayList<>());
        try {
            runtime = runtime().executor(executor)
                    .eventStore(event -> {
                        threads.add(Thread.currentThread().getName());
                        store.appendEvent(event);
                    })
                    .build();
            PendingCommit<Body, State> created = runtime.create("init", at(T0));

            assertEquals(CommitOutcome.COMMITTED, await(created.commit()));

            assertEquals(Collections.singletonList(name()), threads);
            assertEquals(created.getEntity(), await(runtime.findOne(created.getEntity().getEntityId())).get());
        } finally {
            executor.shutdown();
        }
    }

    private static List<String> ids(List<Entity<State>> entities) {
        List<String> ids = new ArrayList<>();
        entities.forEach(e -> ids.add(e.getEntityId()));
        return ids;
    }

    @Test
    public void plain_body_type_is_stored_as_given() throws Exception {
        Entity<State> entity = committed("init", T0, name());

        DomainEvent<Body> stored = store.findEventsByEntityIds(ENTITY, Collections.singletonList(name())).get(0);

        assertEquals(new DatetimeBody(T0), stored.getBody());
        assertEquals(entity.getUpdatedAt(), stored.getEventCreatedAt());
    }
}
