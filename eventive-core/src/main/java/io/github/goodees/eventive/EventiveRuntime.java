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

import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.event.Entity;
import io.github.goodees.eventive.event.EventMapper;
import io.github.goodees.eventive.event.Reducer;
import io.github.goodees.eventive.plugin.EventivePlugin;
import io.github.goodees.eventive.store.EventLog;
import io.github.goodees.eventive.store.EventQuery;
import io.github.goodees.eventive.store.EventStore;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.SnapshotQuery;
import io.github.goodees.eventive.store.SnapshotRef;
import io.github.goodees.eventive.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Facade to the event-sourced entities of one type. It reads entities by replaying their events, produces new events
 * together with the projections they lead to, and commits them through the plugin hooks into the stores.
 *
 * <h2>Reads</h2>
 * Every read returns projections folded from the complete event stream of their aggregate, snapshots are only used as
 * an index by {@link #querySnapshots(SnapshotQuery)}. An aggregate without events does not exist; reads express that
 * by absence rather than failure.
 *
 * <h2>Commands</h2>
 * {@link #create(String, Object)} and {@link #dispatch(Entity, String, Object)} compute the new projection
 * synchronously and return a {@link PendingCommit}; nothing is persisted before it is committed. There is no version
 * check between a dispatch and its commit, concurrent commits to one aggregate all get appended.
 *
 * <p>All I/O against the stores runs on the configured executor, the calling thread by default. Exceptions of the
 * stores fail the returned futures and are never retried.</p>
 *
 * <pre>{@code
 * EventiveRuntime<Body, State> runtime = EventiveRuntime.<Body, State>builder()
 *         .entityName("order")
 *         .reducer(reducer)
 *         .initialState(State::new)
 *         .eventStore(store)
 *         .eventLog(store)
 *         .build();
 * PendingCommit<Body, State> created = runtime.create("placed", new Placed(items));
 * created.commit().get();
 * }</pre>
 *
 * @param <P> body supertype
 * @param <S> type of state
 */
public class EventiveRuntime<P, S> {
    private static final Logger logger = LoggerFactory.getLogger(EventiveRuntime.class);

    private final String entityName;
    private final EventLog<P> eventLog;
    private final SnapshotStore<S> snapshotStore;
    private final String currentRevision;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final Executor executor;
    private final ProjectionEngine<P, S> projection;
    private final CommitPipeline<P, S> pipeline;

    private EventiveRuntime(Builder<P, S> b) {
        this.entityName = b.entityName;
        this.eventLog = b.eventLog;
        this.snapshotStore = b.snapshotStore;
        this.currentRevision = b.currentRevision;
        this.idGenerator = b.idGenerator;
        this.clock = b.clock;
        this.executor = b.executor;
        this.projection = new ProjectionEngine<>(b.reducer, b.mapper, b.initialState);
        this.pipeline = new CommitPipeline<>(projection, b.eventStore, b.snapshotStore, b.plugins, b.executor);
    }

    public static <P, S> Builder<P, S> builder() {
        return new Builder<>();
    }

    public String getEntityName() {
        return entityName;
    }

    public boolean isSnapshotEnabled() {
        return snapshotStore != null;
    }

    /**
     * Replay an aggregate.
     * @param entityId aggregate id
     * @return future projection, empty when the aggregate has no events
     */
    public CompletableFuture<Optional<Entity<S>>> findOne(String entityId) {
        Objects.requireNonNull(entityId, "entityId");
        return AsyncResult.invokeOn(executor,
            () -> projection.project(eventLog.findEventsByEntityIds(entityName, Collections.singletonList(entityId))));
    }

    /**
     * Replay several aggregates, fetching their events at once.
     * @param entityIds aggregate ids, duplicates are ignored
     * @return future projections in order of {@code entityIds}, without aggregates that have no events
     */
    public CompletableFuture<List<Entity<S>>> findByIds(Collection<String> entityIds) {
        Set<String> ids = new LinkedHashSet<>(entityIds);
        if (ids.isEmpty()) {
            return AsyncResult.returning(new ArrayList<>());
        }
        return AsyncResult.invokeOn(executor, () -> fold(ids));
    }

    public CompletableFuture<List<Entity<S>>> findByIds(String... entityIds) {
        return findByIds(Arrays.asList(entityIds));
    }

    /**
     * Replay every aggregate of this entity type.
     * @return future projections in order of the first event of each aggregate in the log
     */
    public CompletableFuture<List<Entity<S>>> all() {
        return AsyncResult.invokeOn(executor,
            () -> projection.projectAll(eventLog.findEvents(entityName, EventQuery.all())));
    }

    /**
     * Replay every aggregate having an event matching the query. Projections are folded from the complete streams of
     * those aggregates, not only from the matching events.
     * @param query selection of events
     * @return future projections in order in which the query returned their first matching event
     */
    public CompletableFuture<List<Entity<S>>> all(EventQuery query) {
        Objects.requireNonNull(query, "query");
        return AsyncResult.invokeOn(executor, () -> {
            Set<String> ids = new LinkedHashSet<>();
            for (DomainEvent<P> event : eventLog.findEvents(entityName, query)) {
                ids.add(event.getEntityId());
            }
            return fold(ids);
        });
    }

    /**
     * Scan the event log.
     * @param query selection, order and limit of events
     * @return future events as stored, without mapping
     */
    public CompletableFuture<List<DomainEvent<P>>> queryEvents(EventQuery query) {
        Objects.requireNonNull(query, "query");
        return AsyncResult.invokeOn(executor, () -> eventLog.findEvents(entityName, query));
    }

    /**
     * Find aggregates by the state of their snapshots, and replay them.
     * @param query conditions on snapshot states
     * @return future projections in order of the snapshot store, folded from the event log
     * @throws SnapshotsNotEnabledException when the runtime has no snapshot store
     */
    public CompletableFuture<List<Entity<S>>> querySnapshots(SnapshotQuery query) {
        Objects.requireNonNull(query, "query");
        if (snapshotStore == null) {
            throw new SnapshotsNotEnabledException(entityName);
        }
        return AsyncResult.invokeOn(executor, () -> {
            Set<String> ids = new LinkedHashSet<>();
            for (SnapshotRef ref : snapshotStore.querySnapshotDocs(entityName, query)) {
                ids.add(ref.getEntityId());
            }
            return fold(ids);
        });
    }

    /**
     * Start a new aggregate with a generated id.
     * @param eventName name of the first event
     * @param body body of the first event
     * @return uncommitted event and projection
     */
    public PendingCommit<P, S> create(String eventName, P body) {
        return create(eventName, body, null);
    }

    /**
     * Start a new aggregate.
     * @param eventName name of the first event
     * @param body body of the first event
     * @param entityId id of the aggregate, or null to generate one
     * @return uncommitted event and projection
     */
    public PendingCommit<P, S> create(String eventName, P body, String entityId) {
        DomainEvent<P> event = newEvent(entityId == null ? idGenerator.nextId() : entityId, eventName, body);
        Entity<S> entity = projection.apply(null, event);
        logger.debug("{} Created by event {} {}", event.getEntityId(), eventName, event.getEventId());
        return new PendingCommit<>(event, entity, null, pipeline);
    }

    /**
     * Apply a new event to an existing projection.
     * @param prior projection the event applies to
     * @param eventName name of the event
     * @param body body of the event
     * @return uncommitted event and projection; creation time of the prior is preserved
     */
    public PendingCommit<P, S> dispatch(Entity<S> prior, String eventName, P body) {
        Objects.requireNonNull(prior, "prior");
        if (!entityName.equals(prior.getEntityName())) {
            throw new IllegalArgumentException("Entity " + prior.getEntityId() + " is " + prior.getEntityName()
                    + ", this runtime handles " + entityName);
        }
        DomainEvent<P> event = newEvent(prior.getEntityId(), eventName, body);
        Entity<S> entity = projection.apply(prior, event);
        logger.debug("{} Dispatched event {} {}", event.getEntityId(), eventName, event.getEventId());
        return new PendingCommit<>(event, entity, prior, pipeline);
    }

    /**
     * Commit an event outside of a {@link PendingCommit}.
     * @param event event to append
     * @param entity projection after the event
     * @param prior projection before the event, null for new aggregate
     * @return future outcome
     */
    public CompletableFuture<CommitOutcome> commit(DomainEvent<P> event, Entity<S> entity, Entity<S> prior) {
        Objects.requireNonNull(event, "event");
        Objects.requireNonNull(entity, "entity");
        if (!entityName.equals(event.getEntityName())) {
            return AsyncResult.throwing(EventStoreException.foreignEntity(entityName, event));
        }
        return pipeline.commit(event, entity, prior);
    }

    private DomainEvent<P> newEvent(String entityId, String eventName, P body) {
        Objects.requireNonNull(eventName, "eventName");
        return new DomainEvent<>(idGenerator.nextId(), eventName, clock.instant(), entityName, entityId, body,
                currentRevision);
    }

    private List<Entity<S>> fold(Set<String> ids) throws EventStoreException {
        if (ids.isEmpty()) {
            return new ArrayList<>();
        }
        return projection.projectAll(eventLog.findEventsByEntityIds(entityName, ids), ids);
    }

    public static class Builder<P, S> {
        private String entityName;
        private Reducer<S, P> reducer;
        private Supplier<S> initialState;
        private EventLog<P> eventLog;
        private EventStore<P> eventStore;
        private EventMapper<P> mapper = EventMapper.identity();
        private SnapshotStore<S> snapshotStore;
        private String currentRevision;
        private final List<EventivePlugin<P, S>> plugins = new ArrayList<>();
        private IdGenerator idGenerator = IdGenerator.uuid();
        private Clock clock = Clock.systemUTC();
        private Executor executor = Runnable::run;

        public Builder<P, S> entityName(String entityName) {
            this.entityName = entityName;
            return this;
        }

        public Builder<P, S> reducer(Reducer<S, P> reducer) {
            this.reducer = reducer;
            return this;
        }

        /**
         * Zero value of the state, the first event of every aggregate is reduced into a fresh one.
         * @param initialState supplier of initial state
         * @return this
         */
        public Builder<P, S> initialState(Supplier<S> initialState) {
            this.initialState = initialState;
            return this;
        }

        public Builder<P, S> eventLog(EventLog<P> eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        public Builder<P, S> eventStore(EventStore<P> eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        /**
         * Upgrade of historical event revisions. Identity unless set.
         * @param mapper the mapper
         * @return this
         */
        public Builder<P, S> mapper(EventMapper<P> mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /**
         * Enable snapshots. Every commit then upserts the snapshot of the aggregate, and
         * {@link EventiveRuntime#querySnapshots(SnapshotQuery)} becomes available.
         * @param snapshotStore the store
         * @return this
         */
        public Builder<P, S> snapshotStore(SnapshotStore<S> snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        /**
         * Revision stamped on new events.
         * @param currentRevision revision tag, null for none
         * @return this
         */
        public Builder<P, S> currentRevision(String currentRevision) {
            this.currentRevision = currentRevision;
            return this;
        }

        /**
         * Register a plugin. Hooks are called in order of registration.
         * @param plugin the plugin
         * @return this
         */
        public Builder<P, S> plugin(EventivePlugin<P, S> plugin) {
            this.plugins.add(Objects.requireNonNull(plugin, "plugin"));
            return this;
        }

        public Builder<P, S> plugins(List<? extends EventivePlugin<P, S>> plugins) {
            plugins.forEach(this::plugin);
            return this;
        }

        public Builder<P, S> idGenerator(IdGenerator idGenerator) {
            this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator");
            return this;
        }

        public Builder<P, S> clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /**
         * Executor for the I/O against stores.
         * @param executor the executor
         * @return this
         */
        public Builder<P, S> executor(Executor executor) {
            this.executor = Objects.requireNonNull(executor, "executor");
            return this;
        }

        public EventiveRuntime<P, S> build() {
            require(entityName, "entityName");
            require(reducer, "reducer");
            require(initialState, "initialState");
            require(eventLog, "eventLog");
            require(eventStore, "eventStore");
            return new EventiveRuntime<>(this);
        }

        private static void require(Object value, String option) {
            if (value == null) {
                throw new IllegalStateException("Runtime option " + option + " is not set");
            }
        }
    }
}
