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
import io.github.goodees.eventive.plugin.CommitContext;
import io.github.goodees.eventive.plugin.CommitDecision;
import io.github.goodees.eventive.plugin.EventivePlugin;
import io.github.goodees.eventive.store.EventStore;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Sequences the hooks and the writes of a commit. See {@link EventivePlugin} for the lifecycle.
 *
 * <p>The event append and the snapshot upsert are two independent writes. When the upsert fails, the event stays
 * appended and the snapshot of the aggregate is stale until its next successful commit; the failure is reported to
 * the caller and onCommitted hooks do not run.</p>
 *
 * @param <P> body supertype
 * @param <S> type of state
 */
class CommitPipeline<P, S> {
    private static final Logger logger = LoggerFactory.getLogger(CommitPipeline.class);

    private final ProjectionEngine<P, S> projection;
    private final EventStore<P> eventStore;
    private final SnapshotStore<S> snapshotStore;
    private final List<EventivePlugin<P, S>> plugins;
    private final Executor executor;

    CommitPipeline(ProjectionEngine<P, S> projection, EventStore<P> eventStore, SnapshotStore<S> snapshotStore,
            List<EventivePlugin<P, S>> plugins, Executor executor) {
        this.projection = projection;
        this.eventStore = eventStore;
        this.snapshotStore = snapshotStore;
        this.plugins = new ArrayList<>(plugins);
        this.executor = executor;
    }

    CompletableFuture<CommitOutcome> commit(DomainEvent<P> event, Entity<S> entity, Entity<S> priorEntity) {
        CommitContext<P, S> context;
        try {
            context = new CommitContext<>(projection.map(event), entity, priorEntity);
        } catch (RuntimeException e) {
            return AsyncResult.throwing(e);
        }
        return runBeforeCommit(context).thenCompose(decision -> {
            if (decision == CommitDecision.ABORT) {
                logger.info("{} Commit of event {} {} aborted", event.getEntityId(), event.getEventName(),
                    event.getEventId());
                return AsyncResult.returning(CommitOutcome.ABORTED);
            }
            return persist(event, entity)
                    .thenCompose(persisted -> runOnCommitted(context))
                    .thenApply(done -> CommitOutcome.COMMITTED);
        });
    }

    private AsyncResult<CommitDecision> runBeforeCommit(CommitContext<P, S> context) {
        AsyncResult<CommitDecision> decision = AsyncResult.returning(CommitDecision.PROCEED);
        for (EventivePlugin<P, S> plugin : plugins) {
            decision = decision.thenCompose(d -> {
                if (d == CommitDecision.ABORT) {
                    return AsyncResult.returning(CommitDecision.ABORT);
                }
                return AsyncResult.stage(() -> plugin.beforeCommit(context)).thenApply(this::proceedIfNull);
            });
        }
        return decision;
    }

    private CommitDecision proceedIfNull(CommitDecision decision) {
        return decision == null ? CommitDecision.PROCEED : decision;
    }

    private AsyncResult<Void> runOnCommitted(CommitContext<P, S> context) {
        AsyncResult<Void> chain = AsyncResult.returning(null);
        for (EventivePlugin<P, S> plugin : plugins) {
            chain = chain.thenCompose(v -> AsyncResult.stage(() -> plugin.onCommitted(context)));
        }
        return chain;
    }

    private AsyncResult<Void> persist(DomainEvent<P> event, Entity<S> entity) {
        return AsyncResult.invokeOn(executor, () -> {
            eventStore.appendEvent(event);
            logger.debug("{} Committed event {} {}", event.getEntityId(), event.getEventName(), event.getEventId());
            if (snapshotStore != null) {
                try {
                    snapshotStore.upsertSnapshot(entity);
                } catch (EventStoreException | RuntimeException e) {
                    logger.warn("{} Snapshot is stale, event {} was appended but snapshot failed", event.getEntityId(),
                        event.getEventId(), e);
                    throw e;
                }
            }
            return null;
        });
    }
}
