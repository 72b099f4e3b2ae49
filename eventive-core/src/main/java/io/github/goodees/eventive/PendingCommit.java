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

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of a command: the new event and the projection it leads to, not persisted yet. The caller may inspect the
 * entity and then {@link #commit()} or drop it.
 *
 * @param <P> body supertype
 * @param <S> type of state
 */
public final class PendingCommit<P, S> {
    private final DomainEvent<P> event;
    private final Entity<S> entity;
    private final Entity<S> priorEntity;
    private final CommitPipeline<P, S> pipeline;

    PendingCommit(DomainEvent<P> event, Entity<S> entity, Entity<S> priorEntity, CommitPipeline<P, S> pipeline) {
        this.event = event;
        this.entity = entity;
        this.priorEntity = priorEntity;
        this.pipeline = pipeline;
    }

    public DomainEvent<P> getEvent() {
        return event;
    }

    public Entity<S> getEntity() {
        return entity;
    }

    public Optional<Entity<S>> getPriorEntity() {
        return Optional.ofNullable(priorEntity);
    }

    /**
     * Run hooks and persist the event. Committing the same instance again fails with
     * {@link io.github.goodees.eventive.store.EventStoreException.Fault#DUPLICATE_EVENT}, as the event is already
     * stored.
     * @return future outcome of the commit, failing with the exception of the store or of a hook
     */
    public CompletableFuture<CommitOutcome> commit() {
        return pipeline.commit(event, entity, priorEntity);
    }
}
