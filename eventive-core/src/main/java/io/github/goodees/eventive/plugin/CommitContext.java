package io.github.goodees.eventive.plugin;

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

import java.util.Objects;
import java.util.Optional;

/**
 * Arguments passed to the hooks of one commit. All hooks of a commit receive the same instance.
 *
 * @param <P> body supertype
 * @param <S> type of state
 */
public final class CommitContext<P, S> {
    private final DomainEvent<P> event;
    private final Entity<S> entity;
    private final Entity<S> priorEntity;

    public CommitContext(DomainEvent<P> event, Entity<S> entity, Entity<S> priorEntity) {
        this.event = Objects.requireNonNull(event, "event");
        this.entity = Objects.requireNonNull(entity, "entity");
        this.priorEntity = priorEntity;
    }

    /**
     * The committed event, after mapping.
     * @return mapped event
     */
    public DomainEvent<P> getEvent() {
        return event;
    }

    /**
     * Projection after folding the event.
     * @return candidate entity
     */
    public Entity<S> getEntity() {
        return entity;
    }

    /**
     * Projection the event was dispatched against.
     * @return prior entity, empty for newly created aggregates
     */
    public Optional<Entity<S>> getPriorEntity() {
        return Optional.ofNullable(priorEntity);
    }

    @Override
    public String toString() {
        return "CommitContext{" + "event=" + event.getEventName() + ", eventId=" + event.getEventId() + ", entityId="
                + entity.getEntityId() + '}';
    }
}
