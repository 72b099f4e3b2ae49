package io.github.goodees.eventive.event;

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

import java.time.Instant;
import java.util.Objects;

/**
 * Projection of an aggregate: the state obtained by folding its events, with timestamps of the first and the last
 * folded event.
 *
 * <p>An entity is a value. Folding another event always yields a new instance, the previous one stays untouched.</p>
 *
 * @param <S> type of the state
 */
public final class Entity<S> {
    private final String entityId;
    private final String entityName;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final S state;

    public Entity(String entityId, String entityName, Instant createdAt, Instant updatedAt, S state) {
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.entityName = Objects.requireNonNull(entityName, "entityName");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.updatedAt = Objects.requireNonNull(updatedAt, "updatedAt");
        this.state = state;
    }

    /**
     * Create entity after folding {@code lastEvent}.
     * @param state state after the fold
     * @param createdAt timestamp of the first event of the aggregate
     * @param lastEvent most recently folded event, supplies identity and {@code updatedAt}
     * @param <S> type of state
     * @return new entity
     */
    public static <S> Entity<S> of(S state, Instant createdAt, DomainEvent<?> lastEvent) {
        return new Entity<>(lastEvent.getEntityId(), lastEvent.getEntityName(), createdAt,
            lastEvent.getEventCreatedAt(), state);
    }

    public String getEntityId() {
        return entityId;
    }

    public String getEntityName() {
        return entityName;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public S getState() {
        return state;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        Entity<?> that = (Entity<?>) o;

        return entityId.equals(that.entityId)
                && entityName.equals(that.entityName)
                && createdAt.equals(that.createdAt)
                && updatedAt.equals(that.updatedAt)
                && Objects.equals(state, that.state);
    }

    @Override
    public int hashCode() {
        int result = entityId.hashCode();
        result = 31 * result + updatedAt.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "Entity{" + "entityId=" + entityId + ", entityName=" + entityName + ", createdAt=" + createdAt
                + ", updatedAt=" + updatedAt + ", state=" + state + '}';
    }
}
