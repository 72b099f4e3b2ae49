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
import java.util.Optional;

/**
 * Immutable fact about an aggregate that became true.
 *
 * <p>All events sharing an {@code entityId} form the event stream of one aggregate. Once appended to an event log an
 * event is never mutated or deleted; a mapper that upgrades an older revision creates a new instance via
 * {@link #withBody(Object)} and {@link #withRevision(String)}.</p>
 *
 * <p>{@code eventName} is the discriminant selecting the shape of the body, {@code revision} (when present) tags the
 * schema version the body was written with.</p>
 *
 * @param <P> common supertype of the event bodies of one aggregate type
 */
public final class DomainEvent<P> {
    private final String eventId;
    private final String eventName;
    private final Instant eventCreatedAt;
    private final String entityName;
    private final String entityId;
    private final P body;
    private final String revision;

    public DomainEvent(String eventId, String eventName, Instant eventCreatedAt, String entityName, String entityId,
            P body, String revision) {
        this.eventId = Objects.requireNonNull(eventId, "eventId");
        this.eventName = Objects.requireNonNull(eventName, "eventName");
        this.eventCreatedAt = Objects.requireNonNull(eventCreatedAt, "eventCreatedAt");
        this.entityName = Objects.requireNonNull(entityName, "entityName");
        this.entityId = Objects.requireNonNull(entityId, "entityId");
        this.body = body;
        this.revision = revision;
    }

    public String getEventId() {
        return eventId;
    }

    public String getEventName() {
        return eventName;
    }

    public Instant getEventCreatedAt() {
        return eventCreatedAt;
    }

    public String getEntityName() {
        return entityName;
    }

    public String getEntityId() {
        return entityId;
    }

    public P getBody() {
        return body;
    }

    /**
     * Schema version of the body.
     * @return revision tag, empty for events written without one
     */
    public Optional<String> getRevision() {
        return Optional.ofNullable(revision);
    }

    /**
     * Copy of this event carrying a different body. Identity and metadata are preserved.
     * @param newBody the body of the copy
     * @return new event
     */
    public DomainEvent<P> withBody(P newBody) {
        return new DomainEvent<>(eventId, eventName, eventCreatedAt, entityName, entityId, newBody, revision);
    }

    /**
     * Copy of this event tagged with a different revision.
     * @param newRevision revision of the copy, may be null
     * @return new event
     */
    public DomainEvent<P> withRevision(String newRevision) {
        return new DomainEvent<>(eventId, eventName, eventCreatedAt, entityName, entityId, body, newRevision);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        DomainEvent<?> that = (DomainEvent<?>) o;

        return eventId.equals(that.eventId)
                && eventName.equals(that.eventName)
                && eventCreatedAt.equals(that.eventCreatedAt)
                && entityName.equals(that.entityName)
                && entityId.equals(that.entityId)
                && Objects.equals(body, that.body)
                && Objects.equals(revision, that.revision);
    }

    @Override
    public int hashCode() {
        int result = eventId.hashCode();
        result = 31 * result + entityId.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "DomainEvent{" + "eventId=" + eventId + ", eventName=" + eventName + ", eventCreatedAt="
                + eventCreatedAt + ", entityName=" + entityName + ", entityId=" + entityId + ", revision=" + revision
                + ", body=" + body + '}';
    }
}
