package io.github.goodees.eventive.store;

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
import org.immutables.value.Value;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Filter, sort and limit of an event scan. All conditions must hold for an event to match; an empty query matches
 * every event of the entity type.
 *
 * <pre>{@code
 * EventQuery query = EventQuery.builder()
 *         .eventName("update")
 *         .addBodyCondition(PropertyCondition.equalTo("datetime", "2024-01-01T00:00:00Z"))
 *         .sortOrder(SortOrder.NEWEST_FIRST)
 *         .limit(10)
 *         .build();
 * }</pre>
 */
@Value.Immutable
@ValueStyle
public interface EventQuery {

    Optional<String> getEventName();

    Optional<String> getEntityId();

    Optional<String> getRevision();

    /**
     * Inclusive lower bound of eventCreatedAt.
     * @return lower bound
     */
    Optional<Instant> getCreatedFrom();

    /**
     * Inclusive upper bound of eventCreatedAt.
     * @return upper bound
     */
    Optional<Instant> getCreatedTo();

    List<PropertyCondition> getBodyConditions();

    @Value.Default
    default SortOrder getSortOrder() {
        return SortOrder.NATURAL;
    }

    OptionalInt getLimit();

    @Value.Check
    default void check() {
        if (getLimit().isPresent() && getLimit().getAsInt() <= 0) {
            throw new IllegalStateException("Limit must be positive, was " + getLimit().getAsInt());
        }
    }

    /**
     * Evaluate all conditions except the body conditions, which need the serialized form of the body.
     * @param event event to test
     * @return true if metadata of the event satisfies the query
     */
    default boolean matchesMetadata(DomainEvent<?> event) {
        return getEventName().map(event.getEventName()::equals).orElse(true)
                && getEntityId().map(event.getEntityId()::equals).orElse(true)
                && getRevision().map(r -> r.equals(event.getRevision().orElse(null))).orElse(true)
                && getCreatedFrom().map(from -> !event.getEventCreatedAt().isBefore(from)).orElse(true)
                && getCreatedTo().map(to -> !event.getEventCreatedAt().isAfter(to)).orElse(true);
    }

    static EventQuery all() {
        return builder().build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableEventQuery.Builder {

    }
}
