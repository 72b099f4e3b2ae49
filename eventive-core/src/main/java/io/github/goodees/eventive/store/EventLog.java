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

import java.util.Collection;
import java.util.List;

/**
 * Reads persisted events. Usually implemented along with {@link EventStore}, so that every appended event is
 * visible to subsequent reads.
 *
 * <p>Events are returned as stored, i.e. before any mapping. Grouping by aggregate and ordering by
 * {@code eventCreatedAt} is the caller's job; the order in which an implementation returns events is the tie-break
 * for events of one aggregate with identical timestamps.</p>
 *
 * @param <P> body supertype
 */
public interface EventLog<P> {

    /**
     * Scan events of an entity type.
     * @param entityName aggregate type tag
     * @param query filter, sort and limit
     * @return matching events
     * @throws EventStoreException when storage cannot be read
     */
    List<DomainEvent<P>> findEvents(String entityName, EventQuery query) throws EventStoreException;

    /**
     * Fetch the events of several aggregates at once. No order across aggregates is guaranteed.
     * @param entityName aggregate type tag
     * @param entityIds aggregate ids
     * @return all events of listed aggregates
     * @throws EventStoreException when storage cannot be read
     */
    List<DomainEvent<P>> findEventsByEntityIds(String entityName, Collection<String> entityIds)
            throws EventStoreException;
}
