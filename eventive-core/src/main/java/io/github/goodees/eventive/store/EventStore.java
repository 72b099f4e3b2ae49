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

/**
 * Durable, append-only storage for events.
 *
 * <p>Appending an event constitutes a single non-distributed write uniquely keyed by
 * {@link DomainEvent#getEventId()}. A well-formed event for an aggregate is never rejected because of other events of
 * the same aggregate, there is no optimistic version check.</p>
 *
 * @param <P> body supertype
 * @see EventLog for the read side
 */
public interface EventStore<P> {

    /**
     * Persist an event synchronously. When the method returns, the event is durable and visible to
     * {@link EventLog} reads.
     * @param event event to store
     * @throws EventStoreException when storing fails, with {@link EventStoreException.Fault#DUPLICATE_EVENT} when
     *         the event id is already stored
     */
    void appendEvent(DomainEvent<P> event) throws EventStoreException;
}
