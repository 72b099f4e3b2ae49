package io.github.goodees.eventive.store.inmemory;

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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.store.EventLog;
import io.github.goodees.eventive.store.EventQuery;
import io.github.goodees.eventive.store.EventStore;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.JsonSerialization;
import io.github.goodees.eventive.store.PropertyCondition;
import io.github.goodees.eventive.store.Serialization;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static java.util.stream.Collectors.toList;

/**
 * Event log held in memory, in append order. Useful for tests and for embedding the runtime where durability is not
 * required. Body conditions of queries are evaluated on the JSON tree provided by serialization.
 */
public class InMemoryEventStore<P> implements EventStore<P>, EventLog<P> {
    private final List<DomainEvent<P>> log = new ArrayList<>();
    private final Set<String> eventIds = new HashSet<>();
    private final Serialization<P> serialization;

    public InMemoryEventStore() {
        this(JsonSerialization.writeOnly());
    }

    public InMemoryEventStore(Serialization<P> serialization) {
        this.serialization = serialization;
    }

    @Override
    public synchronized void appendEvent(DomainEvent<P> event) throws EventStoreException {
        if (!eventIds.add(event.getEventId())) {
            throw EventStoreException.duplicateEvent(event, null);
        }
        log.add(event);
    }

    @Override
    public synchronized List<DomainEvent<P>> findEvents(String entityName, EventQuery query) {
        Stream<DomainEvent<P>> stream = log.stream()
                .filter(e -> entityName.equals(e.getEntityName()))
                .filter(query::matchesMetadata);
        if (!query.getBodyConditions().isEmpty()) {
            stream = stream.filter(e -> matchesBody(e, query.getBodyConditions()));
        }
        List<DomainEvent<P>> sorted = query.getSortOrder().sort(stream.collect(toList()));
        if (query.getLimit().isPresent() && sorted.size() > query.getLimit().getAsInt()) {
            return new ArrayList<>(sorted.subList(0, query.getLimit().getAsInt()));
        }
        return sorted;
    }

    @Override
    public synchronized List<DomainEvent<P>> findEventsByEntityIds(String entityName, Collection<String> entityIds) {
        Set<String> ids = new HashSet<>(entityIds);
        return log.stream()
                .filter(e -> entityName.equals(e.getEntityName()) && ids.contains(e.getEntityId()))
                .collect(toList());
    }

    /**
     * Number of stored events of all entities.
     * @return size of the log
     */
    public synchronized int size() {
        return log.size();
    }

    private boolean matchesBody(DomainEvent<P> event, List<PropertyCondition> conditions) {
        JsonNode document = serialization.toDocument(event.getBody());
        return conditions.stream().allMatch(c -> c.matches(document));
    }
}
