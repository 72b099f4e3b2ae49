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
import io.github.goodees.eventive.store.SortOrder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Folds events into entities. Pure computation over the events it is given, the engine performs no I/O.
 *
 * <p>Events of an aggregate are ordered ascending by {@code eventCreatedAt}, keeping the given order for equal
 * timestamps. Each event is mapped, then reduced, starting with a fresh initial state.</p>
 *
 * @param <P> body supertype
 * @param <S> type of state
 */
public class ProjectionEngine<P, S> {
    private static final Logger logger = LoggerFactory.getLogger(ProjectionEngine.class);

    private final Reducer<S, P> reducer;
    private final EventMapper<P> mapper;
    private final Supplier<S> initialState;

    public ProjectionEngine(Reducer<S, P> reducer, EventMapper<P> mapper, Supplier<S> initialState) {
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.initialState = Objects.requireNonNull(initialState, "initialState");
    }

    public DomainEvent<P> map(DomainEvent<P> event) {
        return mapper.map(event);
    }

    /**
     * Fold the event stream of a single aggregate.
     * @param events events of one aggregate, in store order
     * @return the projection, empty if there are no events
     */
    public Optional<Entity<S>> project(List<DomainEvent<P>> events) {
        if (events.isEmpty()) {
            return Optional.empty();
        }
        List<DomainEvent<P>> ordered = SortOrder.OLDEST_FIRST.sort(events);
        Instant createdAt = ordered.get(0).getEventCreatedAt();
        S state = initialState.get();
        DomainEvent<P> last = null;
        for (DomainEvent<P> event : ordered) {
            last = mapper.map(event);
            state = reducer.reduce(state, last);
        }
        logger.debug("{} Folded {} events", last.getEntityId(), ordered.size());
        return Optional.of(Entity.of(state, createdAt, last));
    }

    /**
     * Group events by aggregate and fold each group independently.
     * @param events events of any aggregates, in store order
     * @return projections in order of first appearance of their aggregate in {@code events}
     */
    public List<Entity<S>> projectAll(List<DomainEvent<P>> events) {
        Map<String, List<DomainEvent<P>>> streams = group(events);
        return projectStreams(streams, streams.keySet());
    }

    /**
     * Group events by aggregate and fold groups of listed aggregates.
     * @param events events of any aggregates, in store order
     * @param entityIds aggregates to project, defining the order of result
     * @return projections in order of {@code entityIds}, aggregates without events are omitted
     */
    public List<Entity<S>> projectAll(List<DomainEvent<P>> events, Collection<String> entityIds) {
        return projectStreams(group(events), entityIds);
    }

    /**
     * Fold a new event into prior projection, or into initial state when there is none.
     * @param prior projection the event applies to, null for new aggregate
     * @param event new event
     * @return new projection; creation time is taken from prior, or from the event when there is no prior
     */
    public Entity<S> apply(Entity<S> prior, DomainEvent<P> event) {
        DomainEvent<P> mapped = mapper.map(event);
        S state = reducer.reduce(prior == null ? initialState.get() : prior.getState(), mapped);
        Instant createdAt = prior == null ? mapped.getEventCreatedAt() : prior.getCreatedAt();
        return Entity.of(state, createdAt, mapped);
    }

    private Map<String, List<DomainEvent<P>>> group(List<DomainEvent<P>> events) {
        Map<String, List<DomainEvent<P>>> streams = new LinkedHashMap<>();
        for (DomainEvent<P> event : events) {
            streams.computeIfAbsent(event.getEntityId(), id -> new ArrayList<>()).add(event);
        }
        return streams;
    }

    private List<Entity<S>> projectStreams(Map<String, List<DomainEvent<P>>> streams, Collection<String> entityIds) {
        List<Entity<S>> result = new ArrayList<>();
        for (String entityId : entityIds) {
            List<DomainEvent<P>> stream = streams.get(entityId);
            if (stream != null) {
                project(stream).ifPresent(result::add);
            }
        }
        return result;
    }
}
