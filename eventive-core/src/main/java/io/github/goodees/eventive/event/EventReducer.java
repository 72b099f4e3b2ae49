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

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;

/**
 * Reducer assembled from branches keyed by event name. Boilerplate-free alternative to a switch over
 * {@link DomainEvent#getEventName()}, that unlike a switch never falls through silently: an event no branch matches
 * raises {@link ReducerContractViolationException}, unless an explicit {@linkplain Builder#otherwise(Reducer) fallback}
 * was registered.
 *
 * <pre>{@code
 * Reducer<OrderState, OrderBody> reducer = EventReducer.<OrderState, OrderBody>builder()
 *         .on("placed", OrderPlaced.class, (state, placed) -> state.placed(placed.getItems()))
 *         .on("shipped", (state, event) -> state.shipped(event.getEventCreatedAt()))
 *         .build();
 * }</pre>
 *
 * The first matching branch wins.
 *
 * @param <S> type of state
 * @param <P> body supertype
 */
public class EventReducer<S, P> implements Reducer<S, P> {
    private final List<Branch<S, P>> branches;
    private final Reducer<S, P> fallback;

    private EventReducer(Builder<S, P> b) {
        this.branches = new ArrayList<>(b.branches);
        this.fallback = b.fallback;
    }

    @Override
    public S reduce(S state, DomainEvent<P> event) {
        for (Branch<S, P> branch : branches) {
            if (branch.matches(event)) {
                return branch.reducer.reduce(state, event);
            }
        }
        if (fallback != null) {
            return fallback.reduce(state, event);
        }
        throw new ReducerContractViolationException(event);
    }

    public static <S, P> Builder<S, P> builder() {
        return new Builder<>();
    }

    public static class Builder<S, P> {
        private final List<Branch<S, P>> branches = new ArrayList<>();
        private Reducer<S, P> fallback;

        /**
         * Handle events of given name.
         * @param eventName name to match
         * @param reducer reduction of the matching events
         * @return this builder
         */
        public Builder<S, P> on(String eventName, Reducer<S, P> reducer) {
            branches.add(new Branch<>(eventName, null, reducer));
            return this;
        }

        /**
         * Handle events of given name whose body is an instance of {@code bodyClass}. Useful when older revisions of
         * an event keep a distinct body class and are not upgraded by a mapper.
         * @param eventName name to match
         * @param bodyClass required class of the body
         * @param reducer reduction receiving the state and the cast body
         * @param <B> body type
         * @return this builder
         */
        public <B extends P> Builder<S, P> on(String eventName, Class<B> bodyClass, BiFunction<S, B, S> reducer) {
            Objects.requireNonNull(bodyClass, "Body class cannot be null");
            Objects.requireNonNull(reducer, "Reducer cannot be null");
            branches.add(new Branch<>(eventName, bodyClass,
                (state, event) -> reducer.apply(state, bodyClass.cast(event.getBody()))));
            return this;
        }

        /**
         * Reduction for events no branch handles. Without it such events fail the fold.
         * @param fallback the fallback reducer
         * @return this builder
         */
        public Builder<S, P> otherwise(Reducer<S, P> fallback) {
            this.fallback = fallback;
            return this;
        }

        public EventReducer<S, P> build() {
            return new EventReducer<>(this);
        }
    }

    private static class Branch<S, P> {
        private final String eventName;
        private final Class<?> bodyClass;
        private final Reducer<S, P> reducer;

        Branch(String eventName, Class<?> bodyClass, Reducer<S, P> reducer) {
            this.eventName = Objects.requireNonNull(eventName, "Event name cannot be null");
            this.bodyClass = bodyClass;
            this.reducer = Objects.requireNonNull(reducer, "Reducer cannot be null");
        }

        boolean matches(DomainEvent<P> event) {
            return eventName.equals(event.getEventName())
                    && (bodyClass == null || bodyClass.isInstance(event.getBody()));
        }
    }
}
