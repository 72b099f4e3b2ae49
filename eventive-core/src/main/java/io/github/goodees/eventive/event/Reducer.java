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

/**
 * Pure, deterministic fold of an event into state. Applied in ascending {@code eventCreatedAt} order, seeded with the
 * zero value of the state for the first event of an aggregate.
 *
 * <p>Implementations must handle every event name that can reach the aggregate. An event that is not handled is a
 * contract violation and must fail with {@link ReducerContractViolationException} rather than leave the state
 * unchanged. {@link EventReducer} enforces that.</p>
 *
 * @param <S> type of state
 * @param <P> body supertype
 */
@FunctionalInterface
public interface Reducer<S, P> {

    S reduce(S state, DomainEvent<P> event);
}
