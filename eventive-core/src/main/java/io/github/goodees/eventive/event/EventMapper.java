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
 * Upgrades a stored event of any historical revision to the shape the reducer consumes.
 *
 * <p>The mapping must be total and pure. The runtime calls it once per event during folding, and once before the
 * event is handed to plugins. When the body shape of an event changes, the store must still be able to read the old
 * payload (see {@link io.github.goodees.eventive.store.Serialization}), and the mapper converts it to the current one.</p>
 *
 * @param <P> body supertype
 */
@FunctionalInterface
public interface EventMapper<P> {

    DomainEvent<P> map(DomainEvent<P> event);

    static <P> EventMapper<P> identity() {
        return event -> event;
    }
}
