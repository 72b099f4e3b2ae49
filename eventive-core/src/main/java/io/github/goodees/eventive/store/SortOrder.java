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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Order of events returned by an event scan.
 */
public enum SortOrder {
    /** Whatever order the store returns events in */
    NATURAL,
    /** Ascending by eventCreatedAt, store order for equal timestamps */
    OLDEST_FIRST,
    /** Descending by eventCreatedAt, store order for equal timestamps */
    NEWEST_FIRST;

    /**
     * Sort events in this order. The sort is stable.
     * @param events events in store order
     * @param <P> body supertype
     * @return new sorted list
     */
    public <P> List<DomainEvent<P>> sort(List<DomainEvent<P>> events) {
        List<DomainEvent<P>> result = new ArrayList<>(events);
        Comparator<DomainEvent<P>> byTimestamp = Comparator.comparing(DomainEvent::getEventCreatedAt);
        switch (this) {
            case OLDEST_FIRST:
                result.sort(byTimestamp);
                break;
            case NEWEST_FIRST:
                result.sort(byTimestamp.reversed());
                break;
            default:
                break;
        }
        return result;
    }
}
