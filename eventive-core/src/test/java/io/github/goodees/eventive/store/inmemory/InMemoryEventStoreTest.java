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

import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.store.EventQuery;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.PropertyCondition;
import io.github.goodees.eventive.store.SortOrder;
import org.junit.Before;
import org.junit.Test;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static java.util.stream.Collectors.toList;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class InMemoryEventStoreTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private InMemoryEventStore<Map<String, Object>> store;

    private static DomainEvent<Map<String, Object>> event(String id, String entityName, String entityId, int seconds,
            int amount) {
        return new DomainEvent<>(id, "added", T0.plusSeconds(seconds), entityName, entityId,
                Collections.<String, Object>singletonMap("amount", amount), null);
    }

    private static List<String> ids(List<DomainEvent<Map<String, Object>>> events) {
        return events.stream().map(DomainEvent::getEventId).collect(toList());
    }

    @Before
    public void setUp() throws EventStoreException {
        store = new InMemoryEventStore<>();
        store.appendEvent(event("e1", "counter", "a", 2, 10));
        store.appendEvent(event("e2", "counter", "b", 1, 20));
        store.appendEvent(event("e3", "other", "a", 0, 10));
        store.appendEvent(event("e4", "counter", "a", 3, 30));
    }

    @Test
    public void duplicate_event_is_rejected() {
        try {
            store.appendEvent(event("e1", "counter", "c", 5, 1));
            fail("Duplicate should be rejected");
        } catch (EventStoreException e) {
            assertEquals(EventStoreException.Fault.DUPLICATE_EVENT, e.getFault());
            assertEquals(4, store.size());
        }
    }

    @Test
    public void natural_order_is_append_order() {
        assertEquals(Arrays.asList("e1", "e2", "e4"), ids(store.findEvents("counter", EventQuery.all())));
    }

    @Test
    public void events_are_sorted_and_limited() {
        assertEquals(Arrays.asList("e2", "e1", "e4"), ids(store.findEvents("counter",
            EventQuery.builder().sortOrder(SortOrder.OLDEST_FIRST).build())));
        assertEquals(Arrays.asList("e4", "e1"), ids(store.findEvents("counter",
            EventQuery.builder().sortOrder(SortOrder.NEWEST_FIRST).limit(2).build())));
    }

    @Test
    public void body_conditions_are_evaluated_on_json() {
        assertEquals(Collections.singletonList("e1"), ids(store.findEvents("counter",
            EventQuery.builder().addBodyCondition(PropertyCondition.equalTo("amount", 10)).build())));
    }

    @Test
    public void limit_applies_after_conditions() {
        assertEquals(Collections.singletonList("e4"), ids(store.findEvents("counter", EventQuery.builder()
                .addBodyCondition(PropertyCondition.equalTo("amount", 30)).limit(1).build())));
    }

    @Test
    public void events_of_listed_entities_are_found() {
        assertEquals(Arrays.asList("e1", "e4"), ids(store.findEventsByEntityIds("counter",
            Collections.singletonList("a"))));
        assertTrue(store.findEventsByEntityIds("counter", Collections.singletonList("z")).isEmpty());
    }
}
