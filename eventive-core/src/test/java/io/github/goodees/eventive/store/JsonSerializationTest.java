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

import io.github.goodees.eventive.TestEntities;
import io.github.goodees.eventive.TestEntities.Body;
import io.github.goodees.eventive.TestEntities.DatetimeBody;
import io.github.goodees.eventive.TestEntities.LegacyInitBody;
import io.github.goodees.eventive.TestEntities.State;
import org.junit.Test;

import java.time.Instant;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class JsonSerializationTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final JsonSerialization<Body> serialization = TestEntities.bodySerialization();

    @Test
    public void dates_are_written_as_iso_strings() {
        assertEquals("{\"datetime\":\"2024-01-01T00:00:00Z\"}", serialization.serialize(new DatetimeBody(T0)));
    }

    @Test
    public void revision_selects_the_class() {
        String payload = "{\"timestamp\":\"2024-01-01T00:00:00Z\",\"datetime\":\"2024-01-01T00:00:00Z\"}";

        assertEquals(new LegacyInitBody("2024-01-01T00:00:00Z"), serialization.deserialize("init", "1", payload));
        assertEquals(new DatetimeBody(T0), serialization.deserialize("init", "2", payload));
        assertEquals(new DatetimeBody(T0), serialization.deserialize("init", null, payload));
    }

    @Test
    public void unknown_type_is_not_deserialized() {
        assertNull(serialization.deserialize("renamed", null, "{}"));
    }

    @Test
    public void null_body_is_told_apart_from_unknown_type() {
        String payload = serialization.serialize(null);

        assertEquals("null", payload);
        assertNull(serialization.deserialize("touch", null, payload));
        assertTrue(serialization.supports("touch", null));
        assertTrue(serialization.supports("init", "1"));
        assertFalse(serialization.supports("renamed", null));
    }

    @Test
    public void malformed_payload_is_rejected() {
        try {
            serialization.deserialize("init", null, "{datetime:");
            fail("Malformed payload should be rejected");
        } catch (IllegalArgumentException e) {
            assertEquals("Cannot deserialize init revision null", e.getMessage());
        }
    }

    @Test
    public void default_type_reads_untyped_payloads() {
        JsonSerialization<State> states = TestEntities.stateSerialization();
        State state = new State(T0, T0.plusSeconds(1));

        assertEquals(state, states.deserialize(null, null, states.serialize(state)));
        assertEquals("2024-01-01T00:00:01Z",
            states.parseDocument(states.serialize(state)).get("updatedDatetime").asText());
    }
}
