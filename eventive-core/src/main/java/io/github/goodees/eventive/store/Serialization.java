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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Conversion of event bodies or states into String payloads. Both event and snapshot stores use it to define
 * entity-specific conversions.
 *
 * <p>We expect that during lifetime of the project the body of an event changes. Whenever it changes in incompatible
 * manner, new events are written with a new revision and the serialization must keep reading the past revisions.
 * Upgrading an old body to the current shape is the job of {@link io.github.goodees.eventive.event.EventMapper},
 * serialization only needs to produce the object the old revision was written from.</p>
 *
 * @param <T> type of serialized object
 */
public interface Serialization<T> {

    /**
     * Serialize the object into a String payload.
     * @param object object to serialize
     * @return String serialization of the object
     * @throws IllegalArgumentException when the object cannot be serialized
     */
    String serialize(T object);

    /**
     * Deserialize a payload given its type and revision.
     * @param type event name, or <code>null</code> for untyped payloads such as states
     * @param revision revision the payload was written with, may be <code>null</code>
     * @param payload payload to deserialize
     * @return deserialized object, <code>null</code> for a serialized null or when the type and revision are not known
     * @throws IllegalArgumentException when the payload is malformed
     */
    T deserialize(String type, String revision, String payload);

    /**
     * Tell whether payloads of given type and revision can be deserialized. Stores use it to distinguish an unknown
     * event from an event whose body is null. Implementations returning <code>null</code> from
     * {@link #deserialize(String, String, String)} for unknown types need to override it.
     * @param type event name
     * @param revision revision the payload was written with, may be <code>null</code>
     * @return true if the type is known
     */
    default boolean supports(String type, String revision) {
        return true;
    }

    /**
     * Tree view of the object as used by {@link PropertyCondition}.
     * @param object object to convert
     * @return document tree
     */
    JsonNode toDocument(T object);

    /**
     * Tree view of a stored payload, for evaluating conditions without binding the payload to a type.
     * @param payload serialized form, as returned by {@link #serialize(Object)}
     * @return document tree
     * @throws IllegalArgumentException when the payload is malformed
     */
    default JsonNode parseDocument(String payload) {
        return toDocument(deserialize(null, null, payload));
    }
}
