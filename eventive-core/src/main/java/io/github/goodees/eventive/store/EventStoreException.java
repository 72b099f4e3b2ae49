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
 * Failure of the underlying storage while appending, reading or snapshotting. The runtime never retries, the
 * exception reaches the caller unchanged as the cause of the failed future.
 */
public class EventStoreException extends Exception {
    private final Fault fault;

    public enum Fault {
        /** Storage could not complete the operation */
        TX_ERROR,
        /** An event with the same id is already in the log */
        DUPLICATE_EVENT,
        /** Payload could not be converted to or from its stored form */
        SERIALIZATION,
        PROGRAMMATIC_ERROR
    }

    protected EventStoreException(Fault type, String message, Throwable cause) {
        super(message, cause);
        this.fault = type;
    }

    public Fault getFault() {
        return fault;
    }

    public static EventStoreException storeFailed(String entityId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Store of entity " + entityId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException readFailed(String entityName, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Reading events of " + entityName + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException snapshotFailed(String entityId, Throwable cause) {
        return new EventStoreException(Fault.TX_ERROR,
            "Snapshot of entity " + entityId + " failed. " + cause.getMessage(), cause);
    }

    public static EventStoreException duplicateEvent(DomainEvent<?> event, Throwable cause) {
        return new EventStoreException(Fault.DUPLICATE_EVENT, "Event " + event.getEventId() + " of entity "
                + event.getEntityId() + " is already stored", cause);
    }

    public static EventStoreException unsupported(String entityId, String eventName, String revision) {
        return new EventStoreException(Fault.SERIALIZATION, "Unsupported event " + eventName + " revision "
                + revision + " of entity " + entityId, null);
    }

    public static EventStoreException serializationFailed(String entityId, Throwable cause) {
        return new EventStoreException(Fault.SERIALIZATION,
            "Payload of entity " + entityId + " could not be (de)serialized. " + cause.getMessage(), cause);
    }

    public static EventStoreException foreignEntity(String expectedEntityName, DomainEvent<?> violating) {
        return new EventStoreException(Fault.PROGRAMMATIC_ERROR, "Event " + violating.getEventId() + " belongs to "
                + violating.getEntityName() + ", expected " + expectedEntityName, null);
    }
}
