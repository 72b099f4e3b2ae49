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

import java.time.Instant;
import java.util.Objects;

/**
 * Reference to a stored snapshot document.
 */
public final class SnapshotRef {
    private final String entityId;
    private final Instant updatedAt;

    public SnapshotRef(String entityId, Instant updatedAt) {
        this.entityId = Objects.requireNonNull(entityId);
        this.updatedAt = updatedAt;
    }

    public String getEntityId() {
        return entityId;
    }

    /**
     * Timestamp of the last event the snapshot reflects.
     * @return the updatedAt of the snapshotted entity
     */
    public Instant getUpdatedAt() {
        return updatedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        SnapshotRef that = (SnapshotRef) o;
        return entityId.equals(that.entityId) && Objects.equals(updatedAt, that.updatedAt);
    }

    @Override
    public int hashCode() {
        return entityId.hashCode();
    }

    @Override
    public String toString() {
        return "SnapshotRef{" + "entityId=" + entityId + ", updatedAt=" + updatedAt + '}';
    }
}
