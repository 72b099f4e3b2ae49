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

import com.fasterxml.jackson.databind.JsonNode;
import io.github.goodees.eventive.event.Entity;
import io.github.goodees.eventive.store.JsonSerialization;
import io.github.goodees.eventive.store.Serialization;
import io.github.goodees.eventive.store.SnapshotQuery;
import io.github.goodees.eventive.store.SnapshotRef;
import io.github.goodees.eventive.store.SnapshotStore;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores snapshots in memory, in order of first insertion. An upsert replaces the document in place.
 */
public class InMemorySnapshotStore<S> implements SnapshotStore<S> {
    private final Map<String, Entity<S>> snapshots = new LinkedHashMap<>();
    private final Serialization<S> serialization;

    public InMemorySnapshotStore() {
        this(JsonSerialization.writeOnly());
    }

    public InMemorySnapshotStore(Serialization<S> serialization) {
        this.serialization = serialization;
    }

    @Override
    public synchronized void upsertSnapshot(Entity<S> entity) {
        snapshots.put(key(entity.getEntityName(), entity.getEntityId()), entity);
    }

    @Override
    public synchronized List<SnapshotRef> querySnapshotDocs(String entityName, SnapshotQuery query) {
        List<SnapshotRef> result = new ArrayList<>();
        for (Entity<S> entity : snapshots.values()) {
            if (query.getLimit().isPresent() && result.size() >= query.getLimit().getAsInt()) {
                break;
            }
            if (entityName.equals(entity.getEntityName()) && matches(entity, query)) {
                result.add(new SnapshotRef(entity.getEntityId(), entity.getUpdatedAt()));
            }
        }
        return result;
    }

    /**
     * Currently stored document of an entity.
     * @param entityName entity type
     * @param entityId entity id
     * @return the snapshotted entity
     */
    public synchronized Optional<Entity<S>> getSnapshot(String entityName, String entityId) {
        return Optional.ofNullable(snapshots.get(key(entityName, entityId)));
    }

    private boolean matches(Entity<S> entity, SnapshotQuery query) {
        if (query.getStateConditions().isEmpty()) {
            return true;
        }
        JsonNode document = serialization.toDocument(entity.getState());
        return query.getStateConditions().stream().allMatch(c -> c.matches(document));
    }

    private static String key(String entityName, String entityId) {
        return entityName + "/" + entityId;
    }
}
