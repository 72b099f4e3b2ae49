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

import io.github.goodees.eventive.event.Entity;

import java.util.List;

/**
 * Best-effort cache of projections, one document per aggregate.
 *
 * <p>Snapshots are never authoritative. The runtime uses them only as a queryable index and resolves every hit back
 * into a projection by replaying the event log. A snapshot may therefore lag behind the log, e.g. when its upsert
 * failed after the event was appended, or when concurrent commits of one aggregate land in a different order.</p>
 *
 * @param <S> type of state
 */
public interface SnapshotStore<S> {

    /**
     * Insert or replace the document of {@link Entity#getEntityId()}.
     * @param entity projection to store
     * @throws EventStoreException when storage fails
     */
    void upsertSnapshot(Entity<S> entity) throws EventStoreException;

    /**
     * Query snapshot documents by their state.
     * @param entityName aggregate type tag
     * @param query conditions on the state and limit
     * @return references to matching documents, in store order
     * @throws EventStoreException when storage cannot be read
     */
    List<SnapshotRef> querySnapshotDocs(String entityName, SnapshotQuery query) throws EventStoreException;
}
