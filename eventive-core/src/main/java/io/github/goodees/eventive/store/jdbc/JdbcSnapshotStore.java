package io.github.goodees.eventive.store.jdbc;

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
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.Serialization;
import io.github.goodees.eventive.store.SnapshotQuery;
import io.github.goodees.eventive.store.SnapshotRef;
import io.github.goodees.eventive.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot store keeping serialized states in the snapshot table of a {@link JdbcSchema}. Conditions of snapshot
 * queries are evaluated on the documents parsed from stored states.
 *
 * @param <S> type of state
 */
public class JdbcSnapshotStore<S> implements SnapshotStore<S> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<S> serialization;

    public JdbcSnapshotStore(DataSource ds, JdbcSchema schema, Serialization<S> serialization) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = Objects.requireNonNull(serialization);
    }

    @Override
    public void upsertSnapshot(Entity<S> entity) throws EventStoreException {
        String entityId = entity.getEntityId();
        String state;
        try {
            state = serialization.serialize(entity.getState());
        } catch (IllegalArgumentException e) {
            throw EventStoreException.serializationFailed(entityId, e);
        }
        try (Connection connection = ds.getConnection()) {
            int result = exists(connection, entity)
                    ? update(connection, entity, state)
                    : insertOrUpdate(connection, entity, state);
            if (result != 1) {
                throw EventStoreException.snapshotFailed(entityId,
                    new SQLException("Snapshot upsert affected " + result + " rows"));
            }
        } catch (SQLException se) {
            throw EventStoreException.snapshotFailed(entityId, se);
        }
        logger.debug("{} Snapshot stored, updated at {}", entityId, entity.getUpdatedAt());
    }

    private boolean exists(Connection connection, Entity<S> entity) throws SQLException {
        try (PreparedStatement st = schema.selectSnapshot(connection, entity.getEntityName(), entity.getEntityId());
                ResultSet rs = st.executeQuery()) {
            return rs.next();
        }
    }

    private int update(Connection connection, Entity<S> entity, String state) throws SQLException {
        try (PreparedStatement st = schema.updateSnapshot(connection, entity, state)) {
            return st.executeUpdate();
        }
    }

    /**
     * Inserts the snapshot row, or updates it when another writer inserted the row since it was looked up.
     */
    private int insertOrUpdate(Connection connection, Entity<S> entity, String state) throws SQLException {
        try (PreparedStatement st = schema.insertSnapshot(connection, entity, state)) {
            return st.executeUpdate();
        } catch (SQLException e) {
            if (!JdbcEventStore.isIntegrityViolation(e)) {
                throw e;
            }
            logger.debug("{} Snapshot inserted concurrently, updating", entity.getEntityId());
            return update(connection, entity, state);
        }
    }

    @Override
    public List<SnapshotRef> querySnapshotDocs(String entityName, SnapshotQuery query) throws EventStoreException {
        List<SnapshotRef> result = new ArrayList<>();
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectSnapshots(connection, entityName);
                ResultSet rs = st.executeQuery()) {
            while (rs.next()) {
                if (query.getLimit().isPresent() && result.size() >= query.getLimit().getAsInt()) {
                    break;
                }
                String entityId = schema.readSnapshotEntityId(rs);
                if (matches(entityId, schema.readSnapshotState(rs), query)) {
                    result.add(new SnapshotRef(entityId, schema.readSnapshotUpdatedAt(rs)));
                }
            }
        } catch (SQLException se) {
            throw EventStoreException.readFailed(entityName, se);
        }
        return result;
    }

    private boolean matches(String entityId, String state, SnapshotQuery query) throws EventStoreException {
        if (query.getStateConditions().isEmpty()) {
            return true;
        }
        JsonNode document;
        try {
            document = serialization.parseDocument(state);
        } catch (IllegalArgumentException e) {
            throw EventStoreException.serializationFailed(entityId, e);
        }
        return query.getStateConditions().stream().allMatch(c -> c.matches(document));
    }
}
