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

import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.event.Entity;
import io.github.goodees.eventive.store.EventQuery;
import io.github.goodees.eventive.store.SortOrder;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.List;
import java.util.TimeZone;

/**
 * JDBC schema with one event table and one snapshot table shared by all entity types. Following tables are expected
 * to exist:
 * <ul>
 * <li><em>eventTable</em>(EVENT_ID, ENTITY_NAME, ENTITY_ID, EVENT_NAME, REVISION, CREATED_AT, BODY) primary key
 * (EVENT_ID)</li>
 * <li><em>snapshotTable</em>(ENTITY_NAME, ENTITY_ID, CREATED_AT, UPDATED_AT, STATE) primary key (ENTITY_NAME,
 * ENTITY_ID)</li>
 * </ul>
 * Events are read ordered by CREATED_AT and EVENT_ID. Timestamps are written and read as UTC, so that the order
 * does not depend on the time zone of the JVM.
 */
public class DefaultJdbcSchema extends JdbcSchema {
    private static final String EVENT_COLUMNS = "EVENT_ID, ENTITY_NAME, ENTITY_ID, EVENT_NAME, REVISION, CREATED_AT, BODY";
    private static final String EVENT_ORDER = " ORDER BY CREATED_AT, EVENT_ID";
    private static final String NEWEST_FIRST_ORDER = " ORDER BY CREATED_AT DESC, EVENT_ID";
    private static final TimeZone UTC = TimeZone.getTimeZone("UTC");

    private final String eventTable;
    private final String snapshotTable;

    public DefaultJdbcSchema(String eventTable, String snapshotTable) {
        this.eventTable = eventTable;
        this.snapshotTable = snapshotTable;
    }

    protected String getEventTable() {
        return eventTable;
    }

    protected String getSnapshotTable() {
        return snapshotTable;
    }

    @Override
    protected PreparedStatement insertEvent(Connection connection) throws SQLException {
        return connection.prepareStatement("INSERT INTO " + getEventTable() + " (" + EVENT_COLUMNS
                + ") VALUES (?,?,?,?,?,?,?)");
    }

    @Override
    protected void prepareInsert(PreparedStatement insertEvent, DomainEvent<?> event, String body)
            throws SQLException {
        insertEvent.setString(1, event.getEventId());
        insertEvent.setString(2, event.getEntityName());
        insertEvent.setString(3, event.getEntityId());
        insertEvent.setString(4, event.getEventName());
        insertEvent.setString(5, event.getRevision().orElse(null));
        setInstant(insertEvent, 6, event.getEventCreatedAt());
        insertEvent.setString(7, body);
    }

    @Override
    protected PreparedStatement selectEvents(Connection connection, String entityName, EventQuery query)
            throws SQLException {
        StringBuilder sql = new StringBuilder("SELECT ").append(EVENT_COLUMNS).append(" FROM ").append(getEventTable())
                .append(" WHERE ENTITY_NAME=?");
        List<Object> params = new ArrayList<>();
        params.add(entityName);
        query.getEventName().ifPresent(name -> {
            sql.append(" AND EVENT_NAME=?");
            params.add(name);
        });
        query.getEntityId().ifPresent(id -> {
            sql.append(" AND ENTITY_ID=?");
            params.add(id);
        });
        query.getRevision().ifPresent(revision -> {
            sql.append(" AND REVISION=?");
            params.add(revision);
        });
        query.getCreatedFrom().ifPresent(from -> {
            sql.append(" AND CREATED_AT>=?");
            params.add(from);
        });
        query.getCreatedTo().ifPresent(to -> {
            sql.append(" AND CREATED_AT<=?");
            params.add(to);
        });
        sql.append(query.getSortOrder() == SortOrder.NEWEST_FIRST ? NEWEST_FIRST_ORDER : EVENT_ORDER);
        PreparedStatement st = connection.prepareStatement(sql.toString());
        bind(st, params);
        return st;
    }

    @Override
    protected PreparedStatement selectEventsByEntityIds(Connection connection, String entityName,
            Collection<String> entityIds) throws SQLException {
        StringBuilder placeholders = new StringBuilder();
        for (int i = 0; i < entityIds.size(); i++) {
            placeholders.append(i == 0 ? "?" : ",?");
        }
        PreparedStatement st = connection.prepareStatement("SELECT " + EVENT_COLUMNS + " FROM " + getEventTable()
                + " WHERE ENTITY_NAME=? AND ENTITY_ID IN (" + placeholders + ")" + EVENT_ORDER);
        List<Object> params = new ArrayList<>();
        params.add(entityName);
        params.addAll(entityIds);
        bind(st, params);
        return st;
    }

    private static void bind(PreparedStatement st, List<Object> params) throws SQLException {
        for (int i = 0; i < params.size(); i++) {
            Object param = params.get(i);
            if (param instanceof Instant) {
                setInstant(st, i + 1, (Instant) param);
            } else {
                st.setString(i + 1, (String) param);
            }
        }
    }

    @Override
    protected String readEventId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected String readEntityId(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    @Override
    protected String readEventName(ResultSet rs) throws SQLException {
        return rs.getString(4);
    }

    @Override
    protected String readRevision(ResultSet rs) throws SQLException {
        return rs.getString(5);
    }

    @Override
    protected Instant readEventCreatedAt(ResultSet rs) throws SQLException {
        return getInstant(rs, 6);
    }

    @Override
    protected String readEventBody(ResultSet rs) throws SQLException {
        return rs.getString(7);
    }

    @Override
    protected PreparedStatement selectSnapshot(Connection connection, String entityName, String entityId)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT ENTITY_ID, UPDATED_AT, STATE FROM "
                + getSnapshotTable() + " WHERE ENTITY_NAME=? AND ENTITY_ID=?");
        ps.setString(1, entityName);
        ps.setString(2, entityId);
        return ps;
    }

    @Override
    protected PreparedStatement updateSnapshot(Connection connection, Entity<?> entity, String state)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("UPDATE " + getSnapshotTable()
                + " SET CREATED_AT=?, UPDATED_AT=?, STATE=? WHERE ENTITY_NAME=? AND ENTITY_ID=?");
        setInstant(ps, 1, entity.getCreatedAt());
        setInstant(ps, 2, entity.getUpdatedAt());
        ps.setString(3, state);
        ps.setString(4, entity.getEntityName());
        ps.setString(5, entity.getEntityId());
        return ps;
    }

    @Override
    protected PreparedStatement insertSnapshot(Connection connection, Entity<?> entity, String state)
            throws SQLException {
        PreparedStatement ps = connection.prepareStatement("INSERT INTO " + getSnapshotTable()
                + " (ENTITY_NAME, ENTITY_ID, CREATED_AT, UPDATED_AT, STATE) VALUES (?,?,?,?,?)");
        ps.setString(1, entity.getEntityName());
        ps.setString(2, entity.getEntityId());
        setInstant(ps, 3, entity.getCreatedAt());
        setInstant(ps, 4, entity.getUpdatedAt());
        ps.setString(5, state);
        return ps;
    }

    @Override
    protected PreparedStatement selectSnapshots(Connection connection, String entityName) throws SQLException {
        PreparedStatement ps = connection.prepareStatement("SELECT ENTITY_ID, UPDATED_AT, STATE FROM "
                + getSnapshotTable() + " WHERE ENTITY_NAME=? ORDER BY CREATED_AT, ENTITY_ID");
        ps.setString(1, entityName);
        return ps;
    }

    @Override
    protected String readSnapshotEntityId(ResultSet rs) throws SQLException {
        return rs.getString(1);
    }

    @Override
    protected Instant readSnapshotUpdatedAt(ResultSet rs) throws SQLException {
        return getInstant(rs, 2);
    }

    @Override
    protected String readSnapshotState(ResultSet rs) throws SQLException {
        return rs.getString(3);
    }

    protected static void setInstant(PreparedStatement ps, int index, Instant instant) throws SQLException {
        ps.setTimestamp(index, Timestamp.from(instant), Calendar.getInstance(UTC));
    }

    protected static Instant getInstant(ResultSet rs, int index) throws SQLException {
        Timestamp timestamp = rs.getTimestamp(index, Calendar.getInstance(UTC));
        return timestamp == null ? null : timestamp.toInstant();
    }
}
