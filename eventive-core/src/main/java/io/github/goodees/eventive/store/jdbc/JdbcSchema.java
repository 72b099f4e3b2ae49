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

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;

/**
 * Statements and result mapping used by JDBC stores. Subclass to adapt the stores to an existing schema or a specific
 * database dialect.
 *
 * <p>Statements select events in their native order, which is the tie-break for events of an aggregate created at
 * the same instant. {@link #selectEvents(Connection, String, EventQuery)} applies the sort order of the query, the
 * event log reads its rows in that order. Property conditions of queries are not part of the statements, stores
 * evaluate them on the deserialized documents.</p>
 *
 * @see DefaultJdbcSchema
 */
public abstract class JdbcSchema {

    protected abstract PreparedStatement insertEvent(Connection connection) throws SQLException;

    protected abstract void prepareInsert(PreparedStatement insertEvent, DomainEvent<?> event, String body)
            throws SQLException;

    protected abstract PreparedStatement selectEvents(Connection connection, String entityName, EventQuery query)
            throws SQLException;

    protected abstract PreparedStatement selectEventsByEntityIds(Connection connection, String entityName,
            Collection<String> entityIds) throws SQLException;

    protected abstract String readEventId(ResultSet rs) throws SQLException;

    protected abstract String readEventName(ResultSet rs) throws SQLException;

    protected abstract String readEntityId(ResultSet rs) throws SQLException;

    protected abstract String readRevision(ResultSet rs) throws SQLException;

    protected abstract Instant readEventCreatedAt(ResultSet rs) throws SQLException;

    protected abstract String readEventBody(ResultSet rs) throws SQLException;

    protected abstract PreparedStatement selectSnapshot(Connection connection, String entityName, String entityId)
            throws SQLException;

    protected abstract PreparedStatement updateSnapshot(Connection connection, Entity<?> entity, String state)
            throws SQLException;

    protected abstract PreparedStatement insertSnapshot(Connection connection, Entity<?> entity, String state)
            throws SQLException;

    protected abstract PreparedStatement selectSnapshots(Connection connection, String entityName)
            throws SQLException;

    protected abstract String readSnapshotEntityId(ResultSet rs) throws SQLException;

    protected abstract Instant readSnapshotUpdatedAt(ResultSet rs) throws SQLException;

    protected abstract String readSnapshotState(ResultSet rs) throws SQLException;
}
