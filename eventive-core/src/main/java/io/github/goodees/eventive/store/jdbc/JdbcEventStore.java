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
import io.github.goodees.eventive.store.EventStore;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;

/**
 * Appends events into the event table of a {@link JdbcSchema}. Every append is a single insert, the primary key on
 * event id rejects duplicates.
 *
 * <p>By default the store leaves transaction demarcation to the container, i.e. it relies on the connections of the
 * data source either being auto-committed or enrolled in a managed transaction. Pass a {@link TxHandler} to manage
 * local transactions.</p>
 *
 * @param <P> body supertype
 */
public class JdbcEventStore<P> implements EventStore<P> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventStore.class);
    private static final String INTEGRITY_VIOLATION_STATE = "23";

    private final DataSource dataSource;
    private final JdbcSchema schema;
    private final Serialization<P> serialization;
    private final TxHandler txHandler;

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<P> serialization) {
        this(dataSource, schema, serialization, CONTAINER_HANDLER);
    }

    public JdbcEventStore(DataSource dataSource, JdbcSchema schema, Serialization<P> serialization,
            TxHandler handler) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.serialization = serialization;
        this.txHandler = handler;
    }

    protected String serializeBody(DomainEvent<P> event) throws EventStoreException {
        try {
            return serialization.serialize(event.getBody());
        } catch (IllegalArgumentException e) {
            throw EventStoreException.serializationFailed(event.getEntityId(), e);
        }
    }

    @Override
    public void appendEvent(DomainEvent<P> event) throws EventStoreException {
        String body = serializeBody(event);
        try (Connection connection = txHandler.enroll(dataSource.getConnection())) {
            try (PreparedStatement insertEvent = schema.insertEvent(connection)) {
                schema.prepareInsert(insertEvent, event, body);
                insertEvent.executeUpdate();
                txHandler.commit(connection);
            } catch (SQLException | RuntimeException e) {
                txHandler.rollback(connection);
                throw e;
            }
        } catch (SQLException ex) {
            if (isIntegrityViolation(ex)) {
                throw EventStoreException.duplicateEvent(event, ex);
            }
            throw EventStoreException.storeFailed(event.getEntityId(), ex);
        }
        logger.debug("{} Appended event {} {}", event.getEntityId(), event.getEventName(), event.getEventId());
    }

    static boolean isIntegrityViolation(SQLException ex) {
        return ex instanceof SQLIntegrityConstraintViolationException
                || (ex.getSQLState() != null && ex.getSQLState().startsWith(INTEGRITY_VIOLATION_STATE));
    }

    /**
     * Transaction demarcation around a single append.
     */
    public interface TxHandler {

        Connection enroll(Connection connection) throws SQLException;

        void commit(Connection connection) throws SQLException;

        void rollback(Connection connection) throws SQLException;
    }

    /**
     * Handler for connections not in auto-commit mode, that commits or rolls back every append on its own.
     */
    public static final TxHandler LOCAL_TX_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) throws SQLException {
            connection.setAutoCommit(false);
            return connection;
        }

        @Override
        public void commit(Connection connection) throws SQLException {
            connection.commit();
        }

        @Override
        public void rollback(Connection connection) throws SQLException {
            connection.rollback();
        }
    };

    private static final TxHandler CONTAINER_HANDLER = new TxHandler() {
        @Override
        public Connection enroll(Connection connection) {
            return connection;
        }

        @Override
        public void commit(Connection connection) {
        }

        @Override
        public void rollback(Connection connection) {
        }
    };
}
