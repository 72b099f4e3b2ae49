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
import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.store.EventLog;
import io.github.goodees.eventive.store.EventQuery;
import io.github.goodees.eventive.store.EventStoreException;
import io.github.goodees.eventive.store.PropertyCondition;
import io.github.goodees.eventive.store.Serialization;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Event log backed by schema and serialization.
 */
public class JdbcEventLog<P> implements EventLog<P> {
    private static final Logger logger = LoggerFactory.getLogger(JdbcEventLog.class);

    private final DataSource ds;
    private final JdbcSchema schema;
    private final Serialization<P> serialization;
    private final boolean strict;

    /**
     * Create instance that will read from provided datasource, delegating queries to JdbcSchema, deserializing events
     * by serialization, while being or not being strict.
     *
     * <p>When event log is in strict mode, it will throw an exception when an event being read cannot be deserialized.
     * This can usually happen in two cases: Either there was an error in payload serialization, or an event could
     * belong to a future version of the system, code was rolled back and currently running code doesn't yet know such
     * event.
     * <p>When {@code strict} is false, such event is logged and skipped.
     *
     * <p>In case the entity needs very strong state consistency guarantees, strict mode should be used.
     *
     * @param ds data source to read from
     * @param schema statements to use
     * @param serialization deserialization of event bodies
     * @param strict whether undecodable events fail the read
     */
    public JdbcEventLog(DataSource ds, JdbcSchema schema, Serialization<P> serialization, boolean strict) {
        this.ds = ds;
        this.schema = schema;
        this.serialization = serialization;
        this.strict = strict;
    }

    /**
     * Scan events of an entity type. The statement returns rows in the requested order and reading stops once the
     * limit is reached. In strict mode without body conditions every row read is returned, so the limit is also
     * passed to the statement as its maximal number of rows.
     */
    @Override
    public List<DomainEvent<P>> findEvents(String entityName, EventQuery query) throws EventStoreException {
        int max = query.getLimit().orElse(Integer.MAX_VALUE);
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectEvents(connection, entityName, query)) {
            if (strict && query.getBodyConditions().isEmpty() && query.getLimit().isPresent()) {
                st.setMaxRows(max);
            }
            try (ResultSet rs = st.executeQuery()) {
                return read(entityName, rs, query.getBodyConditions(), max);
            }
        } catch (SQLException e) {
            throw EventStoreException.readFailed(entityName, e);
        }
    }

    @Override
    public List<DomainEvent<P>> findEventsByEntityIds(String entityName, Collection<String> entityIds)
            throws EventStoreException {
        if (entityIds.isEmpty()) {
            return new ArrayList<>();
        }
        try (Connection connection = ds.getConnection();
                PreparedStatement st = schema.selectEventsByEntityIds(connection, entityName,
                    new LinkedHashSet<>(entityIds));
                ResultSet rs = st.executeQuery()) {
            return read(entityName, rs, Collections.emptyList(), Integer.MAX_VALUE);
        } catch (SQLException e) {
            throw EventStoreException.readFailed(entityName, e);
        }
    }

    /**
     * Indicate whether failure to deserialize event causes exception to be thrown.
     * @return true if strict
     */
    public boolean isStrict() {
        return strict;
    }

    private List<DomainEvent<P>> read(String entityName, ResultSet rs, List<PropertyCondition> conditions, int max)
            throws SQLException, EventStoreException {
        List<DomainEvent<P>> events = new ArrayList<>();
        while (events.size() < max && rs.next()) {
            String entityId = schema.readEntityId(rs);
            String eventName = schema.readEventName(rs);
            String revision = schema.readRevision(rs);
            if (!serialization.supports(eventName, revision)) {
                if (isStrict()) {
                    throw EventStoreException.unsupported(entityId, eventName, revision);
                }
                logger.error("{} Unsupported event {} revision {} skipped", entityId, eventName, revision);
                continue;
            }
            P body;
            try {
                body = serialization.deserialize(eventName, revision, schema.readEventBody(rs));
            } catch (IllegalArgumentException e) {
                if (isStrict()) {
                    throw EventStoreException.serializationFailed(entityId, e);
                }
                logger.error("{} Could not deserialize event {} revision {}", entityId, eventName, revision, e);
                continue;
            }
            DomainEvent<P> event = new DomainEvent<>(schema.readEventId(rs), eventName, schema.readEventCreatedAt(rs),
                    entityName, entityId, body, revision);
            if (matchesBody(event, conditions)) {
                events.add(event);
            }
        }
        return events;
    }

    private boolean matchesBody(DomainEvent<P> event, List<PropertyCondition> conditions) {
        if (conditions.isEmpty()) {
            return true;
        }
        JsonNode document = serialization.toDocument(event.getBody());
        return conditions.stream().allMatch(c -> c.matches(document));
    }
}
