package dk.cloudcreate.essentials.sessions.eventstore.persistence;

import dk.cloudcreate.essentials.sessions.eventstore.EventStoreException;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventSerializer;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

class StoredEventRowMapper implements RowMapper<StoredEvent> {
    private final AggregateTypeConfiguration config;
    private final EventSerializer            eventSerializer;

    StoredEventRowMapper(AggregateTypeConfiguration configuration, EventSerializer eventSerializer) {
        this.config = requireNonNull(configuration, "No configuration provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
    }

    @Override
    public StoredEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        var eventType = getString(rs, "event_type");
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalStateException(msg("[{}] Row: {} - Column 'event_type' was empty or blank",
                                                config.aggregateType,
                                                rs.getRow()));
        }
        return new StoredEvent(getString(rs, "event_id"),
                               getString(rs, "aggregate_id"),
                               config.aggregateType,
                               eventSerializer.toEventJSON(eventType, getString(rs, "event_payload")),
                               eventSerializer.deserializeMetadata(getString(rs, "event_metadata")),
                               rs.getLong("version"),
                               rs.getObject("timestamp", OffsetDateTime.class));
    }

    private String getString(ResultSet resultSet, String columnName) {
        try {
            return resultSet.getString(columnName);
        } catch (SQLException e) {
            throw new EventStoreException(msg("Failed to getString from ResultSet in relation to columnName '{}'", columnName), e);
        }
    }
}
