package dk.cloudcreate.essentials.sessions.eventstore.persistence;

import com.google.common.base.Throwables;
import dk.cloudcreate.essentials.sessions.common.transaction.*;
import dk.cloudcreate.essentials.sessions.eventstore.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventSerializer;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.statement.PreparedBatch;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.*;
import static java.util.Objects.requireNonNull;

/**
 * This strategy uses a separate table for each {@link AggregateType}. All event streams of an {@link AggregateType}
 * share the table and are separated by their <code>aggregate_id</code>.<br>
 * The <code>UNIQUE(aggregate_id, version)</code> constraint is the conditional write that guarantees that only one
 * writer can append a given version to an event stream.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class SeparateTablePerAggregateTypePersistenceStrategy {
    private static final Logger log = LoggerFactory.getLogger(SeparateTablePerAggregateTypePersistenceStrategy.class);

    private static final String UNIQUE_VIOLATION_SQL_STATE = "23505";

    /**
     * Key: {@link AggregateType}<br>
     * Value: The insert SQL for the event stream table the event stream is persisted to
     */
    private final ConcurrentMap<AggregateType, String>                     insertSql                   = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregateType, AggregateTypeConfiguration> aggregateTypeConfigurations = new ConcurrentSkipListMap<>();
    private final Jdbi                                                     jdbi;
    private final UnitOfWorkFactory                                        unitOfWorkFactory;
    private final EventSerializer                                          eventSerializer;

    public SeparateTablePerAggregateTypePersistenceStrategy(Jdbi jdbi,
                                                            UnitOfWorkFactory unitOfWorkFactory,
                                                            EventSerializer eventSerializer,
                                                            List<AggregateTypeConfiguration> aggregateTypeConfigurations) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        requireNonNull(aggregateTypeConfigurations, "No aggregateTypeConfigurations provided");
        aggregateTypeConfigurations.forEach(this::addAggregateTypeConfiguration);
    }

    public SeparateTablePerAggregateTypePersistenceStrategy addAggregateTypeConfiguration(AggregateTypeConfiguration configuration) {
        requireNonNull(configuration, "No configuration provided");
        if (aggregateTypeConfigurations.putIfAbsent(configuration.aggregateType, configuration) == null) {
            initializeEventStorageFor(configuration);
        }
        return this;
    }

    public Set<AggregateType> configuredAggregateTypes() {
        return Set.copyOf(aggregateTypeConfigurations.keySet());
    }

    private AggregateTypeConfiguration getAggregateTypeConfiguration(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        var config = aggregateTypeConfigurations.get(aggregateType);
        if (config == null) {
            throw new EventStoreException(msg("AggregateType '{}' hasn't been configured. Please add it to the persistence strategy's configuration at initialization time or using addAggregateTypeConfiguration(config)", aggregateType));
        }
        return config;
    }

    private void initializeEventStorageFor(AggregateTypeConfiguration configuration) {
        log.info("Initializing EventStream storage for aggregate-type '{}'", configuration.aggregateType);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            Optional<String> eventTable = unitOfWork.handle().select("SELECT to_regclass(?)::text", configuration.eventStreamTableName)
                                                    .mapTo(String.class)
                                                    .findOne();
            if (eventTable.isEmpty()) {
                createEventStreamTable(unitOfWork.handle(), configuration);
            }
            ensureIndexes(unitOfWork.handle(), configuration);
        });
    }

    /**
     * Drop and recreate the event stream table for the given configuration
     */
    public void resetEventStorageFor(AggregateType aggregateType) {
        var configuration = getAggregateTypeConfiguration(aggregateType);
        log.info("Resetting EventStream storage for aggregate-type '{}'", configuration.aggregateType);
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("DROP TABLE IF EXISTS " + configuration.eventStreamTableName));
        initializeEventStorageFor(configuration);
    }

    private void createEventStreamTable(Handle handle, AggregateTypeConfiguration configuration) {
        log.info("[{}] Creating event-stream table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        handle.execute(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                    "            global_order bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                    "            aggregate_id text NOT NULL,\n" +
                                    "            version bigint NOT NULL CHECK (version >= 1),\n" +
                                    "            event_id text NOT NULL,\n" +
                                    "            event_type text NOT NULL,\n" +
                                    "            correlation_id text NOT NULL,\n" +
                                    "            causation_id text NOT NULL,\n" +
                                    "            timestamp TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                    "            event_payload {:jsonType} NOT NULL,\n" +
                                    "            event_metadata {:jsonType} NOT NULL,\n" +
                                    "          CONSTRAINT {:versionConstraint} UNIQUE (aggregate_id, version),\n" +
                                    "          UNIQUE (event_id)\n" +
                                    "        )",
                            arg("tableName", configuration.eventStreamTableName),
                            arg("jsonType", configuration.jsonColumnType),
                            arg("versionConstraint", versionConstraintName(configuration))));
    }

    private void ensureIndexes(Handle handle, AggregateTypeConfiguration configuration) {
        handle.execute(bind("CREATE INDEX IF NOT EXISTS {:tableName}_timestamp ON {:tableName} (timestamp)",
                            arg("tableName", configuration.eventStreamTableName)));
        log.debug("[{}] Ensured '{}' index on 'timestamp'", configuration.aggregateType, configuration.eventStreamTableName);
    }

    private static String versionConstraintName(AggregateTypeConfiguration configuration) {
        return configuration.eventStreamTableName + "_aggregate_version_key";
    }

    /**
     * Persist the events using the {@link UnitOfWork}'s transaction
     *
     * @throws ConcurrencyException    if the event stream isn't at <code>expectedVersion</code>
     * @throws AppendToStreamException if the events couldn't be persisted for any other reason
     */
    public List<StoredEvent> persist(UnitOfWork unitOfWork,
                                     AggregateType aggregateType,
                                     String aggregateId,
                                     long expectedVersion,
                                     List<?> events,
                                     Optional<EventMetadata> metadata) {
        requireNonNull(unitOfWork, "No unitOfWork provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(events, "No events provided");
        requireNonNull(metadata, "No metadata option provided");
        var configuration = getAggregateTypeConfiguration(aggregateType);
        if (events.isEmpty()) {
            return List.of();
        }

        var actualVersion = loadCurrentVersion(unitOfWork.handle(), configuration, aggregateId);
        if (actualVersion != expectedVersion) {
            throw new ConcurrencyException(aggregateType, aggregateId, expectedVersion, actualVersion);
        }

        var storedEvents = new ArrayList<StoredEvent>(events.size());
        var version      = expectedVersion;
        for (var event : events) {
            storedEvents.add(eventSerializer.toStoredEvent(aggregateType, aggregateId, event, ++version, metadata));
        }

        var batch = unitOfWork.handle()
                              .prepareBatch(getInsertSql(configuration));
        storedEvents.forEach(storedEvent -> addEventToPersistenceBatch(batch, storedEvent));
        try {
            batch.execute();
        } catch (RuntimeException e) {
            if (isVersionConstraintViolation(e, configuration)) {
                // The transaction is aborted, so the version that won the race is read using a separate connection
                var versionAfterConflict = jdbi.withHandle(handle -> loadCurrentVersion(handle, configuration, aggregateId));
                log.debug(msg("[{}] Optimistic Concurrency Exception Failed to Append {} Events to Stream related to aggregate with id '{}'. " +
                                      "First event was appended with version {}",
                              aggregateType,
                              events.size(),
                              aggregateId,
                              expectedVersion + 1), e);
                throw new ConcurrencyException(aggregateType, aggregateId, expectedVersion, versionAfterConflict, e);
            }
            throw new AppendToStreamException(msg("[{}] Failed to Append {} Events to Stream related to aggregate with id '{}'",
                                                  aggregateType,
                                                  events.size(),
                                                  aggregateId), e);
        }
        log.debug("[{}] Appended {} event(s) to aggregate with id '{}' after version {}",
                  aggregateType,
                  storedEvents.size(),
                  aggregateId,
                  expectedVersion);
        return List.copyOf(storedEvents);
    }

    private static boolean isVersionConstraintViolation(RuntimeException e, AggregateTypeConfiguration configuration) {
        var constraintName = versionConstraintName(configuration);
        for (var cause : Throwables.getCausalChain(e)) {
            if (cause instanceof SQLException) {
                var sqlException = (SQLException) cause;
                while (sqlException != null) {
                    if (UNIQUE_VIOLATION_SQL_STATE.equals(sqlException.getSQLState()) &&
                            sqlException.getMessage() != null &&
                            sqlException.getMessage().contains(constraintName)) {
                        return true;
                    }
                    sqlException = sqlException.getNextException();
                }
            }
        }
        return false;
    }

    private void addEventToPersistenceBatch(PreparedBatch batch, StoredEvent storedEvent) {
        batch.bind("aggregateId", storedEvent.aggregateId)
             .bind("version", storedEvent.version)
             .bind("eventId", storedEvent.eventId)
             .bind("eventType", storedEvent.eventType())
             .bind("correlationId", storedEvent.metadata.correlationId)
             .bind("causationId", storedEvent.metadata.causationId)
             .bind("timestamp", storedEvent.timestamp)
             .bind("eventPayload", storedEvent.eventData.getJson())
             .bind("eventMetadata", eventSerializer.serializeMetadata(storedEvent.metadata))
             .add();
    }

    public long loadCurrentVersion(Handle handle, AggregateType aggregateType, String aggregateId) {
        return loadCurrentVersion(handle, getAggregateTypeConfiguration(aggregateType), aggregateId);
    }

    private long loadCurrentVersion(Handle handle, AggregateTypeConfiguration configuration, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return handle.createQuery(bind("SELECT COALESCE(MAX(version), 0) FROM {:tableName} WHERE aggregate_id = :aggregateId",
                                       arg("tableName", configuration.eventStreamTableName)))
                     .bind("aggregateId", aggregateId)
                     .mapTo(Long.class)
                     .one();
    }

    /**
     * Load the events of an aggregate with a version strictly greater than <code>afterVersion</code>
     */
    public List<StoredEvent> loadAggregateEvents(Handle handle, AggregateType aggregateType, String aggregateId, long afterVersion) {
        requireNonNull(handle, "No handle provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        var configuration = getAggregateTypeConfiguration(aggregateType);
        return handle.createQuery(bind("SELECT * FROM {:tableName} WHERE \n" +
                                               "   aggregate_id = :aggregateId AND version > :afterVersion\n" +
                                               "   ORDER BY version ASC",
                                       arg("tableName", configuration.eventStreamTableName)))
                     .bind("aggregateId", aggregateId)
                     .bind("afterVersion", afterVersion)
                     .setFetchSize(configuration.queryFetchSize)
                     .map(new StoredEventRowMapper(configuration, eventSerializer))
                     .list();
    }

    /**
     * Lazily stream every event of the {@link AggregateType}, optionally only those with a timestamp after the watermark.<br>
     * Events are ordered by the order in which they were inserted, which keeps the per aggregate version order.
     * The stream is only valid while the <code>handle</code> and its transaction are open.
     */
    public Stream<StoredEvent> scanEvents(Handle handle, AggregateType aggregateType, Optional<OffsetDateTime> afterTimestamp) {
        requireNonNull(handle, "No handle provided");
        requireNonNull(afterTimestamp, "No afterTimestamp option provided");
        var configuration = getAggregateTypeConfiguration(aggregateType);
        var sql           = "SELECT * FROM {:tableName}";
        if (afterTimestamp.isPresent()) {
            sql += " WHERE timestamp > :afterTimestamp";
        }
        sql += " ORDER BY global_order ASC";
        var query = handle.createQuery(bind(sql, arg("tableName", configuration.eventStreamTableName)));
        afterTimestamp.ifPresent(timestamp -> query.bind("afterTimestamp", timestamp));
        return query.setFetchSize(configuration.queryFetchSize)
                    .map(new StoredEventRowMapper(configuration, eventSerializer))
                    .stream();
    }

    protected String getInsertSql(AggregateTypeConfiguration config) {
        return insertSql.computeIfAbsent(config.aggregateType, aggregateType ->
                bind("INSERT INTO {:tableName} (\n" +
                             "        aggregate_id,\n" +
                             "        version,\n" +
                             "        event_id,\n" +
                             "        event_type,\n" +
                             "        correlation_id,\n" +
                             "        causation_id,\n" +
                             "        timestamp,\n" +
                             "        event_payload,\n" +
                             "        event_metadata\n" +
                             "     ) VALUES (\n" +
                             "        :aggregateId,\n" +
                             "        :version,\n" +
                             "        :eventId,\n" +
                             "        :eventType,\n" +
                             "        :correlationId,\n" +
                             "        :causationId,\n" +
                             "        :timestamp,\n" +
                             "        :eventPayload::{:jsonType},\n" +
                             "        :eventMetadata::{:jsonType}\n" +
                             "     )",
                     arg("tableName", config.eventStreamTableName),
                     arg("jsonType", config.jsonColumnType)));
    }
}
