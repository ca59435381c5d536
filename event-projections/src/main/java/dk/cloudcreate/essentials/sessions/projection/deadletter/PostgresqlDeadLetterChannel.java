package dk.cloudcreate.essentials.sessions.projection.deadletter;

import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.StoredEventJSONCodec;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.result.RowView;
import org.slf4j.*;

import java.time.*;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link DeadLetterChannel} that stores the dead letters in a PostgreSQL table (default <code>projection_dead_letters</code>).<br>
 * The failed event is stored in the event envelope JSON format (see {@link StoredEventJSONCodec}).
 */
public final class PostgresqlDeadLetterChannel implements DeadLetterChannel {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlDeadLetterChannel.class);

    public static final String DEFAULT_DEAD_LETTERS_TABLE_NAME = "projection_dead_letters";

    private final Jdbi                 jdbi;
    private final StoredEventJSONCodec eventCodec;
    private final String               deadLettersTableName;

    public PostgresqlDeadLetterChannel(Jdbi jdbi, StoredEventJSONCodec eventCodec) {
        this(jdbi, eventCodec, DEFAULT_DEAD_LETTERS_TABLE_NAME);
    }

    public PostgresqlDeadLetterChannel(Jdbi jdbi, StoredEventJSONCodec eventCodec, String deadLettersTableName) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        this.eventCodec = requireNonNull(eventCodec, "You must supply an eventCodec");
        this.deadLettersTableName = requireNonNull(deadLettersTableName, "You must supply a deadLettersTableName").toLowerCase();
        initializeDeadLettersTable();
    }

    private void initializeDeadLettersTable() {
        jdbi.useTransaction(handle -> {
            handle.execute("CREATE TABLE IF NOT EXISTS " + deadLettersTableName + " (\n" +
                                   "id TEXT PRIMARY KEY,\n" +
                                   "projector_name TEXT NOT NULL,\n" +
                                   "event_id TEXT NOT NULL,\n" +
                                   "event_envelope JSON NOT NULL,\n" +
                                   "last_error TEXT,\n" +
                                   "added_ts TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                   "delivery_attempts INTEGER NOT NULL,\n" +
                                   "CONSTRAINT " + deadLettersTableName + "_projector_event_key UNIQUE (projector_name, event_id)\n" +
                                   ")");
            var indexName = deadLettersTableName + "_projector_index";
            handle.execute("CREATE INDEX IF NOT EXISTS " + indexName + " ON " + deadLettersTableName + " (projector_name, added_ts)");
        });
        log.info("Using dead letters table '{}'", deadLettersTableName);
    }

    @Override
    public void send(DeadLetterMessage message) {
        requireNonNull(message, "No message provided");
        jdbi.useTransaction(handle -> handle.createUpdate("INSERT INTO " + deadLettersTableName +
                                                                  " (id, projector_name, event_id, event_envelope, last_error, added_ts, delivery_attempts)" +
                                                                  " VALUES (:id, :projector_name, :event_id, CAST(:event_envelope AS JSON), :last_error, :added_ts, :delivery_attempts)" +
                                                                  " ON CONFLICT (projector_name, event_id) DO UPDATE SET" +
                                                                  " last_error = EXCLUDED.last_error," +
                                                                  " delivery_attempts = " + deadLettersTableName + ".delivery_attempts + 1")
                                            .bind("id", message.id)
                                            .bind("projector_name", message.projectorName)
                                            .bind("event_id", message.event.eventId)
                                            .bind("event_envelope", eventCodec.toJSON(message.event))
                                            .bind("last_error", message.lastError)
                                            .bind("added_ts", message.addedTimestamp)
                                            .bind("delivery_attempts", message.deliveryAttempts)
                                            .execute());
        log.debug("[{}] Dead lettered event '{}'", message.projectorName, message.event.eventId);
    }

    @Override
    public List<DeadLetterMessage> getDeadLetterMessages(String projectorName) {
        requireNonNull(projectorName, "No projectorName provided");
        return jdbi.withHandle(handle -> handle.createQuery("SELECT * FROM " + deadLettersTableName +
                                                                    " WHERE projector_name = :projector_name ORDER BY added_ts, id")
                                               .bind("projector_name", projectorName)
                                               .map(this::toDeadLetterMessage)
                                               .list());
    }

    @Override
    public boolean recordFailedRedelivery(String id, Exception cause) {
        requireNonNull(id, "No id provided");
        return jdbi.withHandle(handle -> handle.createUpdate("UPDATE " + deadLettersTableName +
                                                                     " SET delivery_attempts = delivery_attempts + 1, last_error = :last_error WHERE id = :id")
                                               .bind("id", id)
                                               .bind("last_error", DeadLetterMessage.describe(cause))
                                               .execute()) == 1;
    }

    @Override
    public boolean delete(String id) {
        requireNonNull(id, "No id provided");
        return jdbi.withHandle(handle -> handle.createUpdate("DELETE FROM " + deadLettersTableName + " WHERE id = :id")
                                               .bind("id", id)
                                               .execute()) == 1;
    }

    private DeadLetterMessage toDeadLetterMessage(RowView row) {
        return new DeadLetterMessage(row.getColumn("id", String.class),
                                     row.getColumn("projector_name", String.class),
                                     eventCodec.fromJSON(row.getColumn("event_envelope", String.class)),
                                     row.getColumn("last_error", String.class),
                                     row.getColumn("added_ts", OffsetDateTime.class).withOffsetSameInstant(ZoneOffset.UTC),
                                     row.getColumn("delivery_attempts", Integer.class));
    }
}
