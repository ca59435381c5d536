package dk.cloudcreate.essentials.sessions.chat.projection;

import dk.cloudcreate.essentials.sessions.chat.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.JSONSerializer;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.result.RowView;
import org.slf4j.*;

import java.time.*;
import java.util.*;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * {@link ChatReadModelStore} backed by two PostgreSQL tables: <code>chat_session_views</code> and <code>chat_message_views</code>.<br>
 * The file keys of a message are stored as a JSON array. Status changes that arrive before their session are parked in
 * <code>chat_early_status_changes</code> until the session is inserted.<br>
 * Every mutation holds a transaction scoped advisory lock on the session id, so concurrent projections of events from the
 * same session are serialized.
 */
public final class PostgresqlChatReadModelStore implements ChatReadModelStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlChatReadModelStore.class);

    public static final String SESSIONS_TABLE_NAME             = "chat_session_views";
    public static final String MESSAGES_TABLE_NAME             = "chat_message_views";
    public static final String EARLY_STATUS_CHANGES_TABLE_NAME = "chat_early_status_changes";

    private final Jdbi           jdbi;
    private final JSONSerializer jsonSerializer;

    public PostgresqlChatReadModelStore(Jdbi jdbi, JSONSerializer jsonSerializer) {
        this.jdbi = requireNonNull(jdbi, "You must supply a jdbi instance");
        this.jsonSerializer = requireNonNull(jsonSerializer, "You must supply a jsonSerializer");
        initializeTables();
    }

    private void initializeTables() {
        jdbi.useTransaction(handle -> {
            handle.execute("CREATE TABLE IF NOT EXISTS " + SESSIONS_TABLE_NAME + " (\n" +
                                   "id TEXT PRIMARY KEY,\n" +
                                   "user_id TEXT NOT NULL,\n" +
                                   "title TEXT NOT NULL,\n" +
                                   "status TEXT NOT NULL,\n" +
                                   "message_count INTEGER NOT NULL,\n" +
                                   "created_at TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                   "updated_at TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                   ")");
            handle.execute("CREATE INDEX IF NOT EXISTS " + SESSIONS_TABLE_NAME + "_user_index ON " + SESSIONS_TABLE_NAME + " (user_id, updated_at DESC)");
            handle.execute("CREATE TABLE IF NOT EXISTS " + MESSAGES_TABLE_NAME + " (\n" +
                                   "id TEXT PRIMARY KEY,\n" +
                                   "session_id TEXT NOT NULL,\n" +
                                   "role TEXT NOT NULL,\n" +
                                   "content TEXT NOT NULL,\n" +
                                   "file_keys JSON NOT NULL,\n" +
                                   "created_at TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                   ")");
            handle.execute("CREATE INDEX IF NOT EXISTS " + MESSAGES_TABLE_NAME + "_session_index ON " + MESSAGES_TABLE_NAME + " (session_id, created_at)");
            handle.execute("CREATE TABLE IF NOT EXISTS " + EARLY_STATUS_CHANGES_TABLE_NAME + " (\n" +
                                   "session_id TEXT PRIMARY KEY,\n" +
                                   "status TEXT NOT NULL,\n" +
                                   "changed_at TIMESTAMP WITH TIME ZONE NOT NULL\n" +
                                   ")");
        });
        log.info("Using chat read model tables '{}', '{}' and '{}'", SESSIONS_TABLE_NAME, MESSAGES_TABLE_NAME, EARLY_STATUS_CHANGES_TABLE_NAME);
    }

    @Override
    public boolean insertSessionIfAbsent(ChatSessionReadModel session) {
        requireNonNull(session, "No session provided");
        return jdbi.inTransaction(handle -> {
            lockSession(handle, session.id);
            var inserted = handle.createUpdate("INSERT INTO " + SESSIONS_TABLE_NAME +
                                                       " (id, user_id, title, status, message_count, created_at, updated_at)" +
                                                       " SELECT :id, :user_id, :title," +
                                                       " COALESCE((SELECT status FROM " + EARLY_STATUS_CHANGES_TABLE_NAME + " WHERE session_id = :id), :status)," +
                                                       " :message_count + COUNT(m.id), :created_at," +
                                                       " GREATEST(:updated_at, MAX(m.created_at), (SELECT changed_at FROM " + EARLY_STATUS_CHANGES_TABLE_NAME + " WHERE session_id = :id))" +
                                                       " FROM (SELECT id, created_at FROM " + MESSAGES_TABLE_NAME + " WHERE session_id = :id) m" +
                                                       " ON CONFLICT (id) DO NOTHING")
                                 .bind("id", session.id)
                                 .bind("user_id", session.userId)
                                 .bind("title", session.title)
                                 .bind("status", session.status.name())
                                 .bind("message_count", session.messageCount)
                                 .bind("created_at", session.createdAt)
                                 .bind("updated_at", session.updatedAt)
                                 .execute() == 1;
            if (inserted) {
                handle.createUpdate("DELETE FROM " + EARLY_STATUS_CHANGES_TABLE_NAME + " WHERE session_id = :id")
                      .bind("id", session.id)
                      .execute();
            }
            return inserted;
        });
    }

    @Override
    public boolean insertMessageIfAbsent(ChatMessageReadModel message) {
        requireNonNull(message, "No message provided");
        return jdbi.inTransaction(handle -> {
            lockSession(handle, message.sessionId);
            var inserted = handle.createUpdate("INSERT INTO " + MESSAGES_TABLE_NAME +
                                                       " (id, session_id, role, content, file_keys, created_at)" +
                                                       " VALUES (:id, :session_id, :role, :content, CAST(:file_keys AS JSON), :created_at)" +
                                                       " ON CONFLICT (id) DO NOTHING")
                                 .bind("id", message.id)
                                 .bind("session_id", message.sessionId)
                                 .bind("role", message.role.name())
                                 .bind("content", message.content)
                                 .bind("file_keys", jsonSerializer.serialize(message.fileKeys))
                                 .bind("created_at", message.createdAt)
                                 .execute() == 1;
            if (inserted) {
                handle.createUpdate("UPDATE " + SESSIONS_TABLE_NAME +
                                            " SET message_count = message_count + 1, updated_at = GREATEST(updated_at, :created_at) WHERE id = :id")
                      .bind("id", message.sessionId)
                      .bind("created_at", message.createdAt)
                      .execute();
            }
            return inserted;
        });
    }

    @Override
    public boolean updateSessionStatus(String sessionId, SessionStatus status, OffsetDateTime changedAt) {
        requireNonNull(sessionId, "No sessionId provided");
        requireNonNull(status, "No status provided");
        requireNonNull(changedAt, "No changedAt provided");
        return jdbi.inTransaction(handle -> {
            lockSession(handle, sessionId);
            var updated = handle.createUpdate("UPDATE " + SESSIONS_TABLE_NAME +
                                                      " SET status = :status, updated_at = GREATEST(updated_at, :changed_at) WHERE id = :id")
                                .bind("id", sessionId)
                                .bind("status", status.name())
                                .bind("changed_at", changedAt)
                                .execute() == 1;
            if (!updated) {
                handle.createUpdate("INSERT INTO " + EARLY_STATUS_CHANGES_TABLE_NAME + " AS e (session_id, status, changed_at)" +
                                            " VALUES (:id, :status, :changed_at)" +
                                            " ON CONFLICT (session_id) DO UPDATE SET status = EXCLUDED.status, changed_at = EXCLUDED.changed_at" +
                                            " WHERE e.changed_at <= EXCLUDED.changed_at")
                      .bind("id", sessionId)
                      .bind("status", status.name())
                      .bind("changed_at", changedAt)
                      .execute();
                log.debug("Session '{}' hasn't been projected yet, keeping status {} until it is", sessionId, status);
            }
            return updated;
        });
    }

    @Override
    public Optional<ChatSessionReadModel> getSession(String sessionId) {
        requireNonNull(sessionId, "No sessionId provided");
        return jdbi.withHandle(handle -> handle.createQuery("SELECT * FROM " + SESSIONS_TABLE_NAME + " WHERE id = :id")
                                               .bind("id", sessionId)
                                               .map(PostgresqlChatReadModelStore::toSession)
                                               .findOne());
    }

    @Override
    public List<ChatMessageReadModel> getMessages(String sessionId) {
        requireNonNull(sessionId, "No sessionId provided");
        return jdbi.withHandle(handle -> handle.createQuery("SELECT * FROM " + MESSAGES_TABLE_NAME + " WHERE session_id = :session_id ORDER BY created_at, id")
                                               .bind("session_id", sessionId)
                                               .map(this::toMessage)
                                               .list());
    }

    @Override
    public List<ChatSessionReadModel> listSessionsByUser(String userId, int limit) {
        requireNonNull(userId, "No userId provided");
        checkArgument(limit >= 0, "limit must be >= 0");
        return jdbi.withHandle(handle -> handle.createQuery("SELECT * FROM " + SESSIONS_TABLE_NAME +
                                                                    " WHERE user_id = :user_id ORDER BY updated_at DESC, id LIMIT :limit")
                                               .bind("user_id", userId)
                                               .bind("limit", limit)
                                               .map(PostgresqlChatReadModelStore::toSession)
                                               .list());
    }

    @Override
    public void deleteAll() {
        jdbi.useTransaction(handle -> {
            handle.execute("DELETE FROM " + MESSAGES_TABLE_NAME);
            handle.execute("DELETE FROM " + SESSIONS_TABLE_NAME);
            handle.execute("DELETE FROM " + EARLY_STATUS_CHANGES_TABLE_NAME);
        });
        log.debug("Deleted all chat read models");
    }

    private static void lockSession(Handle handle, String sessionId) {
        handle.createQuery("SELECT 1 FROM pg_advisory_xact_lock(hashtext(:id))")
              .bind("id", sessionId)
              .mapTo(Integer.class)
              .one();
    }

    private static ChatSessionReadModel toSession(RowView row) {
        return new ChatSessionReadModel(row.getColumn("id", String.class),
                                        row.getColumn("user_id", String.class),
                                        row.getColumn("title", String.class),
                                        SessionStatus.valueOf(row.getColumn("status", String.class)),
                                        row.getColumn("message_count", Integer.class),
                                        row.getColumn("created_at", OffsetDateTime.class).withOffsetSameInstant(ZoneOffset.UTC),
                                        row.getColumn("updated_at", OffsetDateTime.class).withOffsetSameInstant(ZoneOffset.UTC));
    }

    private ChatMessageReadModel toMessage(RowView row) {
        var fileKeys = jsonSerializer.deserialize(row.getColumn("file_keys", String.class), String[].class);
        return new ChatMessageReadModel(row.getColumn("id", String.class),
                                        row.getColumn("session_id", String.class),
                                        MessageRole.valueOf(row.getColumn("role", String.class)),
                                        row.getColumn("content", String.class),
                                        List.of(fileKeys),
                                        row.getColumn("created_at", OffsetDateTime.class).withOffsetSameInstant(ZoneOffset.UTC));
    }
}
