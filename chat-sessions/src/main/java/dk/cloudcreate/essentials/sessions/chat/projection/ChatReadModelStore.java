package dk.cloudcreate.essentials.sessions.chat.projection;

import dk.cloudcreate.essentials.sessions.chat.SessionStatus;

import java.time.OffsetDateTime;
import java.util.*;

/**
 * Storage of the chat read models. Every mutation is idempotent, so the {@link ChatSessionProjector} can be fed the same
 * event more than once
 */
public interface ChatReadModelStore {
    /**
     * Insert the session unless a session with the same id already exists. Messages of the session projected before the
     * session itself are included in its <code>messageCount</code>, and a status change projected before the session
     * replaces its <code>status</code>
     *
     * @return true if the session was inserted
     */
    boolean insertSessionIfAbsent(ChatSessionReadModel session);

    /**
     * Insert the message unless a message with the same id already exists. When inserted, the owning session's
     * <code>messageCount</code> is incremented and its <code>updatedAt</code> moved forward to the message's <code>createdAt</code>
     *
     * @return true if the message was inserted
     */
    boolean insertMessageIfAbsent(ChatMessageReadModel message);

    /**
     * Set the status of the session and move its <code>updatedAt</code> forward to <code>changedAt</code>.<br>
     * If the session hasn't been inserted yet, the status change with the latest <code>changedAt</code> is kept and applied
     * by {@link #insertSessionIfAbsent(ChatSessionReadModel)}
     *
     * @return true if the session exists
     */
    boolean updateSessionStatus(String sessionId, SessionStatus status, OffsetDateTime changedAt);

    Optional<ChatSessionReadModel> getSession(String sessionId);

    /**
     * Messages of the session ordered by <code>createdAt</code>
     */
    List<ChatMessageReadModel> getMessages(String sessionId);

    /**
     * Sessions owned by the user, most recently updated first
     */
    List<ChatSessionReadModel> listSessionsByUser(String userId, int limit);

    /**
     * Delete every session and message
     */
    void deleteAll();
}
