package dk.cloudcreate.essentials.sessions.chat.projection;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Read side of the chat sessions. Results are eventually consistent with the event store
 */
public final class ChatSessionQueries {
    public static final int DEFAULT_LIST_LIMIT = 20;

    private final ChatReadModelStore store;

    public ChatSessionQueries(ChatReadModelStore store) {
        this.store = requireNonNull(store, "No store provided");
    }

    public Optional<ChatSessionReadModel> getSession(String sessionId) {
        return store.getSession(requireNonNull(sessionId, "No sessionId provided"));
    }

    public Optional<SessionWithMessages> getSessionWithMessages(String sessionId) {
        return getSession(sessionId).map(session -> new SessionWithMessages(session, store.getMessages(session.id)));
    }

    public List<ChatSessionReadModel> listSessionsByUser(String userId, int limit) {
        return store.listSessionsByUser(requireNonNull(userId, "No userId provided"), limit);
    }

    public List<ChatSessionReadModel> listSessionsByUser(String userId) {
        return listSessionsByUser(userId, DEFAULT_LIST_LIMIT);
    }

    public static final class SessionWithMessages {
        public final ChatSessionReadModel       session;
        public final List<ChatMessageReadModel> messages;

        public SessionWithMessages(ChatSessionReadModel session, List<ChatMessageReadModel> messages) {
            this.session = requireNonNull(session, "No session provided");
            this.messages = List.copyOf(requireNonNull(messages, "No messages provided"));
        }
    }
}
