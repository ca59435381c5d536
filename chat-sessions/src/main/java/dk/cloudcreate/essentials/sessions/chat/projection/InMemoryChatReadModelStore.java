package dk.cloudcreate.essentials.sessions.chat.projection;

import dk.cloudcreate.essentials.sessions.chat.SessionStatus;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

public final class InMemoryChatReadModelStore implements ChatReadModelStore {
    private final Map<String, ChatSessionReadModel> sessions           = new HashMap<>();
    private final Map<String, ChatMessageReadModel> messages           = new LinkedHashMap<>();
    private final Map<String, StatusChange>         earlyStatusChanges = new HashMap<>();

    @Override
    public synchronized boolean insertSessionIfAbsent(ChatSessionReadModel session) {
        requireNonNull(session, "No session provided");
        if (sessions.containsKey(session.id)) {
            return false;
        }
        var sessionWithMessages = session;
        for (var message : messages.values()) {
            if (message.sessionId.equals(session.id)) {
                sessionWithMessages = sessionWithMessages.withMessageAdded(message.createdAt);
            }
        }
        var statusChange = earlyStatusChanges.remove(session.id);
        if (statusChange != null) {
            sessionWithMessages = sessionWithMessages.withStatus(statusChange.status, statusChange.changedAt);
        }
        sessions.put(session.id, sessionWithMessages);
        return true;
    }

    @Override
    public synchronized boolean insertMessageIfAbsent(ChatMessageReadModel message) {
        requireNonNull(message, "No message provided");
        if (messages.putIfAbsent(message.id, message) != null) {
            return false;
        }
        sessions.computeIfPresent(message.sessionId, (id, session) -> session.withMessageAdded(message.createdAt));
        return true;
    }

    @Override
    public synchronized boolean updateSessionStatus(String sessionId, SessionStatus status, OffsetDateTime changedAt) {
        requireNonNull(status, "No status provided");
        requireNonNull(changedAt, "No changedAt provided");
        requireNonNull(sessionId, "No sessionId provided");
        if (sessions.computeIfPresent(sessionId, (id, session) -> session.withStatus(status, changedAt)) != null) {
            return true;
        }
        earlyStatusChanges.merge(sessionId,
                                 new StatusChange(status, changedAt),
                                 (kept, latest) -> latest.changedAt.isBefore(kept.changedAt) ? kept : latest);
        return false;
    }

    @Override
    public synchronized Optional<ChatSessionReadModel> getSession(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    @Override
    public synchronized List<ChatMessageReadModel> getMessages(String sessionId) {
        return messages.values()
                       .stream()
                       .filter(message -> message.sessionId.equals(sessionId))
                       .sorted(Comparator.comparing((ChatMessageReadModel message) -> message.createdAt).thenComparing(message -> message.id))
                       .collect(Collectors.toList());
    }

    @Override
    public synchronized List<ChatSessionReadModel> listSessionsByUser(String userId, int limit) {
        checkArgument(limit >= 0, "limit must be >= 0");
        return sessions.values()
                       .stream()
                       .filter(session -> session.userId.equals(userId))
                       .sorted(Comparator.comparing((ChatSessionReadModel session) -> session.updatedAt).reversed().thenComparing(session -> session.id))
                       .limit(limit)
                       .collect(Collectors.toList());
    }

    @Override
    public synchronized void deleteAll() {
        sessions.clear();
        messages.clear();
        earlyStatusChanges.clear();
    }

    private static final class StatusChange {
        private final SessionStatus  status;
        private final OffsetDateTime changedAt;

        private StatusChange(SessionStatus status, OffsetDateTime changedAt) {
            this.status = status;
            this.changedAt = changedAt;
        }
    }
}
