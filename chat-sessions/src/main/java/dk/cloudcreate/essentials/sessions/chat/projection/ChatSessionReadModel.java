package dk.cloudcreate.essentials.sessions.chat.projection;

import dk.cloudcreate.essentials.sessions.chat.SessionStatus;

import java.time.OffsetDateTime;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

/**
 * Query side view of a chat session
 */
public final class ChatSessionReadModel {
    public final String         id;
    public final String         userId;
    public final String         title;
    public final SessionStatus  status;
    public final int            messageCount;
    public final OffsetDateTime createdAt;
    public final OffsetDateTime updatedAt;

    public ChatSessionReadModel(String id, String userId, String title, SessionStatus status, int messageCount, OffsetDateTime createdAt, OffsetDateTime updatedAt) {
        this.id = requireNonNull(id, "No id provided");
        this.userId = requireNonNull(userId, "No userId provided");
        this.title = requireNonNull(title, "No title provided");
        this.status = requireNonNull(status, "No status provided");
        this.messageCount = messageCount;
        this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        this.updatedAt = requireNonNull(updatedAt, "No updatedAt provided");
    }

    ChatSessionReadModel withMessageAdded(OffsetDateTime messageAddedAt) {
        return new ChatSessionReadModel(id, userId, title, status, messageCount + 1, createdAt, latest(updatedAt, messageAddedAt));
    }

    ChatSessionReadModel withStatus(SessionStatus newStatus, OffsetDateTime changedAt) {
        return new ChatSessionReadModel(id, userId, title, newStatus, messageCount, createdAt, latest(updatedAt, changedAt));
    }

    private static OffsetDateTime latest(OffsetDateTime a, OffsetDateTime b) {
        return a.isAfter(b) ? a : b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatSessionReadModel)) return false;
        var that = (ChatSessionReadModel) o;
        return messageCount == that.messageCount &&
                id.equals(that.id) &&
                userId.equals(that.userId) &&
                title.equals(that.title) &&
                status == that.status &&
                createdAt.isEqual(that.createdAt) &&
                updatedAt.isEqual(that.updatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, userId, title, status, messageCount, createdAt.toInstant(), updatedAt.toInstant());
    }

    @Override
    public String toString() {
        return "ChatSessionReadModel{" +
                "id='" + id + '\'' +
                ", userId='" + userId + '\'' +
                ", title='" + title + '\'' +
                ", status=" + status +
                ", messageCount=" + messageCount +
                ", createdAt=" + createdAt +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
