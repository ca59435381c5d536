package dk.cloudcreate.essentials.sessions.chat.projection;

import dk.cloudcreate.essentials.sessions.chat.MessageRole;

import java.time.OffsetDateTime;
import java.util.*;

import static java.util.Objects.requireNonNull;

public final class ChatMessageReadModel {
    public final String         id;
    public final String         sessionId;
    public final MessageRole    role;
    public final String         content;
    public final List<String>   fileKeys;
    public final OffsetDateTime createdAt;

    public ChatMessageReadModel(String id, String sessionId, MessageRole role, String content, List<String> fileKeys, OffsetDateTime createdAt) {
        this.id = requireNonNull(id, "No id provided");
        this.sessionId = requireNonNull(sessionId, "No sessionId provided");
        this.role = requireNonNull(role, "No role provided");
        this.content = requireNonNull(content, "No content provided");
        this.fileKeys = List.copyOf(requireNonNull(fileKeys, "No fileKeys provided"));
        this.createdAt = requireNonNull(createdAt, "No createdAt provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatMessageReadModel)) return false;
        var that = (ChatMessageReadModel) o;
        return id.equals(that.id) &&
                sessionId.equals(that.sessionId) &&
                role == that.role &&
                content.equals(that.content) &&
                fileKeys.equals(that.fileKeys) &&
                createdAt.isEqual(that.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, sessionId, role, content, fileKeys, createdAt.toInstant());
    }

    @Override
    public String toString() {
        return "ChatMessageReadModel{id='" + id + "', sessionId='" + sessionId + "', role=" + role + ", createdAt=" + createdAt + '}';
    }
}
