package dk.cloudcreate.essentials.sessions.chat;

import java.time.OffsetDateTime;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * A message as seen by the {@link ChatSession} aggregate
 */
public final class ChatMessage {
    public final String         messageId;
    public final MessageRole    role;
    public final String         content;
    public final List<String>   fileKeys;
    public final OffsetDateTime addedAt;

    public ChatMessage(String messageId, MessageRole role, String content, List<String> fileKeys, OffsetDateTime addedAt) {
        this.messageId = requireNonNull(messageId, "No messageId provided");
        this.role = requireNonNull(role, "No role provided");
        this.content = requireNonNull(content, "No content provided");
        this.fileKeys = List.copyOf(requireNonNull(fileKeys, "No fileKeys provided"));
        this.addedAt = requireNonNull(addedAt, "No addedAt provided");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatMessage)) return false;
        var that = (ChatMessage) o;
        return messageId.equals(that.messageId) &&
                role == that.role &&
                content.equals(that.content) &&
                fileKeys.equals(that.fileKeys) &&
                addedAt.isEqual(that.addedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(messageId, role, content, fileKeys, addedAt.toInstant());
    }

    @Override
    public String toString() {
        return "ChatMessage{" +
                "messageId='" + messageId + '\'' +
                ", role=" + role +
                ", length=" + content.length() +
                ", fileKeys=" + fileKeys +
                ", addedAt=" + addedAt +
                '}';
    }
}
