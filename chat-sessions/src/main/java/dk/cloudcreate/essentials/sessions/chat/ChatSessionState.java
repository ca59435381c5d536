package dk.cloudcreate.essentials.sessions.chat;

import dk.cloudcreate.essentials.sessions.aggregates.AggregateException;
import dk.cloudcreate.essentials.sessions.chat.ChatSessionEvent.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;

/**
 * Immutable snapshot of a {@link ChatSession}. Each event produces a new snapshot through {@link #evolve(ChatSessionState, ChatSessionEvent)}
 */
public final class ChatSessionState {
    public final String            ownerId;
    public final String            title;
    public final SessionStatus     status;
    public final List<ChatMessage> messages;
    public final OffsetDateTime    createdAt;
    private final OffsetDateTime   lastMessageAt;

    private ChatSessionState(String ownerId,
                             String title,
                             SessionStatus status,
                             List<ChatMessage> messages,
                             OffsetDateTime createdAt,
                             OffsetDateTime lastMessageAt) {
        this.ownerId = ownerId;
        this.title = title;
        this.status = status;
        this.messages = List.copyOf(messages);
        this.createdAt = createdAt;
        this.lastMessageAt = lastMessageAt;
    }

    static ChatSessionState evolve(ChatSessionState state, ChatSessionEvent event) {
        return event.accept(new ChatSessionEvent.Handler<>() {
            @Override
            public ChatSessionState on(SessionCreated event) {
                return new ChatSessionState(event.ownerId, event.title, SessionStatus.ACTIVE, List.of(), event.createdAt, null);
            }

            @Override
            public ChatSessionState on(MessageAdded event) {
                requireCreated(state, event.sessionId, event);
                var messages = new ArrayList<>(state.messages);
                messages.add(new ChatMessage(event.messageId, event.role, event.content, event.fileKeys, event.addedAt));
                return new ChatSessionState(state.ownerId, state.title, state.status, messages, state.createdAt, event.addedAt);
            }

            @Override
            public ChatSessionState on(SessionArchived event) {
                requireCreated(state, event.sessionId, event);
                return new ChatSessionState(state.ownerId, state.title, SessionStatus.ARCHIVED, state.messages, state.createdAt, state.lastMessageAt);
            }
        });
    }

    private static void requireCreated(ChatSessionState state, String sessionId, ChatSessionEvent event) {
        if (state == null) {
            throw new AggregateException(msg("ChatSession '{}' cannot apply {} before it has been created", sessionId, event.getClass().getSimpleName()));
        }
    }

    public int messageCount() {
        return messages.size();
    }

    public Optional<OffsetDateTime> lastMessageAt() {
        return Optional.ofNullable(lastMessageAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChatSessionState)) return false;
        var that = (ChatSessionState) o;
        return ownerId.equals(that.ownerId) &&
                title.equals(that.title) &&
                status == that.status &&
                messages.equals(that.messages) &&
                createdAt.isEqual(that.createdAt) &&
                Objects.equals(lastMessageAt == null ? null : lastMessageAt.toInstant(),
                               that.lastMessageAt == null ? null : that.lastMessageAt.toInstant());
    }

    @Override
    public int hashCode() {
        return Objects.hash(ownerId, title, status, messages, createdAt.toInstant());
    }

    @Override
    public String toString() {
        return "ChatSessionState{" +
                "ownerId='" + ownerId + '\'' +
                ", title='" + title + '\'' +
                ", status=" + status +
                ", messages=" + messages.size() +
                ", createdAt=" + createdAt +
                '}';
    }
}
