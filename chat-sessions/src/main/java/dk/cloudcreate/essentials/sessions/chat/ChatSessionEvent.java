package dk.cloudcreate.essentials.sessions.chat;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventTypeRegistry;

import java.time.OffsetDateTime;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Events of the {@link ChatSession} aggregate. The event type name stored with each event is the simple class name
 */
public interface ChatSessionEvent {
    String sessionId();

    <R> R accept(Handler<R> handler);

    static EventTypeRegistry registerEventTypes(EventTypeRegistry eventTypeRegistry) {
        return eventTypeRegistry.register(SessionCreated.class.getSimpleName(), SessionCreated.class)
                                .register(MessageAdded.class.getSimpleName(), MessageAdded.class)
                                .register(SessionArchived.class.getSimpleName(), SessionArchived.class);
    }

    interface Handler<R> {
        R on(SessionCreated event);

        R on(MessageAdded event);

        R on(SessionArchived event);
    }

    final class SessionCreated implements ChatSessionEvent {
        public final String         sessionId;
        public final String         ownerId;
        public final String         title;
        public final OffsetDateTime createdAt;

        @JsonCreator
        public SessionCreated(@JsonProperty("sessionId") String sessionId,
                              @JsonProperty("ownerId") String ownerId,
                              @JsonProperty("title") String title,
                              @JsonProperty("createdAt") OffsetDateTime createdAt) {
            this.sessionId = requireNonNull(sessionId, "No sessionId provided");
            this.ownerId = requireNonNull(ownerId, "No ownerId provided");
            this.title = requireNonNull(title, "No title provided");
            this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.on(this);
        }
    }

    final class MessageAdded implements ChatSessionEvent {
        public final String         sessionId;
        public final String         messageId;
        public final MessageRole    role;
        public final String         content;
        public final List<String>   fileKeys;
        public final OffsetDateTime addedAt;

        @JsonCreator
        public MessageAdded(@JsonProperty("sessionId") String sessionId,
                            @JsonProperty("messageId") String messageId,
                            @JsonProperty("role") MessageRole role,
                            @JsonProperty("content") String content,
                            @JsonProperty("fileKeys") List<String> fileKeys,
                            @JsonProperty("addedAt") OffsetDateTime addedAt) {
            this.sessionId = requireNonNull(sessionId, "No sessionId provided");
            this.messageId = requireNonNull(messageId, "No messageId provided");
            this.role = requireNonNull(role, "No role provided");
            this.content = requireNonNull(content, "No content provided");
            this.fileKeys = fileKeys == null ? List.of() : List.copyOf(fileKeys);
            this.addedAt = requireNonNull(addedAt, "No addedAt provided");
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.on(this);
        }
    }

    final class SessionArchived implements ChatSessionEvent {
        public final String         sessionId;
        public final OffsetDateTime archivedAt;

        @JsonCreator
        public SessionArchived(@JsonProperty("sessionId") String sessionId,
                               @JsonProperty("archivedAt") OffsetDateTime archivedAt) {
            this.sessionId = requireNonNull(sessionId, "No sessionId provided");
            this.archivedAt = requireNonNull(archivedAt, "No archivedAt provided");
        }

        @Override
        public String sessionId() {
            return sessionId;
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.on(this);
        }
    }
}
