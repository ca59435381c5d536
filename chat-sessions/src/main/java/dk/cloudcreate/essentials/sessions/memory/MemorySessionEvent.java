package dk.cloudcreate.essentials.sessions.memory;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventTypeRegistry;

import java.time.OffsetDateTime;

import static java.util.Objects.requireNonNull;

public interface MemorySessionEvent {
    <R> R accept(Handler<R> handler);

    static EventTypeRegistry registerEventTypes(EventTypeRegistry eventTypeRegistry) {
        return eventTypeRegistry.register(MemorySessionCreated.class.getSimpleName(), MemorySessionCreated.class)
                                .register(MemoryEventStored.class.getSimpleName(), MemoryEventStored.class)
                                .register(MemorySessionClosed.class.getSimpleName(), MemorySessionClosed.class);
    }

    interface Handler<R> {
        R on(MemorySessionCreated event);

        R on(MemoryEventStored event);

        R on(MemorySessionClosed event);
    }

    final class MemorySessionCreated implements MemorySessionEvent {
        public final String         sessionId;
        public final String         actorId;
        public final String         title;
        public final OffsetDateTime createdAt;

        @JsonCreator
        public MemorySessionCreated(@JsonProperty("sessionId") String sessionId,
                                    @JsonProperty("actorId") String actorId,
                                    @JsonProperty("title") String title,
                                    @JsonProperty("createdAt") OffsetDateTime createdAt) {
            this.sessionId = requireNonNull(sessionId, "No sessionId provided");
            this.actorId = requireNonNull(actorId, "No actorId provided");
            this.title = requireNonNull(title, "No title provided");
            this.createdAt = requireNonNull(createdAt, "No createdAt provided");
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.on(this);
        }
    }

    final class MemoryEventStored implements MemorySessionEvent {
        public final String      sessionId;
        public final MemoryEntry entry;

        @JsonCreator
        public MemoryEventStored(@JsonProperty("sessionId") String sessionId,
                                 @JsonProperty("entry") MemoryEntry entry) {
            this.sessionId = requireNonNull(sessionId, "No sessionId provided");
            this.entry = requireNonNull(entry, "No entry provided");
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.on(this);
        }
    }

    final class MemorySessionClosed implements MemorySessionEvent {
        public final String         sessionId;
        public final OffsetDateTime closedAt;

        @JsonCreator
        public MemorySessionClosed(@JsonProperty("sessionId") String sessionId,
                                   @JsonProperty("closedAt") OffsetDateTime closedAt) {
            this.sessionId = requireNonNull(sessionId, "No sessionId provided");
            this.closedAt = requireNonNull(closedAt, "No closedAt provided");
        }

        @Override
        public <R> R accept(Handler<R> handler) {
            return handler.on(this);
        }
    }
}
