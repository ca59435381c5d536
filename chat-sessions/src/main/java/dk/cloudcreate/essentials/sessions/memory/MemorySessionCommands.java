package dk.cloudcreate.essentials.sessions.memory;

import dk.cloudcreate.essentials.sessions.aggregates.AggregateReconstructor;
import dk.cloudcreate.essentials.sessions.aggregates.command.CommandDispatcher;
import dk.cloudcreate.essentials.sessions.chat.MessageRole;

import java.time.Clock;
import java.util.*;

import static java.util.Objects.requireNonNull;

public final class MemorySessionCommands {
    private MemorySessionCommands() {
    }

    public static CommandDispatcher.Builder registerHandlers(CommandDispatcher.Builder builder, Clock clock) {
        requireNonNull(builder, "No builder provided");
        requireNonNull(clock, "No clock provided");
        return builder.creationHandler(MemorySession.AGGREGATE_TYPE,
                                       CreateMemorySession.class,
                                       (String sessionId, CreateMemorySession cmd) -> MemorySession.create(MemorySessionId.of(sessionId), cmd.actorId, cmd.title(), clock))
                      .aggregateHandler(MemorySession.AGGREGATE_TYPE,
                                        StoreMemoryEvent.class,
                                        (MemorySession session, StoreMemoryEvent cmd) -> session.storeEvent(cmd.role, cmd.content, cmd.metadata))
                      .aggregateHandler(MemorySession.AGGREGATE_TYPE,
                                        CloseMemorySession.class,
                                        (MemorySession session, CloseMemorySession cmd) -> session.close());
    }

    public static AggregateReconstructor registerReconstruction(AggregateReconstructor reconstructor) {
        return requireNonNull(reconstructor, "No reconstructor provided")
                .register(MemorySession.AGGREGATE_TYPE, MemorySessionEvent.class, sessionId -> new MemorySession(MemorySessionId.of(sessionId)));
    }

    public static final class CreateMemorySession {
        public final String  actorId;
        private final String title;

        public CreateMemorySession(String actorId, String title) {
            this.actorId = requireNonNull(actorId, "No actorId provided");
            this.title = title;
        }

        public Optional<String> title() {
            return Optional.ofNullable(title);
        }
    }

    public static final class StoreMemoryEvent {
        public final MessageRole         role;
        public final String              content;
        public final Map<String, String> metadata;

        public StoreMemoryEvent(MessageRole role, String content, Map<String, String> metadata) {
            this.role = requireNonNull(role, "No role provided");
            this.content = requireNonNull(content, "No content provided");
            this.metadata = Map.copyOf(requireNonNull(metadata, "No metadata provided"));
        }
    }

    public static final class CloseMemorySession {
    }
}
