package dk.cloudcreate.essentials.sessions.chat;

import dk.cloudcreate.essentials.sessions.aggregates.AggregateReconstructor;
import dk.cloudcreate.essentials.sessions.aggregates.command.CommandDispatcher;

import java.time.Clock;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Command payloads accepted by the {@link ChatSession} aggregate and their handlers
 */
public final class ChatSessionCommands {
    private ChatSessionCommands() {
    }

    /**
     * Register the {@link ChatSession} handlers with the dispatcher
     *
     * @param builder the dispatcher builder
     * @param clock   the clock new sessions use for their timestamps
     * @return the <code>builder</code>
     */
    public static CommandDispatcher.Builder registerHandlers(CommandDispatcher.Builder builder, Clock clock) {
        requireNonNull(builder, "No builder provided");
        requireNonNull(clock, "No clock provided");
        return builder.creationHandler(ChatSession.AGGREGATE_TYPE,
                                       CreateSession.class,
                                       (String sessionId, CreateSession cmd) -> ChatSession.create(SessionId.of(sessionId), cmd.ownerId, cmd.title(), clock))
                      .aggregateHandler(ChatSession.AGGREGATE_TYPE,
                                        AddMessage.class,
                                        (ChatSession session, AddMessage cmd) -> session.addMessage(MessageContent.of(cmd.content), cmd.role, cmd.fileKeys))
                      .aggregateHandler(ChatSession.AGGREGATE_TYPE,
                                        ArchiveSession.class,
                                        (ChatSession session, ArchiveSession cmd) -> session.archive());
    }

    /**
     * Register how {@link ChatSession}s are reconstructed from their events
     */
    public static AggregateReconstructor registerReconstruction(AggregateReconstructor reconstructor) {
        return requireNonNull(reconstructor, "No reconstructor provided")
                .register(ChatSession.AGGREGATE_TYPE, ChatSessionEvent.class, sessionId -> new ChatSession(SessionId.of(sessionId)));
    }

    public static final class CreateSession {
        public final String  ownerId;
        private final String title;

        public CreateSession(String ownerId, String title) {
            this.ownerId = requireNonNull(ownerId, "No ownerId provided");
            this.title = title;
        }

        public CreateSession(String ownerId) {
            this(ownerId, null);
        }

        public Optional<String> title() {
            return Optional.ofNullable(title);
        }
    }

    public static final class AddMessage {
        public final String       content;
        public final MessageRole  role;
        public final List<String> fileKeys;

        public AddMessage(String content, MessageRole role, List<String> fileKeys) {
            this.content = requireNonNull(content, "No content provided");
            this.role = requireNonNull(role, "No role provided");
            this.fileKeys = List.copyOf(requireNonNull(fileKeys, "No fileKeys provided"));
        }

        public AddMessage(String content, MessageRole role) {
            this(content, role, List.of());
        }
    }

    public static final class ArchiveSession {
    }
}
