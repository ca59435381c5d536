package dk.cloudcreate.essentials.sessions.chat;

import dk.cloudcreate.essentials.sessions.aggregates.AggregateException;
import dk.cloudcreate.essentials.sessions.aggregates.command.*;
import dk.cloudcreate.essentials.sessions.chat.ChatSessionCommands.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * Application facing write API for chat sessions. Validates and normalizes the session id before handing the command to
 * the {@link CommandDispatcher}, which must have the {@link ChatSessionCommands} handlers registered.
 */
public final class ChatSessionService {
    private static final Logger log = LoggerFactory.getLogger(ChatSessionService.class);

    private final CommandDispatcher dispatcher;

    public ChatSessionService(CommandDispatcher dispatcher) {
        this.dispatcher = requireNonNull(dispatcher, "No dispatcher provided");
    }

    /**
     * Start a new session owned by <code>ownerId</code>. The owner is recorded as the user in the event metadata unless
     * <code>metadata</code> specifies one
     *
     * @return the id of the new session
     */
    public SessionId startSession(String ownerId, Optional<String> title, CommandMetadata metadata) {
        requireNonNull(ownerId, "No ownerId provided");
        requireNonNull(title, "No title option provided");
        requireNonNull(metadata, "No metadata provided");
        var sessionId = SessionId.random();
        var commandMetadata = metadata.userId.isPresent() ? metadata : metadata.withUserId(ownerId);
        dispatcher.dispatch(sessionId.value(), ChatSession.AGGREGATE_TYPE, Command.of(new CreateSession(ownerId, title.orElse(null)), commandMetadata));
        log.debug("Started ChatSession '{}' for owner '{}'", sessionId, ownerId);
        return sessionId;
    }

    /**
     * Add a message to an existing session
     *
     * @return the id of the new message
     */
    public String sendMessage(String sessionId, MessageRole role, String content, List<String> fileKeys, CommandMetadata metadata) {
        var id = SessionId.of(sessionId);
        var result = dispatcher.dispatch(id.value(), ChatSession.AGGREGATE_TYPE, Command.of(new AddMessage(content, role, fileKeys), metadata));
        return result.events.stream()
                            .map(event -> event.eventData.deserialize())
                            .flatMap(Optional::stream)
                            .filter(ChatSessionEvent.MessageAdded.class::isInstance)
                            .map(event -> ((ChatSessionEvent.MessageAdded) event).messageId)
                            .findFirst()
                            .orElseThrow(() -> new AggregateException(msg("[{}:{}] AddMessage didn't produce a MessageAdded event", ChatSession.AGGREGATE_TYPE, id)));
    }

    /**
     * @return the version of the session after it was archived
     */
    public long archiveSession(String sessionId, CommandMetadata metadata) {
        var id = SessionId.of(sessionId);
        return dispatcher.dispatch(id.value(), ChatSession.AGGREGATE_TYPE, Command.of(new ArchiveSession(), metadata)).producedVersion;
    }
}
