package dk.cloudcreate.essentials.sessions.chat.projection;

import dk.cloudcreate.essentials.sessions.chat.*;
import dk.cloudcreate.essentials.sessions.chat.ChatSessionEvent.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;
import dk.cloudcreate.essentials.sessions.projection.Projector;
import org.slf4j.*;

import static java.util.Objects.requireNonNull;

/**
 * Projects {@link ChatSession} events into the {@link ChatReadModelStore}.<br>
 * Sessions are keyed by session id and messages by message id, so projecting an event again leaves the read models unchanged.
 * Events from other aggregate types and event types without a registered Java type are ignored.
 */
public final class ChatSessionProjector implements Projector {
    private static final Logger log = LoggerFactory.getLogger(ChatSessionProjector.class);

    public static final String NAME = "ChatSessionProjector";

    private final ChatReadModelStore store;

    public ChatSessionProjector(ChatReadModelStore store) {
        this.store = requireNonNull(store, "No store provided");
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public void project(StoredEvent event) {
        requireNonNull(event, "No event provided");
        if (!ChatSession.AGGREGATE_TYPE.equals(event.aggregateType)) {
            return;
        }
        var payload = event.eventData.deserialize();
        if (payload.isEmpty() || !(payload.get() instanceof ChatSessionEvent)) {
            log.trace("[{}] Ignoring event '{}' with event type '{}'", NAME, event.eventId, event.eventType());
            return;
        }
        ((ChatSessionEvent) payload.get()).accept(new ChatSessionEvent.Handler<Void>() {
            @Override
            public Void on(SessionCreated e) {
                store.insertSessionIfAbsent(new ChatSessionReadModel(e.sessionId, e.ownerId, e.title, SessionStatus.ACTIVE, 0, e.createdAt, e.createdAt));
                return null;
            }

            @Override
            public Void on(MessageAdded e) {
                var inserted = store.insertMessageIfAbsent(new ChatMessageReadModel(e.messageId, e.sessionId, e.role, e.content, e.fileKeys, e.addedAt));
                if (!inserted) {
                    log.debug("[{}] Message '{}' of session '{}' was already projected", NAME, e.messageId, e.sessionId);
                }
                return null;
            }

            @Override
            public Void on(SessionArchived e) {
                store.updateSessionStatus(e.sessionId, SessionStatus.ARCHIVED, e.archivedAt);
                return null;
            }
        });
    }

    @Override
    public void reset() {
        store.deleteAll();
    }
}
