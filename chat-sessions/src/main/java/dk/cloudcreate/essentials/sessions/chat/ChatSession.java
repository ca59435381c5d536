package dk.cloudcreate.essentials.sessions.chat;

import dk.cloudcreate.essentials.sessions.aggregates.*;
import dk.cloudcreate.essentials.sessions.chat.ChatSessionEvent.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;

import java.time.*;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * A conversation between a user and an assistant.<br>
 * A session is created {@link SessionStatus#ACTIVE}, accepts messages while active and can be archived once, after which
 * every command fails with {@link InvalidStateException}.
 * <p>
 * Timestamps are taken from the {@link Clock} given at construction, truncated to microseconds, and recorded in the events,
 * so a session reconstructed from its events always equals the session that produced them.
 */
public final class ChatSession implements Aggregate<SessionId, ChatSessionEvent> {
    public static final AggregateType AGGREGATE_TYPE = AggregateType.of("ChatSession");

    private static final DateTimeFormatter DEFAULT_TITLE_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    private final AggregateRoot<SessionId, ChatSessionEvent, ChatSessionState> root;
    private final Clock                                                        clock;

    /**
     * Used when reconstructing the session from its events
     */
    public ChatSession(SessionId sessionId) {
        this(sessionId, Clock.systemUTC());
    }

    public ChatSession(SessionId sessionId, Clock clock) {
        this.root = new AggregateRoot<>(requireNonNull(sessionId, "No sessionId provided"), ChatSessionState::evolve);
        this.clock = requireNonNull(clock, "No clock provided");
    }

    /**
     * Create a new session
     *
     * @param sessionId the id of the new session
     * @param ownerId   the user owning the session
     * @param title     optional title. A blank or missing title defaults to <code>Chat yyyy-MM-dd</code>
     * @param clock     the clock used for the session timestamps
     * @return the new session with the {@link SessionCreated} event uncommitted
     */
    public static ChatSession create(SessionId sessionId, String ownerId, Optional<String> title, Clock clock) {
        requireNonNull(ownerId, "No ownerId provided");
        requireNonNull(title, "No title option provided");
        var session   = new ChatSession(sessionId, clock);
        var createdAt = session.now();
        var sessionTitle = title.map(String::trim)
                                .filter(t -> !t.isEmpty())
                                .orElseGet(() -> "Chat " + DEFAULT_TITLE_DATE.format(createdAt));
        session.root.apply(new SessionCreated(sessionId.value(), ownerId, sessionTitle, createdAt));
        return session;
    }

    public static ChatSession create(SessionId sessionId, String ownerId, Optional<String> title) {
        return create(sessionId, ownerId, title, Clock.systemUTC());
    }

    /**
     * Add a message to the session
     *
     * @return the id of the new message
     * @throws InvalidStateException if the session is archived
     */
    public String addMessage(MessageContent content, MessageRole role, List<String> fileKeys) {
        requireNonNull(content, "No content provided");
        requireNonNull(role, "No role provided");
        requireNonNull(fileKeys, "No fileKeys provided");
        ensureActive("add a message to");
        var messageId = UUID.randomUUID().toString();
        root.apply(new MessageAdded(aggregateId().value(), messageId, role, content.value(), fileKeys, now()));
        return messageId;
    }

    /**
     * @throws InvalidStateException if the session is already archived
     */
    public void archive() {
        ensureActive("archive");
        root.apply(new SessionArchived(aggregateId().value(), now()));
    }

    private void ensureActive(String operation) {
        if (state().status != SessionStatus.ACTIVE) {
            throw new InvalidStateException(aggregateId(), state().status, operation);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    public ChatSessionState state() {
        return root.state();
    }

    public String ownerId() {
        return state().ownerId;
    }

    public String title() {
        return state().title;
    }

    public SessionStatus status() {
        return state().status;
    }

    public List<ChatMessage> messages() {
        return state().messages;
    }

    public int messageCount() {
        return state().messageCount();
    }

    public OffsetDateTime createdAt() {
        return state().createdAt;
    }

    public Optional<OffsetDateTime> lastMessageAt() {
        return state().lastMessageAt();
    }

    @Override
    public SessionId aggregateId() {
        return root.aggregateId();
    }

    @Override
    public long version() {
        return root.version();
    }

    @Override
    public List<ChatSessionEvent> getUncommittedEvents() {
        return root.getUncommittedEvents();
    }

    @Override
    public void clearUncommittedEvents() {
        root.clearUncommittedEvents();
    }

    @Override
    public void loadFromHistory(List<ChatSessionEvent> events, long lastVersion) {
        root.loadFromHistory(events, lastVersion);
    }
}
