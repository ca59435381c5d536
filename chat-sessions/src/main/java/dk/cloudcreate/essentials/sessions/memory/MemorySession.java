package dk.cloudcreate.essentials.sessions.memory;

import dk.cloudcreate.essentials.sessions.aggregates.*;
import dk.cloudcreate.essentials.sessions.chat.MessageRole;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;
import dk.cloudcreate.essentials.sessions.memory.MemorySessionEvent.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;
import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Conversation memory of an actor (a user or an agent). Entries are stored while the session is active; closing the session
 * is terminal.
 */
public final class MemorySession implements Aggregate<MemorySessionId, MemorySessionEvent> {
    public static final AggregateType AGGREGATE_TYPE     = AggregateType.of("MemorySession");
    public static final int           DEFAULT_RECENT_LIMIT = 50;

    private final AggregateRoot<MemorySessionId, MemorySessionEvent, MemorySessionState> root;
    private final Clock                                                                  clock;

    public MemorySession(MemorySessionId sessionId) {
        this(sessionId, Clock.systemUTC());
    }

    public MemorySession(MemorySessionId sessionId, Clock clock) {
        this.root = new AggregateRoot<>(requireNonNull(sessionId, "No sessionId provided"), MemorySessionState::evolve);
        this.clock = requireNonNull(clock, "No clock provided");
    }

    /**
     * @param title optional title, defaults to <code>Session &lt;first 8 characters of the id&gt;</code>
     */
    public static MemorySession create(MemorySessionId sessionId, String actorId, Optional<String> title, Clock clock) {
        requireNonNull(actorId, "No actorId provided");
        requireNonNull(title, "No title option provided");
        var session = new MemorySession(sessionId, clock);
        var sessionTitle = title.map(String::trim)
                                .filter(t -> !t.isEmpty())
                                .orElseGet(() -> "Session " + sessionId.value().substring(0, Math.min(8, sessionId.value().length())));
        session.root.apply(new MemorySessionCreated(sessionId.value(), actorId, sessionTitle, session.now()));
        return session;
    }

    /**
     * Remember an utterance
     *
     * @return the stored entry
     * @throws InvalidStateException if the session is closed
     */
    public MemoryEntry storeEvent(MessageRole role, String content, Map<String, String> metadata) {
        requireNonNull(role, "No role provided");
        requireNonNull(content, "No content provided");
        requireNonNull(metadata, "No metadata provided");
        ensureActive("store an event in");
        var entry = new MemoryEntry("evt-" + UUID.randomUUID(), role, content, now(), metadata);
        root.apply(new MemoryEventStored(aggregateId().value(), entry));
        return entry;
    }

    /**
     * @throws InvalidStateException if the session is already closed
     */
    public void close() {
        ensureActive("close");
        root.apply(new MemorySessionClosed(aggregateId().value(), now()));
    }

    /**
     * The last <code>limit</code> entries, oldest first
     */
    public List<MemoryEntry> recentEvents(int limit) {
        checkArgument(limit >= 0, "limit must be >= 0");
        var entries = state().entries;
        return entries.subList(Math.max(0, entries.size() - limit), entries.size());
    }

    public List<MemoryEntry> recentEvents() {
        return recentEvents(DEFAULT_RECENT_LIMIT);
    }

    /**
     * Entries whose content contains <code>query</code>, ignoring case
     */
    public List<MemoryEntry> searchEvents(String query) {
        requireNonNull(query, "No query provided");
        var lowerCaseQuery = query.toLowerCase(Locale.ROOT);
        return state().entries.stream()
                              .filter(entry -> entry.contentContainsIgnoreCase(lowerCaseQuery))
                              .collect(Collectors.toList());
    }

    private void ensureActive(String operation) {
        if (state().status != MemorySessionState.Status.ACTIVE) {
            throw new InvalidStateException(aggregateId(), state().status, operation);
        }
    }

    private OffsetDateTime now() {
        return OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    public MemorySessionState state() {
        return root.state();
    }

    public int eventCount() {
        return state().entries.size();
    }

    public OffsetDateTime lastActivityAt() {
        return state().lastActivityAt;
    }

    @Override
    public MemorySessionId aggregateId() {
        return root.aggregateId();
    }

    @Override
    public long version() {
        return root.version();
    }

    @Override
    public List<MemorySessionEvent> getUncommittedEvents() {
        return root.getUncommittedEvents();
    }

    @Override
    public void clearUncommittedEvents() {
        root.clearUncommittedEvents();
    }

    @Override
    public void loadFromHistory(List<MemorySessionEvent> events, long lastVersion) {
        root.loadFromHistory(events, lastVersion);
    }
}
