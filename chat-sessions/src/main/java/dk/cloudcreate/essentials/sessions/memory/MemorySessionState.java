package dk.cloudcreate.essentials.sessions.memory;

import dk.cloudcreate.essentials.sessions.aggregates.AggregateException;
import dk.cloudcreate.essentials.sessions.memory.MemorySessionEvent.*;

import java.time.OffsetDateTime;
import java.util.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;

public final class MemorySessionState {
    public enum Status {
        ACTIVE,
        CLOSED
    }

    public final String            actorId;
    public final String            title;
    public final Status            status;
    public final List<MemoryEntry> entries;
    public final OffsetDateTime    createdAt;
    public final OffsetDateTime    lastActivityAt;

    private MemorySessionState(String actorId, String title, Status status, List<MemoryEntry> entries, OffsetDateTime createdAt, OffsetDateTime lastActivityAt) {
        this.actorId = actorId;
        this.title = title;
        this.status = status;
        this.entries = List.copyOf(entries);
        this.createdAt = createdAt;
        this.lastActivityAt = lastActivityAt;
    }

    static MemorySessionState evolve(MemorySessionState state, MemorySessionEvent event) {
        return event.accept(new MemorySessionEvent.Handler<>() {
            @Override
            public MemorySessionState on(MemorySessionCreated event) {
                return new MemorySessionState(event.actorId, event.title, Status.ACTIVE, List.of(), event.createdAt, event.createdAt);
            }

            @Override
            public MemorySessionState on(MemoryEventStored event) {
                requireCreated(state, event.sessionId, event);
                var entries = new ArrayList<>(state.entries);
                entries.add(event.entry);
                return new MemorySessionState(state.actorId, state.title, state.status, entries, state.createdAt, event.entry.storedAt);
            }

            @Override
            public MemorySessionState on(MemorySessionClosed event) {
                requireCreated(state, event.sessionId, event);
                return new MemorySessionState(state.actorId, state.title, Status.CLOSED, state.entries, state.createdAt, event.closedAt);
            }
        });
    }

    private static void requireCreated(MemorySessionState state, String sessionId, MemorySessionEvent event) {
        if (state == null) {
            throw new AggregateException(msg("MemorySession '{}' cannot apply {} before it has been created", sessionId, event.getClass().getSimpleName()));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemorySessionState)) return false;
        var that = (MemorySessionState) o;
        return actorId.equals(that.actorId) &&
                title.equals(that.title) &&
                status == that.status &&
                entries.equals(that.entries) &&
                createdAt.isEqual(that.createdAt) &&
                lastActivityAt.isEqual(that.lastActivityAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(actorId, title, status, entries, createdAt.toInstant());
    }

    @Override
    public String toString() {
        return "MemorySessionState{actorId='" + actorId + "', title='" + title + "', status=" + status + ", entries=" + entries.size() + '}';
    }
}
