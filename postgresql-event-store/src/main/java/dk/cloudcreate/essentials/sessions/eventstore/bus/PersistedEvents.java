package dk.cloudcreate.essentials.sessions.eventstore.bus;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Encapsulates all events persisted by a single, committed, append
 */
public final class PersistedEvents {
    public final List<StoredEvent> events;

    public PersistedEvents(List<StoredEvent> events) {
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    @Override
    public String toString() {
        return "PersistedEvents{" +
                "events=" + events.size() +
                '}';
    }
}
