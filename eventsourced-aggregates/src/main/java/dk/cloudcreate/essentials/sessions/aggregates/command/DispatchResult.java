package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;

import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Outcome of a successfully dispatched {@link Command}
 */
public final class DispatchResult {
    /**
     * The version of the aggregate after the command. Equals the previous version if the command produced no events
     */
    public final long              producedVersion;
    public final List<StoredEvent> events;
    /**
     * Number of attempts it took, 1 when no concurrency conflict occurred
     */
    public final int               attempts;

    public DispatchResult(long producedVersion, List<StoredEvent> events, int attempts) {
        this.producedVersion = producedVersion;
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        this.attempts = attempts;
    }

    @Override
    public String toString() {
        return "DispatchResult{" +
                "producedVersion=" + producedVersion +
                ", events=" + events.size() +
                ", attempts=" + attempts +
                '}';
    }
}
