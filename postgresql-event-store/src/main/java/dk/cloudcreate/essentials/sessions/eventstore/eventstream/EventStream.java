package dk.cloudcreate.essentials.sessions.eventstore.eventstream;

import java.util.List;

import static com.google.common.base.Preconditions.checkArgument;
import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * All events persisted for a single aggregate ordered by ascending {@link StoredEvent#version}
 */
public final class EventStream {
    public final AggregateType     aggregateType;
    public final String            aggregateId;
    public final List<StoredEvent> events;

    public EventStream(AggregateType aggregateType, String aggregateId, List<StoredEvent> events) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
        for (var index = 0; index < this.events.size(); index++) {
            var event = this.events.get(index);
            checkArgument(event.aggregateId.equals(aggregateId),
                          msg("Event '{}' belongs to aggregate '{}' and not '{}'", event.eventId, event.aggregateId, aggregateId));
            if (index > 0) {
                checkArgument(event.version > this.events.get(index - 1).version,
                              msg("Events for aggregate '{}' must be in ascending version order", aggregateId));
            }
        }
    }

    /**
     * @return the version of the last event or 0 if the stream is empty
     */
    public long version() {
        return events.isEmpty() ? 0 : events.get(events.size() - 1).version;
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public String toString() {
        return "EventStream{" +
                "aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", version=" + version() +
                ", events=" + events.size() +
                '}';
    }
}
