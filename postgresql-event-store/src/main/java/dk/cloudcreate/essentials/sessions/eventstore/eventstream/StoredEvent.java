package dk.cloudcreate.essentials.sessions.eventstore.eventstream;

import java.time.OffsetDateTime;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * The envelope of an event persisted in the {@link dk.cloudcreate.essentials.sessions.eventstore.EventStore}.<br>
 * For a given <code>aggregateId</code> no two {@link StoredEvent}'s share the same {@link #version}, and versions
 * are contiguous starting at 1.
 */
public final class StoredEvent {
    public final String         eventId;
    public final String         aggregateId;
    public final AggregateType  aggregateType;
    public final EventJSON      eventData;
    public final EventMetadata  metadata;
    public final long           version;
    public final OffsetDateTime timestamp;

    public StoredEvent(String eventId,
                       String aggregateId,
                       AggregateType aggregateType,
                       EventJSON eventData,
                       EventMetadata metadata,
                       long version,
                       OffsetDateTime timestamp) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.eventData = requireNonNull(eventData, "No eventData provided");
        this.metadata = requireNonNull(metadata, "No metadata provided");
        checkArgument(version >= 1, "version must be >= 1, was %s", version);
        this.version = version;
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    /**
     * Shorthand for <code>eventData.getEventType()</code>
     */
    public String eventType() {
        return eventData.getEventType();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StoredEvent)) return false;
        var that = (StoredEvent) o;
        return version == that.version &&
                eventId.equals(that.eventId) &&
                aggregateId.equals(that.aggregateId) &&
                aggregateType.equals(that.aggregateType) &&
                eventData.equals(that.eventData) &&
                metadata.equals(that.metadata) &&
                timestamp.isEqual(that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId, aggregateId, aggregateType, version);
    }

    @Override
    public String toString() {
        return "StoredEvent{" +
                "eventId='" + eventId + '\'' +
                ", aggregateType=" + aggregateType +
                ", aggregateId='" + aggregateId + '\'' +
                ", eventType='" + eventType() + '\'' +
                ", version=" + version +
                ", timestamp=" + timestamp +
                ", metadata=" + metadata +
                '}';
    }
}
