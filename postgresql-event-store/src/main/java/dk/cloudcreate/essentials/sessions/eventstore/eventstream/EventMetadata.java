package dk.cloudcreate.essentials.sessions.eventstore.eventstream;

import com.fasterxml.jackson.annotation.*;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Causality and tracing information stored alongside every event
 */
public final class EventMetadata {
    /**
     * Identifies the whole causal chain, e.g. the originating request
     */
    public final String           correlationId;
    /**
     * Identifies the command or event that directly caused the event
     */
    public final String           causationId;
    public final Optional<String> userId;
    public final Optional<String> traceId;

    @JsonCreator
    public EventMetadata(@JsonProperty("correlationId") String correlationId,
                         @JsonProperty("causationId") String causationId,
                         @JsonProperty("userId") String userId,
                         @JsonProperty("traceId") String traceId) {
        this.correlationId = requireNonNull(correlationId, "No correlationId provided");
        this.causationId = requireNonNull(causationId, "No causationId provided");
        this.userId = Optional.ofNullable(userId);
        this.traceId = Optional.ofNullable(traceId);
    }

    public static EventMetadata of(String correlationId, String causationId) {
        return new EventMetadata(correlationId, causationId, null, null);
    }

    /**
     * Metadata for an event that starts a new causal chain: both the correlation and causation id
     * are the id of the event itself
     */
    public static EventMetadata originatingFrom(String eventId) {
        return of(eventId, eventId);
    }

    public EventMetadata withUserId(String userId) {
        return new EventMetadata(correlationId, causationId, userId, traceId.orElse(null));
    }

    public EventMetadata withTraceId(String traceId) {
        return new EventMetadata(correlationId, causationId, userId.orElse(null), traceId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventMetadata)) return false;
        var that = (EventMetadata) o;
        return correlationId.equals(that.correlationId) &&
                causationId.equals(that.causationId) &&
                userId.equals(that.userId) &&
                traceId.equals(that.traceId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlationId, causationId, userId, traceId);
    }

    @Override
    public String toString() {
        return "EventMetadata{" +
                "correlationId='" + correlationId + '\'' +
                ", causationId='" + causationId + '\'' +
                ", userId=" + userId +
                ", traceId=" + traceId +
                '}';
    }
}
