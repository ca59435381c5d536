package dk.cloudcreate.essentials.sessions.projection;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * A single {@link Projector} failed to project a single event
 */
public class ProjectionException extends RuntimeException {
    public final String      projectorName;
    public final StoredEvent event;

    public ProjectionException(String projectorName, StoredEvent event, Throwable cause) {
        super(msg("Projector '{}' failed to project event '{}' of type '{}' ({}:{} version {}): {}",
                  projectorName,
                  event.eventId,
                  event.eventType(),
                  event.aggregateType,
                  event.aggregateId,
                  event.version,
                  cause.getMessage()),
              cause);
        this.projectorName = requireNonNull(projectorName, "No projectorName provided");
        this.event = event;
    }
}
