package dk.cloudcreate.essentials.sessions.projection.deadletter;

import com.google.common.base.Throwables;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;
import dk.cloudcreate.essentials.sessions.projection.ProjectionException;

import java.time.*;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * An event that a projector failed to project, kept for inspection and redelivery
 */
public final class DeadLetterMessage {
    public final String         id;
    public final String         projectorName;
    public final StoredEvent    event;
    public final String         lastError;
    public final OffsetDateTime addedTimestamp;
    public final int            deliveryAttempts;

    public DeadLetterMessage(String id,
                             String projectorName,
                             StoredEvent event,
                             String lastError,
                             OffsetDateTime addedTimestamp,
                             int deliveryAttempts) {
        this.id = requireNonNull(id, "No id provided");
        this.projectorName = requireNonNull(projectorName, "No projectorName provided");
        this.event = requireNonNull(event, "No event provided");
        this.lastError = lastError;
        this.addedTimestamp = requireNonNull(addedTimestamp, "No addedTimestamp provided");
        this.deliveryAttempts = deliveryAttempts;
    }

    public static DeadLetterMessage from(ProjectionException failure) {
        requireNonNull(failure, "No failure provided");
        return new DeadLetterMessage(UUID.randomUUID().toString(),
                                     failure.projectorName,
                                     failure.event,
                                     describe(failure.getCause() != null ? failure.getCause() : failure),
                                     OffsetDateTime.now(ZoneOffset.UTC),
                                     1);
    }

    static String describe(Throwable error) {
        var rootCause = Throwables.getRootCause(error);
        return rootCause.getClass().getName() + ": " + rootCause.getMessage();
    }

    DeadLetterMessage withFailedRedelivery(String lastError) {
        return new DeadLetterMessage(id, projectorName, event, lastError, addedTimestamp, deliveryAttempts + 1);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DeadLetterMessage)) return false;
        return id.equals(((DeadLetterMessage) o).id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DeadLetterMessage{" +
                "id='" + id + '\'' +
                ", projectorName='" + projectorName + '\'' +
                ", eventId='" + event.eventId + '\'' +
                ", eventType='" + event.eventType() + '\'' +
                ", addedTimestamp=" + addedTimestamp +
                ", deliveryAttempts=" + deliveryAttempts +
                ", lastError='" + lastError + '\'' +
                '}';
    }
}
