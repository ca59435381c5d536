package dk.cloudcreate.essentials.sessions.eventstore;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an aggregate is requested but no events exist for it. An aggregate only exists once its
 * creation event has been persisted.
 */
public class AggregateNotFoundException extends EventStoreException {
    public final String        aggregateId;
    public final AggregateType aggregateType;

    public AggregateNotFoundException(AggregateType aggregateType, String aggregateId) {
        super(msg("Couldn't find an aggregate with Id '{}' belonging to the aggregateType '{}'",
                  aggregateId,
                  aggregateType));
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
    }
}
