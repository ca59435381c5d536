package dk.cloudcreate.essentials.sessions.eventstore;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * Thrown by {@link EventStore#append(AggregateType, String, long, java.util.List)} when the stream of the aggregate
 * has been advanced past the <code>expectedVersion</code> by another writer. Nothing from the failed batch is stored.<br>
 * The correct reaction is to reload the aggregate from the now current stream and re-apply the command.
 */
public class ConcurrencyException extends EventStoreException {
    public final AggregateType aggregateType;
    public final String        aggregateId;
    public final long          expectedVersion;
    public final long          actualVersion;

    public ConcurrencyException(AggregateType aggregateType, String aggregateId, long expectedVersion, long actualVersion) {
        this(aggregateType, aggregateId, expectedVersion, actualVersion, null);
    }

    public ConcurrencyException(AggregateType aggregateType, String aggregateId, long expectedVersion, long actualVersion, Throwable cause) {
        super(msg("[{}] Concurrency conflict for aggregate {}: expected version {}, actual {}",
                  aggregateType,
                  aggregateId,
                  expectedVersion,
                  actualVersion),
              cause);
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
}
