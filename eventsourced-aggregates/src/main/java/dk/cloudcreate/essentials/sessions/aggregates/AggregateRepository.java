package dk.cloudcreate.essentials.sessions.aggregates;

import dk.cloudcreate.essentials.sessions.eventstore.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import org.slf4j.*;

import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Loads and saves aggregates of one {@link AggregateType} using an {@link EventStore} and an {@link AggregateReconstructor}.<br>
 * The stream id of an aggregate is the {@link Object#toString()} of its id.
 * <p>
 * Typical usage:
 * <pre>{@code
 * var session = repository.load(sessionId);
 * session.archive();
 * repository.save(session);
 * }</pre>
 *
 * @param <ID> the aggregate id type
 * @param <A>  the aggregate type
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class AggregateRepository<ID, A extends Aggregate<ID, ?>> {
    private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

    private final EventStore             eventStore;
    private final AggregateReconstructor reconstructor;
    private final AggregateType          aggregateType;

    public AggregateRepository(EventStore eventStore, AggregateReconstructor reconstructor, AggregateType aggregateType) {
        this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
        this.reconstructor = requireNonNull(reconstructor, "You must supply an AggregateReconstructor instance");
        this.aggregateType = requireNonNull(aggregateType, "You must supply an aggregateType");
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    /**
     * Try to load the aggregate with the given id
     *
     * @return the aggregate reconstructed from its stream or {@link Optional#empty()} if no events exist for it
     */
    public Optional<A> tryLoad(ID aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        log.trace("[{}] Trying to load aggregate with id '{}'", aggregateType, aggregateId);
        return eventStore.getStream(aggregateType, aggregateId.toString())
                         .map(stream -> reconstructor.<A>reconstruct(stream));
    }

    /**
     * Load the aggregate with the given id
     *
     * @throws AggregateNotFoundException if no events exist for the aggregate
     */
    public A load(ID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateType, aggregateId.toString()));
    }

    /**
     * Append the uncommitted events of the aggregate, using the version the aggregate had before the command(s) as expected version.
     * The uncommitted events are only cleared when the append succeeds.
     *
     * @return the events appended (empty if the aggregate had no uncommitted events)
     * @throws ConcurrencyException if another writer appended to the stream in the meantime. The aggregate must then be
     *                              discarded and reloaded
     */
    public List<StoredEvent> save(A aggregate) {
        return save(aggregate, Optional.empty());
    }

    /**
     * Append the uncommitted events of the aggregate, using the version the aggregate had before the command(s) as expected version.
     * The uncommitted events are only cleared when the append succeeds.
     *
     * @param metadata the metadata shared by all the appended events
     * @return the events appended (empty if the aggregate had no uncommitted events)
     * @throws ConcurrencyException if another writer appended to the stream in the meantime. The aggregate must then be
     *                              discarded and reloaded
     */
    public List<StoredEvent> save(A aggregate, Optional<EventMetadata> metadata) {
        requireNonNull(aggregate, "No aggregate provided");
        requireNonNull(metadata, "No metadata option provided");
        var uncommittedEvents = aggregate.getUncommittedEvents();
        if (uncommittedEvents.isEmpty()) {
            log.trace("[{}] No changes detected for aggregate '{}'", aggregateType, aggregate.aggregateId());
            return List.of();
        }
        var expectedVersion = aggregate.version() - uncommittedEvents.size();
        log.debug("[{}] Persisting {} event(s) for aggregate '{}' with expectedVersion {}",
                  aggregateType, uncommittedEvents.size(), aggregate.aggregateId(), expectedVersion);
        var storedEvents = eventStore.append(aggregateType,
                                             aggregate.aggregateId().toString(),
                                             expectedVersion,
                                             uncommittedEvents,
                                             metadata);
        aggregate.clearUncommittedEvents();
        return storedEvents;
    }

    @Override
    public String toString() {
        return "AggregateRepository{" +
                "aggregateType=" + aggregateType +
                '}';
    }
}
