package dk.cloudcreate.essentials.sessions.eventstore;

import dk.cloudcreate.essentials.sessions.eventstore.bus.EventStoreLocalEventBus;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Stream;

/**
 * Append-only store of events keyed by ({@link AggregateType}, aggregateId, version) with optimistic concurrency control.<br>
 * <br>
 * Every aggregate has its own event stream, where the first event has version 1 and every following event has
 * the version of the previous event + 1. Version 0 denotes an aggregate with no history.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public interface EventStore {
    /**
     * Append events to the stream of an aggregate. Either all events are persisted, with versions
     * <code>expectedVersion+1 ... expectedVersion+N</code>, or none are.<br>
     * The metadata of every appended event originates from the event itself (see {@link EventMetadata#originatingFrom(String)})
     *
     * @param aggregateType   the type of aggregate
     * @param aggregateId     the id of the aggregate
     * @param expectedVersion the version of the stream the events were produced against (0 if the stream doesn't exist)
     * @param events          the events to append. An empty list is a no-op
     * @return the {@link StoredEvent}'s appended
     * @throws ConcurrencyException if the stream version isn't <code>expectedVersion</code> at the time of the write
     */
    default List<StoredEvent> append(AggregateType aggregateType,
                                     String aggregateId,
                                     long expectedVersion,
                                     List<?> events) {
        return append(aggregateType, aggregateId, expectedVersion, events, Optional.empty());
    }

    /**
     * Append events to the stream of an aggregate. Either all events are persisted, with versions
     * <code>expectedVersion+1 ... expectedVersion+N</code>, or none are.
     *
     * @param aggregateType   the type of aggregate
     * @param aggregateId     the id of the aggregate
     * @param expectedVersion the version of the stream the events were produced against (0 if the stream doesn't exist)
     * @param events          the events to append. An empty list is a no-op
     * @param metadata        the metadata shared by all the events. If empty, each event's metadata originates from the event itself
     * @return the {@link StoredEvent}'s appended
     * @throws ConcurrencyException if the stream version isn't <code>expectedVersion</code> at the time of the write
     */
    List<StoredEvent> append(AggregateType aggregateType,
                             String aggregateId,
                             long expectedVersion,
                             List<?> events,
                             Optional<EventMetadata> metadata);

    /**
     * @return all events of the aggregate ordered by ascending version, or {@link Optional#empty()} if no events exist
     */
    Optional<EventStream> getStream(AggregateType aggregateType, String aggregateId);

    /**
     * @return the events of the aggregate with a version strictly greater than <code>version</code>, ordered by ascending version
     */
    List<StoredEvent> getEventsAfterVersion(AggregateType aggregateType, String aggregateId, long version);

    /**
     * @return the version of the last event persisted for the aggregate or 0 if none exist
     */
    long getCurrentVersion(AggregateType aggregateType, String aggregateId);

    /**
     * Lazily stream all events across all aggregates, used to rebuild read models.<br>
     * Only the per aggregate version order is guaranteed. No order across aggregates is guaranteed.<br>
     * The returned {@link Stream} holds resources and MUST be closed by the consumer.
     *
     * @param afterTimestamp only include events with a timestamp strictly after this watermark
     * @return the events
     */
    Stream<StoredEvent> scanAllEvents(Optional<OffsetDateTime> afterTimestamp);

    /**
     * Bus that publishes every committed append
     */
    EventStoreLocalEventBus localEventBus();
}
