package dk.cloudcreate.essentials.sessions.eventstore.inmemory;

import dk.cloudcreate.essentials.sessions.eventstore.*;
import dk.cloudcreate.essentials.sessions.eventstore.bus.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventSerializer;
import org.slf4j.*;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.*;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * {@link EventStore} that keeps every event stream in memory.<br>
 * The compare-and-append of a stream is atomic per aggregate ({@link ConcurrentHashMap#compute}), so it offers the same
 * optimistic concurrency guarantees as the PostgreSQL backed store. Event payloads are still serialized to JSON,
 * which guarantees they round-trip exactly like they would in a persistent store.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<AggregateType, ConcurrentMap<String, List<StoredEvent>>> streams = new ConcurrentHashMap<>();
    private final EventSerializer                                                        eventSerializer;
    private final EventStoreLocalEventBus                                                localEventBus;

    public InMemoryEventStore(EventSerializer eventSerializer) {
        this(eventSerializer, new EventStoreLocalEventBus());
    }

    public InMemoryEventStore(EventSerializer eventSerializer, EventStoreLocalEventBus localEventBus) {
        this.eventSerializer = requireNonNull(eventSerializer, "No eventSerializer provided");
        this.localEventBus = requireNonNull(localEventBus, "No localEventBus provided");
    }

    @Override
    public List<StoredEvent> append(AggregateType aggregateType,
                                    String aggregateId,
                                    long expectedVersion,
                                    List<?> events,
                                    Optional<EventMetadata> metadata) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(events, "No events provided");
        requireNonNull(metadata, "No metadata option provided");
        checkArgument(expectedVersion >= 0, "expectedVersion must be >= 0, was %s", expectedVersion);
        if (events.isEmpty()) {
            return List.of();
        }

        var storedEvents = new ArrayList<StoredEvent>(events.size());
        var nextVersion  = expectedVersion;
        for (var event : events) {
            storedEvents.add(eventSerializer.toStoredEvent(aggregateType, aggregateId, event, ++nextVersion, metadata));
        }

        streamsOf(aggregateType).compute(aggregateId, (id, existingEvents) -> {
            var actualVersion = existingEvents == null ? 0 : existingEvents.get(existingEvents.size() - 1).version;
            if (actualVersion != expectedVersion) {
                throw new ConcurrencyException(aggregateType, aggregateId, expectedVersion, actualVersion);
            }
            var updatedEvents = new ArrayList<StoredEvent>(existingEvents == null ? List.of() : existingEvents);
            updatedEvents.addAll(storedEvents);
            return List.copyOf(updatedEvents);
        });
        log.debug("[{}] Appended {} event(s) to aggregate with id '{}' after version {}",
                  aggregateType,
                  storedEvents.size(),
                  aggregateId,
                  expectedVersion);

        var appended = List.copyOf(storedEvents);
        localEventBus.publish(new PersistedEvents(appended));
        return appended;
    }

    @Override
    public Optional<EventStream> getStream(AggregateType aggregateType, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return Optional.ofNullable(streamsOf(aggregateType).get(aggregateId))
                       .map(events -> new EventStream(aggregateType, aggregateId, events));
    }

    @Override
    public List<StoredEvent> getEventsAfterVersion(AggregateType aggregateType, String aggregateId, long version) {
        requireNonNull(aggregateId, "No aggregateId provided");
        return streamsOf(aggregateType).getOrDefault(aggregateId, List.of())
                                       .stream()
                                       .filter(event -> event.version > version)
                                       .collect(Collectors.toUnmodifiableList());
    }

    @Override
    public long getCurrentVersion(AggregateType aggregateType, String aggregateId) {
        requireNonNull(aggregateId, "No aggregateId provided");
        var events = streamsOf(aggregateType).get(aggregateId);
        return events == null ? 0 : events.get(events.size() - 1).version;
    }

    @Override
    public Stream<StoredEvent> scanAllEvents(Optional<OffsetDateTime> afterTimestamp) {
        requireNonNull(afterTimestamp, "No afterTimestamp option provided");
        return streams.values()
                      .stream()
                      .flatMap(streamsOfAggregateType -> streamsOfAggregateType.values().stream())
                      .flatMap(List::stream)
                      .filter(event -> afterTimestamp.map(watermark -> event.timestamp.isAfter(watermark)).orElse(true));
    }

    @Override
    public EventStoreLocalEventBus localEventBus() {
        return localEventBus;
    }

    private ConcurrentMap<String, List<StoredEvent>> streamsOf(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return streams.computeIfAbsent(aggregateType, type -> new ConcurrentHashMap<>());
    }
}
