package dk.cloudcreate.essentials.sessions.eventstore;

import dk.cloudcreate.essentials.sessions.common.transaction.*;
import dk.cloudcreate.essentials.sessions.eventstore.bus.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.persistence.*;
import org.jdbi.v3.core.ConnectionException;
import org.slf4j.*;
import reactor.core.publisher.Flux;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.*;

import static com.google.common.base.Preconditions.checkArgument;
import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * PostgreSQL backed {@link EventStore} that uses {@link SeparateTablePerAggregateTypePersistenceStrategy}.<br>
 * All operations join the {@link UnitOfWork} active on the current thread or, if there's none, run in their own {@link UnitOfWork}.
 * Appended events are published on the {@link #localEventBus()} after the {@link UnitOfWork} that persisted them has committed.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class PostgresqlEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(PostgresqlEventStore.class);

    private final JdbiUnitOfWorkFactory                            unitOfWorkFactory;
    private final SeparateTablePerAggregateTypePersistenceStrategy persistenceStrategy;
    private final EventStoreLocalEventBus                          eventStoreLocalEventBus;

    public PostgresqlEventStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                SeparateTablePerAggregateTypePersistenceStrategy persistenceStrategy) {
        this(unitOfWorkFactory, persistenceStrategy, new EventStoreLocalEventBus());
    }

    public PostgresqlEventStore(JdbiUnitOfWorkFactory unitOfWorkFactory,
                                SeparateTablePerAggregateTypePersistenceStrategy persistenceStrategy,
                                EventStoreLocalEventBus eventStoreLocalEventBus) {
        this.unitOfWorkFactory = requireNonNull(unitOfWorkFactory, "No unitOfWorkFactory provided");
        this.persistenceStrategy = requireNonNull(persistenceStrategy, "No persistenceStrategy provided");
        this.eventStoreLocalEventBus = requireNonNull(eventStoreLocalEventBus, "No eventStoreLocalEventBus provided");
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
        checkArgument(expectedVersion >= 0, "expectedVersion must be >= 0, was %s", expectedVersion);
        if (events.isEmpty()) {
            return List.of();
        }
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
            var storedEvents = persistenceStrategy.persist(unitOfWork,
                                                           aggregateType,
                                                           aggregateId,
                                                           expectedVersion,
                                                           events,
                                                           metadata);
            unitOfWork.registerLifecycleCallback(new UnitOfWorkLifecycleCallback() {
                @Override
                public void afterCommit(UnitOfWork committedUnitOfWork) {
                    eventStoreLocalEventBus.publish(new PersistedEvents(storedEvents));
                }
            });
            return storedEvents;
        });
    }

    @Override
    public Optional<EventStream> getStream(AggregateType aggregateType, String aggregateId) {
        var events = getEventsAfterVersion(aggregateType, aggregateId, 0);
        if (events.isEmpty()) {
            log.trace("[{}] No events found for aggregate with id '{}'", aggregateType, aggregateId);
            return Optional.empty();
        }
        return Optional.of(new EventStream(aggregateType, aggregateId, events));
    }

    @Override
    public List<StoredEvent> getEventsAfterVersion(AggregateType aggregateType, String aggregateId, long version) {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> persistenceStrategy.loadAggregateEvents(unitOfWork.handle(),
                                                                                                       aggregateType,
                                                                                                       aggregateId,
                                                                                                       version));
    }

    @Override
    public long getCurrentVersion(AggregateType aggregateType, String aggregateId) {
        return unitOfWorkFactory.withUnitOfWork(unitOfWork -> persistenceStrategy.loadCurrentVersion(unitOfWork.handle(),
                                                                                                      aggregateType,
                                                                                                      aggregateId));
    }

    /**
     * {@inheritDoc}
     * <br>
     * When called within an active {@link UnitOfWork} the scan uses its transaction, otherwise a dedicated read-only
     * transaction is opened and released when the returned {@link Stream} is closed.
     */
    @Override
    public Stream<StoredEvent> scanAllEvents(Optional<OffsetDateTime> afterTimestamp) {
        requireNonNull(afterTimestamp, "No afterTimestamp option provided");
        var existingUnitOfWork = unitOfWorkFactory.getCurrentUnitOfWork();
        if (existingUnitOfWork.isPresent()) {
            var handle = existingUnitOfWork.get().handle();
            return persistenceStrategy.configuredAggregateTypes()
                                      .stream()
                                      .sorted()
                                      .flatMap(aggregateType -> persistenceStrategy.scanEvents(handle, aggregateType, afterTimestamp));
        }

        var handle = unitOfWorkFactory.getJdbi().open();
        handle.begin();
        return persistenceStrategy.configuredAggregateTypes()
                                  .stream()
                                  .sorted()
                                  .flatMap(aggregateType -> persistenceStrategy.scanEvents(handle, aggregateType, afterTimestamp))
                                  .onClose(() -> {
                                      try {
                                          handle.rollback();
                                      } finally {
                                          handle.close();
                                      }
                                  });
    }

    /**
     * Create a {@link Flux} that polls for new events belonging to the given {@link AggregateType}.<br>
     * Every poll loads the events with a timestamp after the timestamp of the last event emitted.
     *
     * @param aggregateType   the aggregate type to poll
     * @param afterTimestamp  the initial watermark. If empty all events are emitted
     * @param pollingInterval the interval between polls
     * @return the polling {@link Flux}
     */
    public Flux<StoredEvent> pollEvents(AggregateType aggregateType,
                                        Optional<OffsetDateTime> afterTimestamp,
                                        Duration pollingInterval) {
        requireNonNull(aggregateType, "You must supply an aggregateType");
        requireNonNull(afterTimestamp, "You must supply an afterTimestamp option");
        requireNonNull(pollingInterval, "You must supply a pollingInterval");

        var eventStreamLogName  = "EventStream:" + aggregateType + ":" + UUID.randomUUID();
        var eventStoreStreamLog = LoggerFactory.getLogger(EventStore.class.getName() + ".PollingEventStream");
        eventStoreStreamLog.debug("[{}] Creating polling reactive '{}' EventStream with afterTimestamp {}",
                                  eventStreamLogName,
                                  aggregateType,
                                  afterTimestamp);

        var watermark = new AtomicReference<>(afterTimestamp);
        var storedEventsFlux = Flux.defer(() -> {
            List<StoredEvent> storedEvents;
            try {
                storedEvents = unitOfWorkFactory.withUnitOfWork(unitOfWork -> {
                    try (var events = persistenceStrategy.scanEvents(unitOfWork.handle(), aggregateType, watermark.get())) {
                        return events.collect(Collectors.toList());
                    }
                });
            } catch (ConnectionException e) {
                eventStoreStreamLog.debug(msg("[{}] Experienced a Postgresql Connection issue, will return an empty Flux",
                                              eventStreamLogName), e);
                return Flux.empty();
            } catch (RuntimeException e) {
                eventStoreStreamLog.error(msg("[{}] Polling failed for '{}' EventStream with watermark {}",
                                              eventStreamLogName,
                                              aggregateType,
                                              watermark.get()),
                                          e);
                return Flux.error(e);
            }
            if (storedEvents.size() > 0) {
                eventStoreStreamLog.debug("[{}] Polling using watermark {} returned {} events",
                                          eventStreamLogName,
                                          watermark.get(),
                                          storedEvents.size());
            } else {
                eventStoreStreamLog.trace("[{}] Polling using watermark {} returned no events",
                                          eventStreamLogName,
                                          watermark.get());
            }
            return Flux.fromIterable(storedEvents);
        }).doOnNext(event -> {
            if (watermark.get().map(current -> event.timestamp.isAfter(current)).orElse(true)) {
                watermark.set(Optional.of(event.timestamp));
            }
        });

        return storedEventsFlux
                .repeatWhen(repeats -> repeats.delayElements(pollingInterval));
    }

    @Override
    public EventStoreLocalEventBus localEventBus() {
        return eventStoreLocalEventBus;
    }

    public JdbiUnitOfWorkFactory getUnitOfWorkFactory() {
        return unitOfWorkFactory;
    }

    public SeparateTablePerAggregateTypePersistenceStrategy getPersistenceStrategy() {
        return persistenceStrategy;
    }
}
