package dk.cloudcreate.essentials.sessions.projection;

import dk.cloudcreate.essentials.sessions.common.Lifecycle;
import dk.cloudcreate.essentials.sessions.eventstore.bus.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;
import dk.cloudcreate.essentials.sessions.projection.deadletter.*;
import org.slf4j.*;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.stream.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Drives a set of {@link Projector}s from live event feeds or from the full historical log.<br>
 * A failing projector never affects the other projectors, nor the caller: the failure is logged and the event
 * is sent to the {@link DeadLetterChannel}.
 * <p>
 * Live feeds (see {@link #subscribeTo(Flux)} and {@link #subscribeTo(EventStoreLocalEventBus, boolean)}) are only
 * consumed while the runner is started.
 */
public final class ProjectorRunner implements Lifecycle {
    private static final Logger log = LoggerFactory.getLogger(ProjectorRunner.class);

    private final List<Projector>                 projectors;
    private final DeadLetterChannel               deadLetterChannel;
    private final List<Flux<StoredEvent>>         liveFeeds         = new CopyOnWriteArrayList<>();
    private final List<Disposable>                liveSubscriptions = new CopyOnWriteArrayList<>();
    private final Consumer<PersistedEvents>       localEventBusSubscriber;
    private       EventStoreLocalEventBus         localEventBus;
    private       boolean                         synchronousLocalEventBusSubscription;
    private volatile boolean                      started;

    public ProjectorRunner(List<? extends Projector> projectors, DeadLetterChannel deadLetterChannel) {
        this.projectors = List.copyOf(requireNonNull(projectors, "You must supply the projectors"));
        this.deadLetterChannel = requireNonNull(deadLetterChannel, "You must supply a DeadLetterChannel");
        var names = this.projectors.stream().map(Projector::name).collect(Collectors.toList());
        checkArgument(new HashSet<>(names).size() == names.size(), msg("Projector names must be unique: {}", names));
        this.localEventBusSubscriber = persistedEvents -> persistedEvents.events.forEach(this::processEvent);
    }

    public List<Projector> projectors() {
        return projectors;
    }

    /**
     * Fan the event out to every projector
     *
     * @param event the event
     * @return the number of projectors that failed to project the event
     */
    public int processEvent(StoredEvent event) {
        requireNonNull(event, "No event provided");
        var failures = 0;
        for (var projector : projectors) {
            try {
                projector.project(event);
            } catch (Exception e) {
                failures++;
                var failure = new ProjectionException(projector.name(), event, e);
                log.error(msg("[{}] Failed to project event '{}' of type '{}' ({}:{} version {})",
                              projector.name(),
                              event.eventId,
                              event.eventType(),
                              event.aggregateType,
                              event.aggregateId,
                              event.version),
                          e);
                deadLetter(failure);
            }
        }
        return failures;
    }

    private void deadLetter(ProjectionException failure) {
        try {
            deadLetterChannel.send(DeadLetterMessage.from(failure));
        } catch (Exception e) {
            log.error(msg("[{}] Failed to dead letter event '{}'", failure.projectorName, failure.event.eventId), e);
        }
    }

    /**
     * Regenerate all read models: reset every projector, then stream every event through {@link #processEvent(StoredEvent)}.
     * The events are consumed one at a time and the source is closed when done.
     *
     * @param events the full event log, e.g. <code>eventStore.scanAllEvents(Optional.empty())</code>
     * @return the number of events processed
     */
    public long rebuild(Stream<StoredEvent> events) {
        requireNonNull(events, "No events provided");
        try (events) {
            log.info("Rebuilding {} projector(s): {}", projectors.size(), projectors.stream().map(Projector::name).collect(Collectors.toList()));
            projectors.forEach(Projector::reset);
            var processed = 0L;
            var failed    = 0L;
            var iterator  = events.iterator();
            while (iterator.hasNext()) {
                if (processEvent(iterator.next()) > 0) {
                    failed++;
                }
                processed++;
            }
            log.info("Rebuild completed. Processed {} event(s), {} of which failed in one or more projectors", processed, failed);
            return processed;
        }
    }

    /**
     * Replay the dead lettered events of a projector. Events projected successfully are removed from the {@link DeadLetterChannel}
     *
     * @return the number of events successfully redelivered
     */
    public int redeliverDeadLetters(String projectorName) {
        var projector = projectors.stream()
                                  .filter(candidate -> candidate.name().equals(projectorName))
                                  .findFirst()
                                  .orElseThrow(() -> new IllegalArgumentException(msg("Unknown projector '{}'", projectorName)));
        var redelivered = 0;
        for (var message : deadLetterChannel.getDeadLetterMessages(projectorName)) {
            try {
                projector.project(message.event);
                deadLetterChannel.delete(message.id);
                redelivered++;
            } catch (Exception e) {
                log.warn(msg("[{}] Redelivery of dead lettered event '{}' failed again (attempt {})",
                             projectorName, message.event.eventId, message.deliveryAttempts + 1),
                         e);
                deadLetterChannel.recordFailedRedelivery(message.id, e);
            }
        }
        log.info("[{}] Redelivered {} dead lettered event(s)", projectorName, redelivered);
        return redelivered;
    }

    /**
     * Consume the live feed while the runner is started
     */
    public ProjectorRunner subscribeTo(Flux<StoredEvent> liveEvents) {
        requireNonNull(liveEvents, "No liveEvents provided");
        liveFeeds.add(liveEvents);
        if (started) {
            liveSubscriptions.add(subscribe(liveEvents));
        }
        return this;
    }

    /**
     * Project every batch committed to the event store while the runner is started
     *
     * @param localEventBus the bus of the event store
     * @param synchronous   if true the events are projected on the thread that committed them, otherwise asynchronously
     */
    public synchronized ProjectorRunner subscribeTo(EventStoreLocalEventBus localEventBus, boolean synchronous) {
        requireNonNull(localEventBus, "No localEventBus provided");
        checkArgument(this.localEventBus == null, "Already subscribed to a local event bus");
        this.localEventBus = localEventBus;
        this.synchronousLocalEventBusSubscription = synchronous;
        if (started) {
            addLocalEventBusSubscriber();
        }
        return this;
    }

    private Disposable subscribe(Flux<StoredEvent> liveEvents) {
        return liveEvents.subscribe(this::processEvent,
                                    error -> log.error("Live event feed failed", error));
    }

    private void addLocalEventBusSubscriber() {
        if (synchronousLocalEventBusSubscription) {
            localEventBus.addSyncSubscriber(localEventBusSubscriber);
        } else {
            localEventBus.addAsyncSubscriber(localEventBusSubscriber);
        }
    }

    @Override
    public synchronized void start() {
        if (!started) {
            log.info("Starting ProjectorRunner with {} projector(s) and {} live feed(s)", projectors.size(), liveFeeds.size() + (localEventBus != null ? 1 : 0));
            liveFeeds.forEach(liveEvents -> liveSubscriptions.add(subscribe(liveEvents)));
            if (localEventBus != null) {
                addLocalEventBusSubscriber();
            }
            started = true;
        }
    }

    @Override
    public synchronized void stop() {
        if (started) {
            log.info("Stopping ProjectorRunner");
            liveSubscriptions.forEach(Disposable::dispose);
            liveSubscriptions.clear();
            if (localEventBus != null) {
                localEventBus.removeSyncSubscriber(localEventBusSubscriber);
                localEventBus.removeAsyncSubscriber(localEventBusSubscriber);
            }
            started = false;
        }
    }

    @Override
    public boolean isStarted() {
        return started;
    }
}
