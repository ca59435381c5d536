package dk.cloudcreate.essentials.sessions.eventstore.bus;

import org.slf4j.*;
import reactor.core.scheduler.*;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * In-process event bus that publishes {@link PersistedEvents} after they have been committed to the event store.<br>
 * Synchronous subscribers are called on the publishing thread, asynchronous subscribers on a Reactor {@link Scheduler}.
 * A subscriber failure is logged and never propagates back to the writer.
 */
public class EventStoreLocalEventBus {
    private static final Logger log = LoggerFactory.getLogger("EventStoreLocalEventBus");

    private final CopyOnWriteArrayList<Consumer<PersistedEvents>> syncSubscribers  = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Consumer<PersistedEvents>> asyncSubscribers = new CopyOnWriteArrayList<>();
    private final Scheduler                                       asyncScheduler;

    public EventStoreLocalEventBus() {
        this(Schedulers.newBoundedElastic(3, Integer.MAX_VALUE, "EventStoreLocalBus", 60, true));
    }

    public EventStoreLocalEventBus(Scheduler asyncScheduler) {
        this.asyncScheduler = requireNonNull(asyncScheduler, "No asyncScheduler provided");
    }

    public void publish(PersistedEvents persistedEvents) {
        requireNonNull(persistedEvents, "No persistedEvents provided");
        for (var subscriber : syncSubscribers) {
            try {
                subscriber.accept(persistedEvents);
            } catch (RuntimeException e) {
                onErrorHandler(subscriber, persistedEvents, e);
            }
        }
        for (var subscriber : asyncSubscribers) {
            asyncScheduler.schedule(() -> {
                try {
                    subscriber.accept(persistedEvents);
                } catch (RuntimeException e) {
                    onErrorHandler(subscriber, persistedEvents, e);
                }
            });
        }
    }

    private void onErrorHandler(Consumer<PersistedEvents> subscriber, PersistedEvents persistedEvents, Exception e) {
        log.error(msg("Failed to publish {} to subscriber {}", persistedEvents, subscriber.getClass().getName()), e);
    }

    public EventStoreLocalEventBus addAsyncSubscriber(Consumer<PersistedEvents> subscriber) {
        asyncSubscribers.add(requireNonNull(subscriber, "No subscriber provided"));
        return this;
    }

    public EventStoreLocalEventBus removeAsyncSubscriber(Consumer<PersistedEvents> subscriber) {
        asyncSubscribers.remove(subscriber);
        return this;
    }

    public EventStoreLocalEventBus addSyncSubscriber(Consumer<PersistedEvents> subscriber) {
        syncSubscribers.add(requireNonNull(subscriber, "No subscriber provided"));
        return this;
    }

    public EventStoreLocalEventBus removeSyncSubscriber(Consumer<PersistedEvents> subscriber) {
        syncSubscribers.remove(subscriber);
        return this;
    }
}
