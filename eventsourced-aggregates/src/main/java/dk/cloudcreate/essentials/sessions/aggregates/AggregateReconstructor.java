package dk.cloudcreate.essentials.sessions.aggregates;

import dk.cloudcreate.essentials.sessions.eventstore.AggregateNotFoundException;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import org.slf4j.*;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Replays a stored event stream into a live aggregate instance.<br>
 * Every {@link AggregateType} is registered with the {@link AggregateFactory} that creates an empty instance and the
 * base type of its events. Reconstruction is deterministic: the same events always produce an aggregate with the same state.
 */
public final class AggregateReconstructor {
    private static final Logger log = LoggerFactory.getLogger(AggregateReconstructor.class);

    private final ConcurrentHashMap<AggregateType, Registration<?, ?>> registrations = new ConcurrentHashMap<>();

    /**
     * Register how to reconstruct aggregates of the given type
     *
     * @param aggregateType the aggregate type
     * @param eventType     the base type every event of the aggregate implements
     * @param factory       creates an empty aggregate instance
     * @return this reconstructor
     */
    public <EVENT, A extends Aggregate<?, EVENT>> AggregateReconstructor register(AggregateType aggregateType,
                                                                                  Class<EVENT> eventType,
                                                                                  AggregateFactory<A> factory) {
        requireNonNull(aggregateType, "No aggregateType provided");
        var previous = registrations.putIfAbsent(aggregateType, new Registration<>(eventType, factory));
        checkArgument(previous == null, msg("AggregateType '{}' is already registered", aggregateType));
        log.debug("Registered AggregateType '{}' with event type '{}'", aggregateType, eventType.getName());
        return this;
    }

    public boolean isRegistered(AggregateType aggregateType) {
        return registrations.containsKey(aggregateType);
    }

    /**
     * Reconstruct an aggregate from its event stream
     *
     * @param stream the event stream
     * @return the aggregate with its version set to the version of the stream and no uncommitted events
     * @throws AggregateNotFoundException if the stream contains no events
     * @throws AggregateException         if the stream contains an event the aggregate doesn't know
     */
    public <A extends Aggregate<?, ?>> A reconstruct(EventStream stream) {
        requireNonNull(stream, "No stream provided");
        return reconstruct(stream.aggregateType, stream.aggregateId, stream.events);
    }

    /**
     * Reconstruct an aggregate from the given events
     *
     * @param aggregateType the type of aggregate
     * @param aggregateId   the id of the aggregate
     * @param events        the events of the aggregate in ascending version order, starting with version 1
     * @return the aggregate with its version set to the version of the last event and no uncommitted events
     * @throws AggregateNotFoundException if <code>events</code> is empty
     * @throws AggregateException         if <code>events</code> contains an event the aggregate doesn't know
     */
    @SuppressWarnings("unchecked")
    public <A extends Aggregate<?, ?>> A reconstruct(AggregateType aggregateType, String aggregateId, List<StoredEvent> events) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(events, "No events provided");
        if (events.isEmpty()) {
            throw new AggregateNotFoundException(aggregateType, aggregateId);
        }
        return (A) registrationFor(aggregateType).reconstruct(aggregateType, aggregateId, events);
    }

    private Registration<?, ?> registrationFor(AggregateType aggregateType) {
        var registration = registrations.get(requireNonNull(aggregateType, "No aggregateType provided"));
        if (registration == null) {
            throw new AggregateException(msg("No aggregate has been registered for AggregateType '{}'", aggregateType));
        }
        return registration;
    }

    private static final class Registration<EVENT, A extends Aggregate<?, EVENT>> {
        private final Class<EVENT>        eventType;
        private final AggregateFactory<A> factory;

        private Registration(Class<EVENT> eventType, AggregateFactory<A> factory) {
            this.eventType = requireNonNull(eventType, "No eventType provided");
            this.factory = requireNonNull(factory, "No factory provided");
        }

        private A reconstruct(AggregateType aggregateType, String aggregateId, List<StoredEvent> storedEvents) {
            var events          = new ArrayList<EVENT>(storedEvents.size());
            var expectedVersion = 1L;
            for (var storedEvent : storedEvents) {
                if (!storedEvent.aggregateId.equals(aggregateId) || !storedEvent.aggregateType.equals(aggregateType)) {
                    throw new AggregateException(msg("[{}] Event '{}' belongs to aggregate '{}' and not '{}'",
                                                     aggregateType, storedEvent.eventId, storedEvent.aggregateId, aggregateId));
                }
                if (storedEvent.version != expectedVersion) {
                    throw new AggregateException(msg("[{}:{}] Expected an event with version {} but found version {}",
                                                     aggregateType, aggregateId, expectedVersion, storedEvent.version));
                }
                events.add(deserialize(aggregateType, aggregateId, storedEvent));
                expectedVersion++;
            }
            var aggregate = factory.newInstance(aggregateId);
            aggregate.loadFromHistory(events, storedEvents.get(storedEvents.size() - 1).version);
            log.trace("[{}:{}] Reconstructed aggregate at version {}", aggregateType, aggregateId, aggregate.version());
            return aggregate;
        }

        private EVENT deserialize(AggregateType aggregateType, String aggregateId, StoredEvent storedEvent) {
            var event = storedEvent.eventData.deserialize()
                                             .orElseThrow(() -> new AggregateException(msg("[{}:{}] Cannot reconstruct aggregate as event type '{}' (version {}) is unknown",
                                                                                           aggregateType, aggregateId, storedEvent.eventType(), storedEvent.version)));
            if (!eventType.isInstance(event)) {
                throw new AggregateException(msg("[{}:{}] Event type '{}' (version {}) is a '{}' and not a '{}'",
                                                 aggregateType, aggregateId, storedEvent.eventType(), storedEvent.version,
                                                 event.getClass().getName(), eventType.getName()));
            }
            return eventType.cast(event);
        }
    }
}
