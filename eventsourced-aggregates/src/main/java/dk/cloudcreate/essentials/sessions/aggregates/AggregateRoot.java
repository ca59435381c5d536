package dk.cloudcreate.essentials.sessions.aggregates;

import java.util.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Holds the identity, immutable state, version and uncommitted events of a single aggregate instance.<br>
 * Concrete aggregates own an instance of this class and call {@link #apply(Object)} from their command methods.
 * State is only ever changed by running an event through the {@link StateEvolver}, both for new events
 * and for replayed history, so a reconstructed aggregate always ends up in the same state as the live one.
 * <p>
 * Example:
 * <pre>{@code
 * public final class Order implements Aggregate<OrderId, OrderEvent> {
 *     private final AggregateRoot<OrderId, OrderEvent, OrderState> root;
 *
 *     public Order(OrderId orderId) {
 *         root = new AggregateRoot<>(orderId, OrderState::evolve);
 *     }
 *
 *     public void accept() {
 *         if (root.state().accepted) {
 *             return;
 *         }
 *         root.apply(new OrderEvent.OrderAccepted(root.aggregateId()));
 *     }
 *     ...
 * }
 * }</pre>
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the aggregate event type
 * @param <STATE> the immutable aggregate state type
 */
public final class AggregateRoot<ID, EVENT, STATE> implements Aggregate<ID, EVENT> {
    private final ID                         aggregateId;
    private final StateEvolver<STATE, EVENT> stateEvolver;
    private       STATE                      state;
    private       long                       version;
    private       List<EVENT>                uncommittedEvents;
    private       boolean                    hasBeenRehydrated;

    public AggregateRoot(ID aggregateId, StateEvolver<STATE, EVENT> stateEvolver) {
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.stateEvolver = requireNonNull(stateEvolver, "You must supply a stateEvolver");
        this.uncommittedEvents = new ArrayList<>();
    }

    /**
     * Apply a new event: evolve the state, increment the version by one and record the event as uncommitted
     *
     * @param event the event to apply
     */
    public void apply(EVENT event) {
        requireNonNull(event, "You must supply an event");
        state = evolve(event);
        version++;
        uncommittedEvents.add(event);
    }

    @Override
    public void loadFromHistory(List<EVENT> events, long lastVersion) {
        requireNonNull(events, "You must supply the events");
        checkArgument(uncommittedEvents.isEmpty(), "Cannot load history into an aggregate with uncommitted events");
        checkArgument(lastVersion == version + events.size(),
                      msg("Aggregate '{}' at version {} cannot replay {} event(s) ending at version {}",
                          aggregateId, version, events.size(), lastVersion));
        events.forEach(event -> state = evolve(requireNonNull(event, "History contains a null event")));
        version = lastVersion;
        hasBeenRehydrated = true;
    }

    private STATE evolve(EVENT event) {
        return requireNonNull(stateEvolver.evolve(state, event),
                              msg("Evolving aggregate '{}' with '{}' returned no state", aggregateId, event.getClass().getName()));
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    @Override
    public long version() {
        return version;
    }

    /**
     * The current state
     *
     * @throws IllegalStateException if no event has been applied yet
     */
    public STATE state() {
        if (state == null) {
            throw new IllegalStateException(msg("Aggregate '{}' has no state, as no events have been applied to it", aggregateId));
        }
        return state;
    }

    /**
     * Has any event, historic or new, been applied
     */
    public boolean hasState() {
        return state != null;
    }

    /**
     * Was the aggregate initialized with {@link #loadFromHistory(List, long)}
     */
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    @Override
    public List<EVENT> getUncommittedEvents() {
        return List.copyOf(uncommittedEvents);
    }

    @Override
    public void clearUncommittedEvents() {
        uncommittedEvents = new ArrayList<>();
    }

    @Override
    public String toString() {
        return "AggregateRoot{" +
                "aggregateId=" + aggregateId +
                ", version=" + version +
                ", uncommittedEvents=" + uncommittedEvents.size() +
                ", state=" + state +
                '}';
    }
}
