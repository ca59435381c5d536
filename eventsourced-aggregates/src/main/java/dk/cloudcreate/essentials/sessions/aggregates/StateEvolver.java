package dk.cloudcreate.essentials.sessions.aggregates;

/**
 * Pure function that computes the next immutable state of an aggregate from the current state and an event
 *
 * @param <STATE> the aggregate state type
 * @param <EVENT> the aggregate event type
 */
@FunctionalInterface
public interface StateEvolver<STATE, EVENT> {
    /**
     * @param currentState the current state, <code>null</code> until the creation event has been applied
     * @param event        the event to apply
     * @return the new state
     */
    STATE evolve(STATE currentState, EVENT event);
}
