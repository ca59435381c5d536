package dk.cloudcreate.essentials.sessions.aggregates;

import java.util.List;

/**
 * Capability interface that every event sourced aggregate satisfies.<br>
 * Concrete aggregates compose an {@link AggregateRoot} (holding identity, state, version and the uncommitted events)
 * and delegate these methods to it, while exposing their own command methods.
 *
 * @param <ID>    the aggregate id type
 * @param <EVENT> the event type of the aggregate
 * @see AggregateRoot
 */
public interface Aggregate<ID, EVENT> {
    /**
     * The id of the aggregate (aka. the stream-id)
     */
    ID aggregateId();

    /**
     * The version of the last event applied to the aggregate, either through replay or through a command.
     * 0 if no events have been applied
     */
    long version();

    /**
     * The events applied by command methods that haven't been persisted yet, in the order they were applied
     *
     * @return an immutable snapshot
     */
    List<EVENT> getUncommittedEvents();

    /**
     * Mark the uncommitted events as persisted. Only call this after the events were appended successfully
     */
    void clearUncommittedEvents();

    /**
     * Replay previously persisted events through the same state evolution used by command methods.
     * Replayed events are not recorded as uncommitted.
     *
     * @param events      the aggregate history in ascending version order
     * @param lastVersion the version of the last event in <code>events</code>
     */
    void loadFromHistory(List<EVENT> events, long lastVersion);
}
