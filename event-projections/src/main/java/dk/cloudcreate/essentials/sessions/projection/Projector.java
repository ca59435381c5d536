package dk.cloudcreate.essentials.sessions.projection;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;

/**
 * Maps stored events into mutations of the read models the projector owns.<br>
 * Implementations must:
 * <ul>
 *     <li>be idempotent: projecting the same {@link StoredEvent#eventId} again must leave the read models unchanged</li>
 *     <li>ignore events with an event type they don't know</li>
 *     <li>be thread safe, as the {@link ProjectorRunner} may receive events from more than one feed</li>
 * </ul>
 */
public interface Projector {
    /**
     * Unique name of the projector, used for logging and dead letters
     */
    String name();

    /**
     * Apply the event to the read models
     *
     * @param event the event
     */
    void project(StoredEvent event);

    /**
     * Remove every read model owned by this projector. Called before a rebuild
     */
    void reset();
}
