package dk.cloudcreate.essentials.sessions.projection.deadletter;

import java.util.List;

/**
 * Stores events that a projector failed to project, so they aren't lost and can be redelivered once the cause has been fixed.<br>
 * A channel holds at most one message per (projector, event): sending the same failure again increments its delivery attempts.
 */
public interface DeadLetterChannel {
    void send(DeadLetterMessage message);

    /**
     * @return the dead letters of the projector, oldest first
     */
    List<DeadLetterMessage> getDeadLetterMessages(String projectorName);

    /**
     * Register that redelivering the message failed again
     *
     * @return true if the message exists
     */
    boolean recordFailedRedelivery(String id, Exception cause);

    /**
     * @return true if the message existed and was deleted
     */
    boolean delete(String id);
}
