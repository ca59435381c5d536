package dk.cloudcreate.essentials.sessions.eventstore;

/**
 * Root of all {@link EventStore} related exceptions
 */
public class EventStoreException extends RuntimeException {
    public EventStoreException(String message) {
        super(message);
    }

    public EventStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
