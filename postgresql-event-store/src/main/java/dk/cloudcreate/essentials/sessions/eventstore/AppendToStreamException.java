package dk.cloudcreate.essentials.sessions.eventstore;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String message, Throwable cause) {
        super(message, cause);
    }
}
