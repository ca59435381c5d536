package dk.cloudcreate.essentials.sessions.eventstore.serializer.json;

import dk.cloudcreate.essentials.sessions.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
