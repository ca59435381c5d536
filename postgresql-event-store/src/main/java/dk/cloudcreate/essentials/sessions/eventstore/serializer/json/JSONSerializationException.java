package dk.cloudcreate.essentials.sessions.eventstore.serializer.json;

import dk.cloudcreate.essentials.sessions.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
