package dk.cloudcreate.essentials.sessions.eventstore.eventstream;

import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventTypeRegistry;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.*;

import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * The serialized payload of an event together with its <code>eventType</code> tag.<br>
 * The payload is deserialized lazily (and at most once) into the Java type registered for the <code>eventType</code>
 * in the {@link EventTypeRegistry}.
 */
public final class EventJSON {
    private final transient EventTypeRegistry eventTypeRegistry;
    private final transient JSONSerializer    jsonSerializer;
    private final           String            eventType;
    private final           String            json;
    private transient volatile Optional<Object> event;

    public EventJSON(EventTypeRegistry eventTypeRegistry, JSONSerializer jsonSerializer, String eventType, String json) {
        this.eventTypeRegistry = requireNonNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.json = requireNonNull(json, "No json provided");
    }

    public String getEventType() {
        return eventType;
    }

    public String getJson() {
        return json;
    }

    /**
     * Deserialize the payload into the Java type registered for {@link #getEventType()}
     *
     * @return the deserialized event or {@link Optional#empty()} if the <code>eventType</code> isn't registered
     * @throws JSONDeserializationException if the payload couldn't be deserialized
     */
    public Optional<Object> deserialize() {
        if (event == null) {
            event = eventTypeRegistry.javaTypeFor(eventType)
                                     .map(javaType -> jsonSerializer.deserialize(json, javaType));
        }
        return event;
    }

    /**
     * Deserialize the payload into the given Java type, regardless of the {@link EventTypeRegistry}
     */
    public <T> T deserialize(Class<T> javaType) {
        return jsonSerializer.deserialize(json, javaType);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EventJSON)) return false;
        var that = (EventJSON) o;
        return eventType.equals(that.eventType) && json.equals(that.json);
    }

    @Override
    public int hashCode() {
        return 31 * eventType.hashCode() + json.hashCode();
    }

    @Override
    public String toString() {
        return "EventJSON{" +
                "eventType='" + eventType + '\'' +
                ", json='" + json + '\'' +
                '}';
    }
}
