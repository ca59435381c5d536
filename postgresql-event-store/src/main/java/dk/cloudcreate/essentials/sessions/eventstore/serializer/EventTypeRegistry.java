package dk.cloudcreate.essentials.sessions.eventstore.serializer;

import com.google.common.collect.*;
import dk.cloudcreate.essentials.sessions.eventstore.EventStoreException;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;
import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * Bidirectional mapping between the <code>eventType</code> tag stored with every event and the Java class
 * the event payload is (de)serialized as.<br>
 * Events are always persisted using their tag, never their class name, so Java classes can be moved or renamed
 * without affecting the stored event log.
 */
public final class EventTypeRegistry {
    private final BiMap<String, Class<?>> eventTypes = Maps.synchronizedBiMap(HashBiMap.create());

    /**
     * Register an event type
     *
     * @param eventType the tag persisted with the event, e.g. <code>MessageAdded</code>
     * @param javaType  the Java class of the event payload
     * @return this registry
     * @throws IllegalArgumentException if the tag or the class is already registered with another counterpart
     */
    public EventTypeRegistry register(String eventType, Class<?> javaType) {
        requireNonNull(eventType, "No eventType provided");
        requireNonNull(javaType, "No javaType provided");
        checkArgument(!eventType.isBlank(), "eventType must not be blank");
        synchronized (eventTypes) {
            var existingJavaType = eventTypes.get(eventType);
            if (javaType.equals(existingJavaType)) {
                return this;
            }
            checkArgument(existingJavaType == null,
                          msg("eventType '{}' is already registered to '{}'", eventType, existingJavaType != null ? existingJavaType.getName() : null));
            checkArgument(!eventTypes.containsValue(javaType),
                          msg("'{}' is already registered as eventType '{}'", javaType.getName(), eventTypes.inverse().get(javaType)));
            eventTypes.put(eventType, javaType);
        }
        return this;
    }

    /**
     * @return the tag registered for the event's class
     * @throws EventStoreException if the class of the event isn't registered
     */
    public String eventTypeFor(Object event) {
        requireNonNull(event, "No event provided");
        var eventType = eventTypes.inverse().get(event.getClass());
        if (eventType == null) {
            throw new EventStoreException(msg("No eventType registered for '{}'", event.getClass().getName()));
        }
        return eventType;
    }

    public Optional<Class<?>> javaTypeFor(String eventType) {
        return Optional.ofNullable(eventTypes.get(requireNonNull(eventType, "No eventType provided")));
    }

    public boolean isRegistered(String eventType) {
        return eventTypes.containsKey(eventType);
    }
}
