package dk.cloudcreate.essentials.sessions.eventstore.serializer;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.*;

import java.time.*;
import java.time.temporal.ChronoUnit;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * Turns raw domain events into {@link StoredEvent}'s and maps persisted JSON back into {@link EventJSON} / {@link EventMetadata}
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class EventSerializer {
    private final EventTypeRegistry eventTypeRegistry;
    private final JSONSerializer    jsonSerializer;
    private final Clock             clock;

    public EventSerializer(EventTypeRegistry eventTypeRegistry, JSONSerializer jsonSerializer) {
        this(eventTypeRegistry, jsonSerializer, Clock.systemUTC());
    }

    public EventSerializer(EventTypeRegistry eventTypeRegistry, JSONSerializer jsonSerializer, Clock clock) {
        this.eventTypeRegistry = requireNonNull(eventTypeRegistry, "No eventTypeRegistry provided");
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.clock = requireNonNull(clock, "No clock provided");
    }

    public EventTypeRegistry eventTypeRegistry() {
        return eventTypeRegistry;
    }

    /**
     * Create the {@link StoredEvent} for a raw event that is about to be persisted.<br>
     * The timestamp is truncated to microseconds, the precision kept by the database.
     * The resulting {@link EventJSON} only holds the serialized payload, so readers always get an instance rebuilt from JSON.
     *
     * @throws dk.cloudcreate.essentials.sessions.eventstore.EventStoreException if the event type isn't registered
     */
    public StoredEvent toStoredEvent(AggregateType aggregateType,
                                     String aggregateId,
                                     Object event,
                                     long version,
                                     Optional<EventMetadata> metadata) {
        requireNonNull(event, "No event provided");
        var eventType = eventTypeRegistry.eventTypeFor(event);
        var eventId   = UUID.randomUUID().toString();
        return new StoredEvent(eventId,
                               aggregateId,
                               aggregateType,
                               toEventJSON(eventType, jsonSerializer.serialize(event)),
                               metadata.orElseGet(() -> EventMetadata.originatingFrom(eventId)),
                               version,
                               OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS));
    }

    public EventJSON toEventJSON(String eventType, String json) {
        return new EventJSON(eventTypeRegistry, jsonSerializer, eventType, json);
    }

    public String serializeMetadata(EventMetadata metadata) {
        return jsonSerializer.serialize(metadata);
    }

    public EventMetadata deserializeMetadata(String json) {
        return jsonSerializer.deserialize(json, EventMetadata.class);
    }
}
