package dk.cloudcreate.essentials.sessions.eventstore.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventTypeRegistry;

import java.time.OffsetDateTime;
import java.time.format.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * Converts a {@link StoredEvent} to and from the JSON envelope shared with external collaborators:
 * <pre>{@code
 * {
 *   "eventId": "...", "aggregateId": "...", "aggregateType": "ChatSession", "eventType": "MessageAdded",
 *   "eventData": { ... },
 *   "metadata": { "correlationId": "...", "causationId": "...", "userId": "...", "traceId": "..." },
 *   "version": 2,
 *   "timestamp": "2024-05-01T10:15:30.123456Z"
 * }
 * }</pre>
 */
public class StoredEventJSONCodec {
    private final ObjectMapper          objectMapper;
    private final JacksonJSONSerializer jsonSerializer;
    private final EventTypeRegistry     eventTypeRegistry;

    public StoredEventJSONCodec(JacksonJSONSerializer jsonSerializer, EventTypeRegistry eventTypeRegistry) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.objectMapper = jsonSerializer.getObjectMapper();
        this.eventTypeRegistry = requireNonNull(eventTypeRegistry, "No eventTypeRegistry provided");
    }

    public String toJSON(StoredEvent event) {
        requireNonNull(event, "No event provided");
        var envelope = objectMapper.createObjectNode();
        envelope.put("eventId", event.eventId);
        envelope.put("aggregateId", event.aggregateId);
        envelope.put("aggregateType", event.aggregateType.value());
        envelope.put("eventType", event.eventType());
        try {
            envelope.set("eventData", objectMapper.readTree(event.eventData.getJson()));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Event '{}' contains invalid eventData JSON", event.eventId), e);
        }
        envelope.set("metadata", objectMapper.valueToTree(event.metadata));
        envelope.put("version", event.version);
        envelope.put("timestamp", DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(event.timestamp));
        return jsonSerializer.serialize(envelope);
    }

    /**
     * @throws JSONDeserializationException if the JSON isn't a valid envelope
     */
    public StoredEvent fromJSON(String json) {
        requireNonNull(json, "No json provided");
        JsonNode envelope;
        try {
            envelope = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException("Malformed event envelope JSON", e);
        }
        if (!(envelope instanceof ObjectNode)) {
            throw new JSONDeserializationException("Event envelope JSON must be an object");
        }
        try {
            var metadata = objectMapper.treeToValue(requiredField(envelope, "metadata"), EventMetadata.class);
            return new StoredEvent(requiredText(envelope, "eventId"),
                                   requiredText(envelope, "aggregateId"),
                                   AggregateType.of(requiredText(envelope, "aggregateType")),
                                   new EventJSON(eventTypeRegistry,
                                                 jsonSerializer,
                                                 requiredText(envelope, "eventType"),
                                                 objectMapper.writeValueAsString(requiredField(envelope, "eventData"))),
                                   metadata,
                                   requiredField(envelope, "version").asLong(),
                                   OffsetDateTime.parse(requiredText(envelope, "timestamp"), DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        } catch (JsonProcessingException | DateTimeParseException | IllegalArgumentException e) {
            throw new JSONDeserializationException(msg("Invalid event envelope: {}", e.getMessage()), e);
        }
    }

    private static JsonNode requiredField(JsonNode envelope, String fieldName) {
        var field = envelope.get(fieldName);
        if (field == null || field.isNull()) {
            throw new JSONDeserializationException(msg("Event envelope is missing '{}'", fieldName));
        }
        return field;
    }

    private static String requiredText(JsonNode envelope, String fieldName) {
        return requiredField(envelope, fieldName).asText();
    }
}
