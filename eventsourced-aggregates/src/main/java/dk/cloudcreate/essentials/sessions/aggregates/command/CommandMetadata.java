package dk.cloudcreate.essentials.sessions.aggregates.command;

import java.time.*;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Tracing information supplied by the caller of a {@link Command}
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public final class CommandMetadata {
    /**
     * If empty, the {@link Command#commandId} is used as correlation id
     */
    public final Optional<String> correlationId;
    public final Optional<String> causationId;
    public final Optional<String> userId;
    public final Optional<String> traceId;
    public final OffsetDateTime   timestamp;

    public CommandMetadata(Optional<String> correlationId,
                           Optional<String> causationId,
                           Optional<String> userId,
                           Optional<String> traceId,
                           OffsetDateTime timestamp) {
        this.correlationId = requireNonNull(correlationId, "No correlationId option provided");
        this.causationId = requireNonNull(causationId, "No causationId option provided");
        this.userId = requireNonNull(userId, "No userId option provided");
        this.traceId = requireNonNull(traceId, "No traceId option provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public static CommandMetadata empty() {
        return new CommandMetadata(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty(), OffsetDateTime.now(ZoneOffset.UTC));
    }

    public CommandMetadata withCorrelationId(String correlationId) {
        return new CommandMetadata(Optional.of(correlationId), causationId, userId, traceId, timestamp);
    }

    public CommandMetadata withCausationId(String causationId) {
        return new CommandMetadata(correlationId, Optional.of(causationId), userId, traceId, timestamp);
    }

    public CommandMetadata withUserId(String userId) {
        return new CommandMetadata(correlationId, causationId, Optional.of(userId), traceId, timestamp);
    }

    public CommandMetadata withTraceId(String traceId) {
        return new CommandMetadata(correlationId, causationId, userId, Optional.of(traceId), timestamp);
    }

    @Override
    public String toString() {
        return "CommandMetadata{" +
                "correlationId=" + correlationId +
                ", causationId=" + causationId +
                ", userId=" + userId +
                ", traceId=" + traceId +
                ", timestamp=" + timestamp +
                '}';
    }
}
