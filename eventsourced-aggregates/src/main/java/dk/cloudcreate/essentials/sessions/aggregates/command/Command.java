package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.EventMetadata;

import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * A request to change an aggregate, dispatched through the {@link CommandDispatcher}
 *
 * @param <P> the payload type
 */
public final class Command<P> {
    public final String          commandId;
    /**
     * Used to find the command handler. Defaults to the simple class name of the payload
     */
    public final String          commandType;
    public final P               payload;
    public final CommandMetadata metadata;

    public Command(String commandId, String commandType, P payload, CommandMetadata metadata) {
        this.commandId = requireNonNull(commandId, "No commandId provided");
        this.commandType = requireNonNull(commandType, "No commandType provided");
        this.payload = requireNonNull(payload, "No payload provided");
        this.metadata = requireNonNull(metadata, "No metadata provided");
    }

    public static <P> Command<P> of(P payload) {
        return of(payload, CommandMetadata.empty());
    }

    public static <P> Command<P> of(P payload, CommandMetadata metadata) {
        requireNonNull(payload, "No payload provided");
        return new Command<>(UUID.randomUUID().toString(), payload.getClass().getSimpleName(), payload, metadata);
    }

    public String correlationId() {
        return metadata.correlationId.orElse(commandId);
    }

    /**
     * The metadata of the events produced by this command: same correlation id as the command and the command as cause
     */
    public EventMetadata toEventMetadata() {
        return new EventMetadata(correlationId(),
                                 commandId,
                                 metadata.userId.orElse(null),
                                 metadata.traceId.orElse(null));
    }

    @Override
    public String toString() {
        return "Command{" +
                "commandId='" + commandId + '\'' +
                ", commandType='" + commandType + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
