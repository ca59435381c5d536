package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.aggregates.Aggregate;

/**
 * Handles a command against an existing aggregate, reconstructed from its current stream, by calling its command methods
 *
 * @param <P> the command payload type
 * @param <A> the aggregate type
 */
@FunctionalInterface
public interface AggregateCommandHandler<P, A extends Aggregate<?, ?>> {
    void handle(A aggregate, P payload);
}
