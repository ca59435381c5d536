package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.aggregates.Aggregate;

/**
 * Handles a command that creates a new aggregate. The returned aggregate must contain the creation event(s) as uncommitted events
 *
 * @param <P> the command payload type
 * @param <A> the aggregate type
 */
@FunctionalInterface
public interface CreationCommandHandler<P, A extends Aggregate<?, ?>> {
    A create(String aggregateId, P payload);
}
