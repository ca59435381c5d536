package dk.cloudcreate.essentials.sessions.aggregates;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * A command was invoked on an aggregate whose current state forbids it, e.g. mutating an archived aggregate.<br>
 * Never retried automatically.
 */
public class InvalidStateException extends AggregateException {
    public final Object aggregateId;
    public final Object currentState;

    public InvalidStateException(Object aggregateId, Object currentState, String operation) {
        super(msg("Cannot {} aggregate '{}' while it is {}", operation, aggregateId, currentState));
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.currentState = requireNonNull(currentState, "No currentState provided");
    }
}
