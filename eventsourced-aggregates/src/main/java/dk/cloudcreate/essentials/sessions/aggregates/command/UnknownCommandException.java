package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.aggregates.AggregateException;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;

public class UnknownCommandException extends AggregateException {
    public final AggregateType aggregateType;
    public final String        commandType;

    public UnknownCommandException(AggregateType aggregateType, String commandType) {
        super(msg("No command handler registered for commandType '{}' on AggregateType '{}'", commandType, aggregateType));
        this.aggregateType = aggregateType;
        this.commandType = commandType;
    }
}
