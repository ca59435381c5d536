package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.aggregates.*;
import dk.cloudcreate.essentials.sessions.eventstore.*;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import org.slf4j.*;

import java.util.*;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Write side entry point: routes a {@link Command} to the handler registered for its aggregate type and command type,
 * and appends the produced events with optimistic concurrency control.
 * <ul>
 *     <li>A creation handler creates a new aggregate, whose events are appended with expected version 0</li>
 *     <li>An aggregate handler runs against the aggregate reconstructed from the current stream. If no stream exists the
 *     dispatch fails with {@link AggregateNotFoundException}</li>
 * </ul>
 * When an append of an existing aggregate fails with {@link ConcurrencyException} the aggregate is discarded, reloaded and the
 * command re-applied as governed by the {@link RetryPolicy}. Once the attempts are exhausted the {@link ConcurrencyException}
 * is rethrown. {@link InvalidStateException} and {@link AggregateNotFoundException} are never retried.
 * <p>
 * Example:
 * <pre>{@code
 * var dispatcher = CommandDispatcher.builder()
 *                                   .eventStore(eventStore)
 *                                   .reconstructor(reconstructor)
 *                                   .creationHandler(ORDER, CreateOrder.class, (orderId, cmd) -> Order.create(OrderId.of(orderId), cmd.customerId))
 *                                   .aggregateHandler(ORDER, AcceptOrder.class, (Order order, AcceptOrder cmd) -> order.accept())
 *                                   .build();
 * var result = dispatcher.dispatch(orderId, ORDER, Command.of(new AcceptOrder()));
 * }</pre>
 */
public final class CommandDispatcher {
    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final EventStore                          eventStore;
    private final AggregateReconstructor              reconstructor;
    private final RetryPolicy                         retryPolicy;
    private final Map<HandlerKey, RegisteredHandler> handlers;

    private CommandDispatcher(EventStore eventStore,
                              AggregateReconstructor reconstructor,
                              RetryPolicy retryPolicy,
                              Map<HandlerKey, RegisteredHandler> handlers) {
        this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
        this.reconstructor = requireNonNull(reconstructor, "You must supply an AggregateReconstructor instance");
        this.retryPolicy = requireNonNull(retryPolicy, "You must supply a RetryPolicy");
        this.handlers = Map.copyOf(handlers);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Dispatch a command to the aggregate
     *
     * @param aggregateId   the id of the aggregate
     * @param aggregateType the type of the aggregate
     * @param command       the command
     * @return the version of the aggregate after the command and the events appended
     * @throws UnknownCommandException     if no handler is registered for the command
     * @throws AggregateNotFoundException  if the command targets an aggregate that doesn't exist
     * @throws InvalidStateException       if the aggregate state forbids the command
     * @throws ConcurrencyException        if the conflict persisted after all attempts, or a creation command targets an existing aggregate
     */
    public DispatchResult dispatch(String aggregateId, AggregateType aggregateType, Command<?> command) {
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(command, "No command provided");
        var handler = handlers.get(new HandlerKey(aggregateType, command.commandType));
        if (handler == null) {
            throw new UnknownCommandException(aggregateType, command.commandType);
        }
        checkArgument(handler.payloadType.isInstance(command.payload),
                      msg("Command '{}' has a payload of type '{}' but the handler expects '{}'",
                          command.commandType, command.payload.getClass().getName(), handler.payloadType.getName()));

        var failedAttempts = 0;
        while (true) {
            try {
                var result = dispatchOnce(aggregateId, aggregateType, command, handler, failedAttempts + 1);
                log.debug("[{}:{}] Dispatched '{}' with commandId '{}': {}", aggregateType, aggregateId, command.commandType, command.commandId, result);
                return result;
            } catch (ConcurrencyException e) {
                failedAttempts++;
                if (handler.isCreation() || !retryPolicy.shouldRetry(failedAttempts)) {
                    log.debug("[{}:{}] Giving up on '{}' with commandId '{}' after {} attempt(s): {}",
                              aggregateType, aggregateId, command.commandType, command.commandId, failedAttempts, e.getMessage());
                    throw e;
                }
                var retryDelay = retryPolicy.calculateRetryDelay(failedAttempts);
                log.debug("[{}:{}] Retrying '{}' with commandId '{}' in {} after conflict: {}",
                          aggregateType, aggregateId, command.commandType, command.commandId, retryDelay, e.getMessage());
                waitBeforeRetry(retryDelay.toMillis(), e);
            }
        }
    }

    private DispatchResult dispatchOnce(String aggregateId,
                                        AggregateType aggregateType,
                                        Command<?> command,
                                        RegisteredHandler handler,
                                        int attempt) {
        Aggregate<?, ?> aggregate;
        if (handler.isCreation()) {
            aggregate = requireNonNull(handler.create(aggregateId, command.payload),
                                       msg("Creation handler for '{}' returned no aggregate", command.commandType));
            if (aggregate.getUncommittedEvents().isEmpty()) {
                throw new AggregateException(msg("[{}:{}] Creation command '{}' didn't produce any events", aggregateType, aggregateId, command.commandType));
            }
        } else {
            var stream = eventStore.getStream(aggregateType, aggregateId)
                                   .orElseThrow(() -> new AggregateNotFoundException(aggregateType, aggregateId));
            aggregate = reconstructor.reconstruct(stream);
            handler.handle(aggregate, command.payload);
        }
        if (!aggregate.aggregateId().toString().equals(aggregateId)) {
            throw new AggregateException(msg("[{}] Command '{}' was dispatched to '{}' but handled by aggregate '{}'",
                                             aggregateType, command.commandType, aggregateId, aggregate.aggregateId()));
        }

        var uncommittedEvents = aggregate.getUncommittedEvents();
        if (uncommittedEvents.isEmpty()) {
            return new DispatchResult(aggregate.version(), List.of(), attempt);
        }
        var storedEvents = eventStore.append(aggregateType,
                                             aggregateId,
                                             aggregate.version() - uncommittedEvents.size(),
                                             uncommittedEvents,
                                             Optional.of(command.toEventMetadata()));
        aggregate.clearUncommittedEvents();
        return new DispatchResult(aggregate.version(), storedEvents, attempt);
    }

    private static void waitBeforeRetry(long millis, ConcurrencyException conflict) {
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            conflict.addSuppressed(e);
            throw conflict;
        }
    }

    public RetryPolicy retryPolicy() {
        return retryPolicy;
    }

    // ------------------------------------------------------------------------------------------------------------------------------------------------

    private static final class HandlerKey {
        private final AggregateType aggregateType;
        private final String        commandType;

        private HandlerKey(AggregateType aggregateType, String commandType) {
            this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
            this.commandType = requireNonNull(commandType, "No commandType provided");
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof HandlerKey)) return false;
            var that = (HandlerKey) o;
            return aggregateType.equals(that.aggregateType) && commandType.equals(that.commandType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateType, commandType);
        }

        @Override
        public String toString() {
            return aggregateType + ":" + commandType;
        }
    }

    @SuppressWarnings({"rawtypes", "unchecked"})
    private static final class RegisteredHandler {
        private final Class<?>                payloadType;
        private final CreationCommandHandler  creationHandler;
        private final AggregateCommandHandler aggregateHandler;

        private RegisteredHandler(Class<?> payloadType, CreationCommandHandler creationHandler, AggregateCommandHandler aggregateHandler) {
            this.payloadType = requireNonNull(payloadType, "No payloadType provided");
            this.creationHandler = creationHandler;
            this.aggregateHandler = aggregateHandler;
        }

        private boolean isCreation() {
            return creationHandler != null;
        }

        private Aggregate<?, ?> create(String aggregateId, Object payload) {
            return creationHandler.create(aggregateId, payload);
        }

        private void handle(Aggregate<?, ?> aggregate, Object payload) {
            aggregateHandler.handle(aggregate, payload);
        }
    }

    public static final class Builder {
        private final Map<HandlerKey, RegisteredHandler> handlers    = new HashMap<>();
        private       EventStore                          eventStore;
        private       AggregateReconstructor              reconstructor;
        private       RetryPolicy                         retryPolicy = RetryPolicy.defaultPolicy();

        private Builder() {
        }

        public Builder eventStore(EventStore eventStore) {
            this.eventStore = eventStore;
            return this;
        }

        public Builder reconstructor(AggregateReconstructor reconstructor) {
            this.reconstructor = reconstructor;
            return this;
        }

        public Builder retryPolicy(RetryPolicy retryPolicy) {
            this.retryPolicy = retryPolicy;
            return this;
        }

        /**
         * Register a handler for the command that creates an aggregate. The command type is the simple class name of <code>payloadType</code>
         */
        public <P, A extends Aggregate<?, ?>> Builder creationHandler(AggregateType aggregateType,
                                                                     Class<P> payloadType,
                                                                     CreationCommandHandler<P, A> handler) {
            return register(aggregateType, payloadType.getSimpleName(), new RegisteredHandler(payloadType, requireNonNull(handler, "No handler provided"), null));
        }

        /**
         * Register a handler for a command against an existing aggregate. The command type is the simple class name of <code>payloadType</code>
         */
        public <P, A extends Aggregate<?, ?>> Builder aggregateHandler(AggregateType aggregateType,
                                                                      Class<P> payloadType,
                                                                      AggregateCommandHandler<P, A> handler) {
            return register(aggregateType, payloadType.getSimpleName(), new RegisteredHandler(payloadType, null, requireNonNull(handler, "No handler provided")));
        }

        private Builder register(AggregateType aggregateType, String commandType, RegisteredHandler handler) {
            var key = new HandlerKey(aggregateType, commandType);
            checkArgument(!handlers.containsKey(key), msg("A handler for '{}' has already been registered", key));
            handlers.put(key, handler);
            return this;
        }

        public CommandDispatcher build() {
            return new CommandDispatcher(eventStore, reconstructor, retryPolicy, handlers);
        }
    }
}
