package dk.cloudcreate.essentials.sessions.aggregates.command;

import dk.cloudcreate.essentials.sessions.aggregates.*;
import dk.cloudcreate.essentials.sessions.aggregates.test_data.*;
import dk.cloudcreate.essentials.sessions.aggregates.test_data.TicketCommands.*;
import dk.cloudcreate.essentials.sessions.eventstore.*;
import dk.cloudcreate.essentials.sessions.eventstore.bus.EventStoreLocalEventBus;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.JacksonJSONSerializer;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.sessions.aggregates.test_data.Ticket.AGGREGATE_TYPE;
import static org.assertj.core.api.Assertions.*;

class CommandDispatcherTest {
    private InMemoryEventStore       inMemoryEventStore;
    private InterferingEventStore    eventStore;
    private AggregateReconstructor   reconstructor;

    @BeforeEach
    void setup() {
        inMemoryEventStore = new InMemoryEventStore(new EventSerializer(TicketEvent.registerEventTypes(new EventTypeRegistry()), new JacksonJSONSerializer()));
        eventStore = new InterferingEventStore(inMemoryEventStore);
        reconstructor = new AggregateReconstructor().register(AGGREGATE_TYPE, TicketEvent.class, Ticket::new);
    }

    private CommandDispatcher dispatcher(RetryPolicy retryPolicy) {
        return CommandDispatcher.builder()
                                .eventStore(eventStore)
                                .reconstructor(reconstructor)
                                .retryPolicy(retryPolicy)
                                .creationHandler(AGGREGATE_TYPE, OpenTicket.class, (String ticketId, OpenTicket cmd) -> Ticket.open(ticketId, cmd.title))
                                .aggregateHandler(AGGREGATE_TYPE, AddComment.class, (Ticket ticket, AddComment cmd) -> ticket.comment(cmd.text))
                                .aggregateHandler(AGGREGATE_TYPE, CloseTicket.class, (Ticket ticket, CloseTicket cmd) -> ticket.close())
                                .build();
    }

    @Test
    void dispatch_returns_the_produced_version() {
        // Given
        var dispatcher = dispatcher(RetryPolicy.defaultPolicy());

        // When
        var created   = dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new OpenTicket("Printer on fire")));
        var commented = dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new AddComment("On it")));
        var closed    = dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new CloseTicket()));

        // Then
        assertThat(created.producedVersion).isEqualTo(1);
        assertThat(commented.producedVersion).isEqualTo(2);
        assertThat(closed.producedVersion).isEqualTo(3);
        assertThat(closed.attempts).isEqualTo(1);
        assertThat(inMemoryEventStore.getCurrentVersion(AGGREGATE_TYPE, "T-1")).isEqualTo(3);
    }

    @Test
    void produced_events_are_correlated_with_and_caused_by_the_command() {
        // Given
        var dispatcher = dispatcher(RetryPolicy.defaultPolicy());
        var command = Command.of(new OpenTicket("Printer on fire"),
                                 CommandMetadata.empty().withCorrelationId("request-1").withUserId("user-1").withTraceId("trace-1"));

        // When
        var result = dispatcher.dispatch("T-1", AGGREGATE_TYPE, command);

        // Then
        var metadata = result.events.get(0).metadata;
        assertThat(metadata.correlationId).isEqualTo("request-1");
        assertThat(metadata.causationId).isEqualTo(command.commandId);
        assertThat(metadata.userId).contains("user-1");
        assertThat(metadata.traceId).contains("trace-1");
    }

    @Test
    void correlation_id_defaults_to_the_command_id() {
        var command = Command.of(new OpenTicket("Printer on fire"));

        var result = dispatcher(RetryPolicy.defaultPolicy()).dispatch("T-1", AGGREGATE_TYPE, command);

        assertThat(result.events.get(0).metadata.correlationId).isEqualTo(command.commandId);
    }

    @Test
    void a_conflicting_write_is_retried_against_the_reloaded_aggregate() {
        // Given
        var dispatcher = dispatcher(RetryPolicy.fixedBackoff(Duration.ofMillis(1), 3));
        dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new OpenTicket("Printer on fire")));
        eventStore.interfereWithNextAppends(1, () -> inMemoryEventStore.append(AGGREGATE_TYPE, "T-1", 1, List.of(new TicketEvent.CommentAdded("T-1", "Concurrent"))));

        // When
        var result = dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new AddComment("Mine")));

        // Then
        assertThat(result.attempts).isEqualTo(2);
        assertThat(result.producedVersion).isEqualTo(3);
        Ticket ticket = reconstructor.reconstruct(inMemoryEventStore.getStream(AGGREGATE_TYPE, "T-1").get());
        assertThat(ticket.state().comments).containsExactly("Concurrent", "Mine");
    }

    @Test
    void the_conflict_is_rethrown_once_all_attempts_are_exhausted() {
        // Given
        var dispatcher = dispatcher(RetryPolicy.fixedBackoff(Duration.ofMillis(1), 2));
        dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new OpenTicket("Printer on fire")));
        var concurrentWrites = new AtomicInteger();
        eventStore.interfereWithNextAppends(2, () -> {
            var version = inMemoryEventStore.getCurrentVersion(AGGREGATE_TYPE, "T-1");
            inMemoryEventStore.append(AGGREGATE_TYPE, "T-1", version, List.of(new TicketEvent.CommentAdded("T-1", "Concurrent " + concurrentWrites.incrementAndGet())));
        });

        // When
        var thrown = catchThrowableOfType(() -> dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new AddComment("Mine"))),
                                          ConcurrencyException.class);

        // Then
        assertThat(thrown.expectedVersion).isEqualTo(2);
        assertThat(thrown.actualVersion).isEqualTo(3);
        assertThat(eventStore.appendCalls.get()).isEqualTo(3);
    }

    @Test
    void creating_an_existing_aggregate_is_not_retried() {
        // Given
        var dispatcher = dispatcher(RetryPolicy.fixedBackoff(Duration.ofMillis(1), 3));
        dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new OpenTicket("Printer on fire")));

        // When
        var thrown = catchThrowableOfType(() -> dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new OpenTicket("Again"))),
                                          ConcurrencyException.class);

        // Then
        assertThat(thrown.expectedVersion).isEqualTo(0);
        assertThat(thrown.actualVersion).isEqualTo(1);
        assertThat(eventStore.appendCalls.get()).isEqualTo(2);
    }

    @Test
    void invalid_state_is_surfaced_without_retry_and_the_stream_is_unchanged() {
        // Given
        var dispatcher = dispatcher(RetryPolicy.defaultPolicy());
        dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new OpenTicket("Printer on fire")));
        dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new AddComment("On it")));
        dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new CloseTicket()));

        // When / Then
        assertThatThrownBy(() -> dispatcher.dispatch("T-1", AGGREGATE_TYPE, Command.of(new AddComment("Too late"))))
                .isExactlyInstanceOf(InvalidStateException.class);
        assertThat(inMemoryEventStore.getCurrentVersion(AGGREGATE_TYPE, "T-1")).isEqualTo(3);
        assertThat(eventStore.appendCalls.get()).isEqualTo(3);
    }

    @Test
    void a_command_for_an_unknown_aggregate_fails_with_not_found() {
        assertThatThrownBy(() -> dispatcher(RetryPolicy.defaultPolicy()).dispatch("unknown", AGGREGATE_TYPE, Command.of(new AddComment("Hello"))))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
        assertThat(inMemoryEventStore.getStream(AGGREGATE_TYPE, "unknown")).isEmpty();
    }

    @Test
    void a_command_without_a_handler_fails() {
        var thrown = catchThrowableOfType(() -> dispatcher(RetryPolicy.defaultPolicy()).dispatch("T-1", AggregateType.of("Other"), Command.of(new AddComment("Hello"))),
                                          UnknownCommandException.class);

        assertThat(thrown.commandType).isEqualTo("AddComment");
    }

    @Test
    void registering_two_handlers_for_the_same_command_fails() {
        assertThatThrownBy(() -> CommandDispatcher.builder()
                                                  .aggregateHandler(AGGREGATE_TYPE, CloseTicket.class, (Ticket ticket, CloseTicket cmd) -> ticket.close())
                                                  .aggregateHandler(AGGREGATE_TYPE, CloseTicket.class, (Ticket ticket, CloseTicket cmd) -> ticket.close()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /**
     * Lets another writer append to the stream right before the dispatcher's own append
     */
    private static final class InterferingEventStore implements EventStore {
        private final EventStore    delegate;
        private final AtomicInteger appendCalls = new AtomicInteger();
        private       int           remainingInterferences;
        private       Runnable      interference;

        private InterferingEventStore(EventStore delegate) {
            this.delegate = delegate;
        }

        void interfereWithNextAppends(int times, Runnable interference) {
            this.remainingInterferences = times;
            this.interference = interference;
        }

        @Override
        public List<StoredEvent> append(AggregateType aggregateType, String aggregateId, long expectedVersion, List<?> events, Optional<EventMetadata> metadata) {
            appendCalls.incrementAndGet();
            if (remainingInterferences > 0) {
                remainingInterferences--;
                interference.run();
            }
            return delegate.append(aggregateType, aggregateId, expectedVersion, events, metadata);
        }

        @Override
        public Optional<EventStream> getStream(AggregateType aggregateType, String aggregateId) {
            return delegate.getStream(aggregateType, aggregateId);
        }

        @Override
        public List<StoredEvent> getEventsAfterVersion(AggregateType aggregateType, String aggregateId, long version) {
            return delegate.getEventsAfterVersion(aggregateType, aggregateId, version);
        }

        @Override
        public long getCurrentVersion(AggregateType aggregateType, String aggregateId) {
            return delegate.getCurrentVersion(aggregateType, aggregateId);
        }

        @Override
        public Stream<StoredEvent> scanAllEvents(Optional<OffsetDateTime> afterTimestamp) {
            return delegate.scanAllEvents(afterTimestamp);
        }

        @Override
        public EventStoreLocalEventBus localEventBus() {
            return delegate.localEventBus();
        }
    }
}
