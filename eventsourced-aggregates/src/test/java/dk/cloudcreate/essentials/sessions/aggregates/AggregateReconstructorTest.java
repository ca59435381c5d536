package dk.cloudcreate.essentials.sessions.aggregates;

import dk.cloudcreate.essentials.sessions.aggregates.test_data.*;
import dk.cloudcreate.essentials.sessions.eventstore.AggregateNotFoundException;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.JacksonJSONSerializer;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;

import static dk.cloudcreate.essentials.sessions.aggregates.test_data.Ticket.AGGREGATE_TYPE;
import static org.assertj.core.api.Assertions.*;

class AggregateReconstructorTest {
    private EventTypeRegistry      eventTypeRegistry;
    private JacksonJSONSerializer  jsonSerializer;
    private InMemoryEventStore     eventStore;
    private AggregateReconstructor reconstructor;

    @BeforeEach
    void setup() {
        eventTypeRegistry = TicketEvent.registerEventTypes(new EventTypeRegistry());
        jsonSerializer = new JacksonJSONSerializer();
        eventStore = new InMemoryEventStore(new EventSerializer(eventTypeRegistry, jsonSerializer));
        reconstructor = new AggregateReconstructor().register(AGGREGATE_TYPE, TicketEvent.class, Ticket::new);
    }

    @Test
    void an_empty_event_sequence_means_not_found() {
        assertThatThrownBy(() -> reconstructor.reconstruct(AGGREGATE_TYPE, "T-1", List.of()))
                .isExactlyInstanceOf(AggregateNotFoundException.class);
    }

    @Test
    void reconstruction_is_deterministic() {
        // Given
        var ticket = Ticket.open("T-1", "Printer on fire");
        ticket.comment("On it");
        ticket.close();
        eventStore.append(AGGREGATE_TYPE, "T-1", 0, ticket.getUncommittedEvents());
        var stream = eventStore.getStream(AGGREGATE_TYPE, "T-1").get();

        // When
        Ticket first  = reconstructor.reconstruct(stream);
        Ticket second = reconstructor.reconstruct(stream);

        // Then
        assertThat(first.state()).isEqualTo(second.state()).isEqualTo(ticket.state());
        assertThat(first.version()).isEqualTo(second.version()).isEqualTo(3);
        assertThat(first.getUncommittedEvents()).isEmpty();
    }

    @Test
    void an_event_unknown_to_the_aggregate_fails_reconstruction() {
        // Given
        var opened = eventStore.append(AGGREGATE_TYPE, "T-1", 0, List.of(new TicketEvent.TicketOpened("T-1", "Printer on fire"))).get(0);
        var escalated = new StoredEvent(UUID.randomUUID().toString(),
                                        "T-1",
                                        AGGREGATE_TYPE,
                                        new EventJSON(eventTypeRegistry, jsonSerializer, "TicketEscalated", "{\"level\":2}"),
                                        EventMetadata.originatingFrom("x"),
                                        2,
                                        OffsetDateTime.now(ZoneOffset.UTC));

        // Then
        assertThatThrownBy(() -> reconstructor.reconstruct(AGGREGATE_TYPE, "T-1", List.of(opened, escalated)))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining("TicketEscalated");
    }

    @Test
    void a_gap_in_the_versions_fails_reconstruction() {
        var events = eventStore.append(AGGREGATE_TYPE, "T-1", 0, List.of(new TicketEvent.TicketOpened("T-1", "Printer on fire"),
                                                                         new TicketEvent.CommentAdded("T-1", "On it"),
                                                                         new TicketEvent.TicketClosed("T-1")));

        assertThatThrownBy(() -> reconstructor.reconstruct(AGGREGATE_TYPE, "T-1", List.of(events.get(0), events.get(2))))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining("Expected an event with version 2");
    }

    @Test
    void an_unregistered_aggregate_type_fails() {
        var events = eventStore.append(AGGREGATE_TYPE, "T-1", 0, List.of(new TicketEvent.TicketOpened("T-1", "Printer on fire")));

        assertThatThrownBy(() -> reconstructor.reconstruct(AggregateType.of("Unknown"), "T-1", events))
                .isExactlyInstanceOf(AggregateException.class);
    }

    @Test
    void registering_the_same_aggregate_type_twice_fails() {
        assertThatThrownBy(() -> reconstructor.register(AGGREGATE_TYPE, TicketEvent.class, Ticket::new))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
