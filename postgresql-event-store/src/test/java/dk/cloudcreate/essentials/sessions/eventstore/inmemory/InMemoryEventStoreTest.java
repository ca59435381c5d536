package dk.cloudcreate.essentials.sessions.eventstore.inmemory;

import dk.cloudcreate.essentials.sessions.eventstore.*;
import dk.cloudcreate.essentials.sessions.eventstore.bus.PersistedEvents;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.essentials.sessions.eventstore.test_data.ShoppingCartEvent.*;
import org.junit.jupiter.api.*;

import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.sessions.eventstore.test_data.ShoppingCartEvent.*;
import static org.assertj.core.api.Assertions.*;

class InMemoryEventStoreTest {
    private InMemoryEventStore eventStore;

    @BeforeEach
    void setup() {
        var eventTypeRegistry = registerEventTypes(new EventTypeRegistry());
        eventStore = new InMemoryEventStore(new EventSerializer(eventTypeRegistry, new JacksonJSONSerializer()));
    }

    @Test
    void appended_events_receive_contiguous_versions_starting_after_the_expected_version() {
        // Given
        var cartId = UUID.randomUUID().toString();
        eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId)));

        // When
        var appended = eventStore.append(AGGREGATE_TYPE, cartId, 1, List.of(new ItemAdded("Apple", 2),
                                                                             new ItemAdded("Pear", 1)));

        // Then
        assertThat(appended).extracting(event -> event.version).containsExactly(2L, 3L);
        var stream = eventStore.getStream(AGGREGATE_TYPE, cartId).get();
        assertThat(stream.version()).isEqualTo(3);
        assertThat(stream.events).extracting(event -> event.version).containsExactly(1L, 2L, 3L);
        assertThat(stream.events).extracting(StoredEvent::eventType).containsExactly("CartCreated", "ItemAdded", "ItemAdded");
        assertThat(stream.events.get(1).eventData.deserialize()).contains(new ItemAdded("Apple", 2));
        assertThat(eventStore.getCurrentVersion(AGGREGATE_TYPE, cartId)).isEqualTo(3);
    }

    @Test
    void stored_events_are_rebuilt_from_their_json_payload() {
        // Given
        var note = new NoteAttached("hello");
        note.scratchpad = "not-serializable";
        var published = new CopyOnWriteArrayList<PersistedEvents>();
        eventStore.localEventBus().addSyncSubscriber(published::add);

        // When
        eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(note));

        // Then
        var storedEvent = eventStore.getStream(AGGREGATE_TYPE, "cart").get().events.get(0);
        assertThat(storedEvent.eventData.getJson()).isEqualTo("{\"note\":\"hello\"}");
        var readBack = (NoteAttached) storedEvent.eventData.deserialize().get();
        assertThat(readBack).isNotSameAs(note);
        assertThat(readBack.note).isEqualTo("hello");
        assertThat(readBack.scratchpad).isNull();
        var publishedEvent = (NoteAttached) published.get(0).events.get(0).eventData.deserialize().get();
        assertThat(publishedEvent).isNotSameAs(note);
        assertThat(publishedEvent.scratchpad).isNull();
    }

    @Test
    void append_with_a_stale_expected_version_fails_and_stores_nothing() {
        // Given
        var cartId = UUID.randomUUID().toString();
        eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId), new ItemAdded("Apple", 1)));

        // When
        var thrown = catchThrowableOfType(() -> eventStore.append(AGGREGATE_TYPE, cartId, 1, List.of(new ItemAdded("Pear", 1))),
                                          ConcurrencyException.class);

        // Then
        assertThat(thrown.aggregateId).isEqualTo(cartId);
        assertThat(thrown.expectedVersion).isEqualTo(1);
        assertThat(thrown.actualVersion).isEqualTo(2);
        assertThat(eventStore.getStream(AGGREGATE_TYPE, cartId).get().version()).isEqualTo(2);
    }

    @Test
    void appending_to_a_missing_stream_with_a_non_zero_expected_version_fails() {
        assertThatThrownBy(() -> eventStore.append(AGGREGATE_TYPE, "unknown", 3, List.of(new ItemAdded("Apple", 1))))
                .isExactlyInstanceOf(ConcurrencyException.class)
                .hasMessageContaining("expected version 3, actual 0");
    }

    @Test
    void exactly_one_of_multiple_concurrent_appends_with_the_same_expected_version_succeeds() throws Exception {
        // Given
        var cartId = UUID.randomUUID().toString();
        eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId)));
        var numberOfWriters = 8;
        var executor        = Executors.newFixedThreadPool(numberOfWriters);
        var startSignal     = new CountDownLatch(1);

        // When
        var results = new ArrayList<Future<Boolean>>();
        for (var writer = 0; writer < numberOfWriters; writer++) {
            var item = "Item-" + writer;
            results.add(executor.submit(() -> {
                startSignal.await();
                try {
                    eventStore.append(AGGREGATE_TYPE, cartId, 1, List.of(new ItemAdded(item, 1), new ItemAdded(item, 2)));
                    return true;
                } catch (ConcurrencyException e) {
                    assertThat(e.expectedVersion).isEqualTo(1);
                    assertThat(e.actualVersion).isEqualTo(3);
                    return false;
                }
            }));
        }
        startSignal.countDown();
        var successes = 0;
        for (var result : results) {
            if (result.get(10, TimeUnit.SECONDS)) {
                successes++;
            }
        }
        executor.shutdown();

        // Then
        assertThat(successes).isEqualTo(1);
        assertThat(eventStore.getStream(AGGREGATE_TYPE, cartId).get().events).extracting(event -> event.version).containsExactly(1L, 2L, 3L);
    }

    @Test
    void get_stream_of_an_unknown_aggregate_is_absent() {
        assertThat(eventStore.getStream(AGGREGATE_TYPE, UUID.randomUUID().toString())).isEmpty();
        assertThat(eventStore.getCurrentVersion(AGGREGATE_TYPE, "unknown")).isEqualTo(0);
        assertThat(eventStore.getEventsAfterVersion(AGGREGATE_TYPE, "unknown", 0)).isEmpty();
    }

    @Test
    void get_events_after_version_only_returns_newer_events() {
        // Given
        var cartId = UUID.randomUUID().toString();
        eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId), new ItemAdded("A", 1), new ItemAdded("B", 1)));

        // Then
        assertThat(eventStore.getEventsAfterVersion(AGGREGATE_TYPE, cartId, 1)).extracting(event -> event.version).containsExactly(2L, 3L);
        assertThat(eventStore.getEventsAfterVersion(AGGREGATE_TYPE, cartId, 3)).isEmpty();
    }

    @Test
    void an_empty_batch_is_a_no_op() {
        assertThat(eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of())).isEmpty();
        assertThat(eventStore.getStream(AGGREGATE_TYPE, "cart")).isEmpty();
    }

    @Test
    void a_negative_expected_version_is_rejected() {
        assertThatThrownBy(() -> eventStore.append(AGGREGATE_TYPE, "cart", -1, List.of(new CartCreated("cart"))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void appending_an_unregistered_event_type_fails_without_storing_anything() {
        // When
        assertThatThrownBy(() -> eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(new CartCreated("cart"), new CartAbandoned())))
                .isExactlyInstanceOf(EventStoreException.class)
                .hasMessageContaining(CartAbandoned.class.getName());

        // Then
        assertThat(eventStore.getStream(AGGREGATE_TYPE, "cart")).isEmpty();
    }

    @Test
    void metadata_defaults_to_the_event_itself_when_not_provided() {
        var stored = eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(new CartCreated("cart"))).get(0);

        assertThat(stored.metadata.correlationId).isEqualTo(stored.eventId);
        assertThat(stored.metadata.causationId).isEqualTo(stored.eventId);
        assertThat(stored.metadata.userId).isEmpty();
    }

    @Test
    void provided_metadata_is_stored_with_every_event_in_the_batch() {
        var metadata = EventMetadata.of("correlation-1", "command-1").withUserId("user-1").withTraceId("trace-1");

        var stored = eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(new CartCreated("cart"), new ItemAdded("A", 1)), Optional.of(metadata));

        assertThat(stored).extracting(event -> event.metadata).containsOnly(metadata);
    }

    @Test
    void scan_all_events_includes_every_aggregate_and_keeps_the_version_order_per_aggregate() {
        // Given
        var otherAggregateType = AggregateType.of("OtherCart");
        eventStore.append(AGGREGATE_TYPE, "cart-1", 0, List.of(new CartCreated("cart-1"), new ItemAdded("A", 1)));
        eventStore.append(otherAggregateType, "cart-2", 0, List.of(new CartCreated("cart-2")));
        eventStore.append(AGGREGATE_TYPE, "cart-1", 2, List.of(new ItemAdded("B", 1)));

        // When
        List<StoredEvent> scanned;
        try (var events = eventStore.scanAllEvents(Optional.empty())) {
            scanned = events.collect(Collectors.toList());
        }

        // Then
        assertThat(scanned).hasSize(4);
        assertThat(scanned.stream().filter(event -> event.aggregateId.equals("cart-1")))
                .extracting(event -> event.version)
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void scan_all_events_only_includes_events_after_the_timestamp_watermark() throws InterruptedException {
        // Given
        var first = eventStore.append(AGGREGATE_TYPE, "cart-1", 0, List.of(new CartCreated("cart-1"))).get(0);
        Thread.sleep(5);
        eventStore.append(AGGREGATE_TYPE, "cart-2", 0, List.of(new CartCreated("cart-2")));

        // When
        List<StoredEvent> scanned;
        try (var events = eventStore.scanAllEvents(Optional.of(first.timestamp))) {
            scanned = events.collect(Collectors.toList());
        }

        // Then
        assertThat(scanned).extracting(event -> event.aggregateId).containsExactly("cart-2");
    }

    @Test
    void committed_appends_are_published_on_the_local_event_bus() {
        // Given
        var published = new CopyOnWriteArrayList<PersistedEvents>();
        eventStore.localEventBus().addSyncSubscriber(published::add);

        // When
        var appended = eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(new CartCreated("cart"), new ItemAdded("A", 1)));
        assertThatThrownBy(() -> eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(new CartCreated("cart"))))
                .isInstanceOf(ConcurrencyException.class);

        // Then
        assertThat(published).hasSize(1);
        assertThat(published.get(0).events).isEqualTo(appended);
    }

    @Test
    void a_failing_bus_subscriber_does_not_fail_the_append() {
        eventStore.localEventBus().addSyncSubscriber(persistedEvents -> {
            throw new IllegalStateException("Subscriber failure");
        });

        assertThat(eventStore.append(AGGREGATE_TYPE, "cart", 0, List.of(new CartCreated("cart")))).hasSize(1);
    }
}
