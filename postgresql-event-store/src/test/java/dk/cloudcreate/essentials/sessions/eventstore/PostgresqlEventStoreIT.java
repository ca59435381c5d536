package dk.cloudcreate.essentials.sessions.eventstore;

import dk.cloudcreate.essentials.sessions.common.transaction.*;
import dk.cloudcreate.essentials.sessions.eventstore.bus.PersistedEvents;
import dk.cloudcreate.essentials.sessions.eventstore.eventstream.*;
import dk.cloudcreate.essentials.sessions.eventstore.persistence.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.*;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.essentials.sessions.eventstore.test_data.ShoppingCartEvent.*;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.*;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.sessions.eventstore.test_data.ShoppingCartEvent.*;
import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.waitAtMost;

@Testcontainers
class PostgresqlEventStoreIT {
    private static final AggregateType ORDER = AggregateType.of("CustomerOrder");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private JdbiUnitOfWorkFactory unitOfWorkFactory;
    private PostgresqlEventStore  eventStore;

    @BeforeEach
    void setup() {
        var jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                               postgreSQLContainer.getUsername(),
                               postgreSQLContainer.getPassword());
        jdbi.setSqlLogger(new EventStoreSqlLogger());
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
        var eventSerializer = new EventSerializer(registerEventTypes(new EventTypeRegistry()), new JacksonJSONSerializer());
        var persistenceStrategy = new SeparateTablePerAggregateTypePersistenceStrategy(jdbi,
                                                                                       unitOfWorkFactory,
                                                                                       eventSerializer,
                                                                                       List.of(AggregateTypeConfiguration.standardConfiguration(AGGREGATE_TYPE),
                                                                                               AggregateTypeConfiguration.standardConfiguration(ORDER)));
        eventStore = new PostgresqlEventStore(unitOfWorkFactory, persistenceStrategy);
    }

    @Test
    void creates_a_table_per_aggregate_type() {
        var tables = unitOfWorkFactory.withUnitOfWork(unitOfWork -> unitOfWork.handle()
                                                                              .createQuery("SELECT table_name FROM information_schema.tables WHERE table_name LIKE '%_events'")
                                                                              .mapTo(String.class)
                                                                              .list());

        assertThat(tables).contains("shopping_cart_events", "customer_order_events");
    }

    @Test
    void appended_events_are_read_back_unchanged_and_in_version_order() {
        // Given
        var cartId = UUID.randomUUID().toString();
        var firstBatch = eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId)),
                                           Optional.of(EventMetadata.of("corr-1", "cmd-1").withUserId("user-1")));

        // When
        var secondBatch = eventStore.append(AGGREGATE_TYPE, cartId, 1, List.of(new ItemAdded("Apple", 2), new ItemAdded("Pear", 1)));

        // Then
        assertThat(secondBatch).extracting(event -> event.version).containsExactly(2L, 3L);
        var stream = eventStore.getStream(AGGREGATE_TYPE, cartId).get();
        assertThat(stream.version()).isEqualTo(3);
        assertThat(stream.events.get(0)).isEqualTo(firstBatch.get(0));
        assertThat(stream.events.subList(1, 3)).isEqualTo(secondBatch);
        assertThat(stream.events.get(0).metadata.userId).contains("user-1");
        assertThat(stream.events.get(2).eventData.deserialize()).contains(new ItemAdded("Pear", 1));
        assertThat(eventStore.getEventsAfterVersion(AGGREGATE_TYPE, cartId, 2)).extracting(event -> event.version).containsExactly(3L);
        assertThat(eventStore.getCurrentVersion(AGGREGATE_TYPE, cartId)).isEqualTo(3);
    }

    @Test
    void get_stream_of_an_unknown_aggregate_is_absent() {
        assertThat(eventStore.getStream(AGGREGATE_TYPE, UUID.randomUUID().toString())).isEmpty();
    }

    @Test
    void a_stale_expected_version_fails_with_the_actual_version() {
        // Given
        var cartId = UUID.randomUUID().toString();
        eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId), new ItemAdded("Apple", 1)));

        // When
        var thrown = catchThrowableOfType(() -> eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId))),
                                          ConcurrencyException.class);

        // Then
        assertThat(thrown.expectedVersion).isEqualTo(0);
        assertThat(thrown.actualVersion).isEqualTo(2);
        assertThat(eventStore.getCurrentVersion(AGGREGATE_TYPE, cartId)).isEqualTo(2);
    }

    @Test
    void exactly_one_of_multiple_concurrent_appends_with_the_same_expected_version_succeeds() throws Exception {
        // Given
        var cartId = UUID.randomUUID().toString();
        eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId)));
        var numberOfWriters = 5;
        var executor        = Executors.newFixedThreadPool(numberOfWriters);
        var startSignal     = new CountDownLatch(1);

        // When
        var results = new ArrayList<Future<Optional<ConcurrencyException>>>();
        for (var writer = 0; writer < numberOfWriters; writer++) {
            var item = "Item-" + writer;
            results.add(executor.submit(() -> {
                startSignal.await();
                try {
                    eventStore.append(AGGREGATE_TYPE, cartId, 1, List.of(new ItemAdded(item, 1), new ItemAdded(item, 2)));
                    return Optional.<ConcurrencyException>empty();
                } catch (ConcurrencyException e) {
                    return Optional.of(e);
                }
            }));
        }
        startSignal.countDown();
        var failures = new ArrayList<ConcurrencyException>();
        for (var result : results) {
            result.get(30, TimeUnit.SECONDS).ifPresent(failures::add);
        }
        executor.shutdown();

        // Then
        assertThat(failures).hasSize(numberOfWriters - 1);
        assertThat(failures).allSatisfy(failure -> {
            assertThat(failure.expectedVersion).isEqualTo(1);
            assertThat(failure.actualVersion).isEqualTo(3);
        });
        assertThat(eventStore.getStream(AGGREGATE_TYPE, cartId).get().events)
                .extracting(event -> event.version)
                .containsExactly(1L, 2L, 3L);
    }

    @Test
    void a_batch_is_rolled_back_completely_when_the_surrounding_unit_of_work_fails() {
        // Given
        var cartId = UUID.randomUUID().toString();

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId), new ItemAdded("Apple", 1)));
            throw new IllegalStateException("Failure after append");
        })).isExactlyInstanceOf(IllegalStateException.class);

        // Then
        assertThat(eventStore.getStream(AGGREGATE_TYPE, cartId)).isEmpty();
    }

    @Test
    void events_are_only_published_after_the_unit_of_work_commits() {
        // Given
        var published = new CopyOnWriteArrayList<PersistedEvents>();
        eventStore.localEventBus().addSyncSubscriber(published::add);
        var cartId = UUID.randomUUID().toString();

        // When
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            eventStore.append(AGGREGATE_TYPE, cartId, 0, List.of(new CartCreated(cartId)));
            assertThat(published).isEmpty();
        });

        // Then
        assertThat(published).hasSize(1);
        assertThat(published.get(0).events).extracting(event -> event.aggregateId).containsExactly(cartId);
    }

    @Test
    void scan_all_events_streams_every_aggregate_type_and_honors_the_watermark() {
        // Given
        var firstCart = eventStore.append(AGGREGATE_TYPE, "cart-1", 0, List.of(new CartCreated("cart-1"), new ItemAdded("A", 1)));
        eventStore.append(ORDER, "order-1", 0, List.of(new CartCreated("order-1")));
        eventStore.append(AGGREGATE_TYPE, "cart-1", 2, List.of(new ItemAdded("B", 1)));

        // When
        List<StoredEvent> all;
        try (var events = eventStore.scanAllEvents(Optional.empty())) {
            all = events.collect(Collectors.toList());
        }
        List<StoredEvent> afterWatermark;
        try (var events = eventStore.scanAllEvents(Optional.of(firstCart.get(1).timestamp))) {
            afterWatermark = events.collect(Collectors.toList());
        }

        // Then
        assertThat(all).hasSize(4);
        assertThat(all.stream().filter(event -> event.aggregateType.equals(AGGREGATE_TYPE)))
                .extracting(event -> event.version)
                .containsExactly(1L, 2L, 3L);
        assertThat(afterWatermark).extracting(event -> event.aggregateId).containsExactlyInAnyOrder("order-1", "cart-1");
    }

    @Test
    void scan_all_events_can_be_abandoned_before_the_end() {
        // Given
        for (var index = 0; index < 250; index++) {
            eventStore.append(AGGREGATE_TYPE, "cart-" + index, 0, List.of(new CartCreated("cart-" + index)));
        }

        // When
        List<StoredEvent> firstEvents;
        try (var events = eventStore.scanAllEvents(Optional.empty())) {
            firstEvents = events.limit(10).collect(Collectors.toList());
        }

        // Then
        assertThat(firstEvents).hasSize(10);
        assertThat(eventStore.getCurrentVersion(AGGREGATE_TYPE, "cart-0")).isEqualTo(1);
    }

    @Test
    void polling_emits_existing_and_newly_appended_events() {
        // Given
        eventStore.append(AGGREGATE_TYPE, "cart-1", 0, List.of(new CartCreated("cart-1")));
        var received = new CopyOnWriteArrayList<StoredEvent>();

        // When
        var subscription = eventStore.pollEvents(AGGREGATE_TYPE, Optional.empty(), Duration.ofMillis(100))
                                     .subscribe(received::add);
        waitAtMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(received).hasSize(1));
        eventStore.append(AGGREGATE_TYPE, "cart-1", 1, List.of(new ItemAdded("A", 1), new ItemAdded("B", 1)));

        // Then
        waitAtMost(Duration.ofSeconds(5)).untilAsserted(() -> assertThat(received).extracting(event -> event.version).containsExactly(1L, 2L, 3L));
        subscription.dispose();
    }

    @Test
    void polling_starts_after_the_initial_watermark() {
        var first = eventStore.append(AGGREGATE_TYPE, "cart-1", 0, List.of(new CartCreated("cart-1"))).get(0);
        eventStore.append(AGGREGATE_TYPE, "cart-1", 1, List.of(new ItemAdded("A", 1)));

        StepVerifier.create(eventStore.pollEvents(AGGREGATE_TYPE, Optional.of(first.timestamp), Duration.ofMillis(100)))
                    .assertNext(event -> assertThat(event.version).isEqualTo(2))
                    .thenCancel()
                    .verify(Duration.ofSeconds(5));
    }

    @Test
    void appending_to_an_unconfigured_aggregate_type_fails() {
        assertThatThrownBy(() -> eventStore.append(AggregateType.of("Unknown"), "id", 0, List.of(new CartCreated("id"))))
                .isExactlyInstanceOf(EventStoreException.class)
                .hasMessageContaining("hasn't been configured");
    }
}
