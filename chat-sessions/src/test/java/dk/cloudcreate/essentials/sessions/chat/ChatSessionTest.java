package dk.cloudcreate.essentials.sessions.chat;

import dk.cloudcreate.essentials.sessions.aggregates.*;
import dk.cloudcreate.essentials.sessions.chat.ChatSessionEvent.*;
import dk.cloudcreate.essentials.sessions.eventstore.inmemory.InMemoryEventStore;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.EventSerializer;
import dk.cloudcreate.essentials.sessions.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.essentials.sessions.test_data.*;
import org.junit.jupiter.api.*;

import java.time.*;
import java.util.*;

import static org.assertj.core.api.Assertions.*;

class ChatSessionTest {
    private TestClock clock;
    private SessionId sessionId;

    @BeforeEach
    void setup() {
        clock = TestClock.startingAt("2024-03-15T09:30:00.123456789Z");
        sessionId = SessionId.random();
    }

    @Test
    void a_new_session_is_active_and_titled_with_the_creation_date() {
        var session = ChatSession.create(sessionId, "user-1", Optional.empty(), clock);

        assertThat(session.status()).isEqualTo(SessionStatus.ACTIVE);
        assertThat(session.title()).isEqualTo("Chat 2024-03-15");
        assertThat(session.ownerId()).isEqualTo("user-1");
        assertThat(session.createdAt()).isEqualTo(OffsetDateTime.parse("2024-03-15T09:30:00.123456Z"));
        assertThat(session.messageCount()).isZero();
        assertThat(session.lastMessageAt()).isEmpty();
        assertThat(session.version()).isEqualTo(1);
        assertThat(session.getUncommittedEvents()).singleElement().isInstanceOf(SessionCreated.class);
    }

    @Test
    void a_blank_title_falls_back_to_the_default() {
        assertThat(ChatSession.create(sessionId, "user-1", Optional.of("  "), clock).title()).isEqualTo("Chat 2024-03-15");
        assertThat(ChatSession.create(sessionId, "user-1", Optional.of(" Trip planning "), clock).title()).isEqualTo("Trip planning");
    }

    @Test
    void messages_are_recorded_in_order() {
        var session = ChatSession.create(sessionId, "user-1", Optional.of("Trip"), clock);
        clock.advance(Duration.ofSeconds(5));

        var questionId = session.addMessage(MessageContent.of("Where should I go?"), MessageRole.USER, List.of());
        clock.advance(Duration.ofSeconds(2));
        var answerId = session.addMessage(MessageContent.of("Lisbon"), MessageRole.ASSISTANT, List.of("maps/lisbon.png"));

        assertThat(session.messageCount()).isEqualTo(2);
        assertThat(session.messages()).extracting(message -> message.messageId).containsExactly(questionId, answerId);
        assertThat(session.messages().get(1).fileKeys).containsExactly("maps/lisbon.png");
        assertThat(session.lastMessageAt()).contains(OffsetDateTime.parse("2024-03-15T09:30:07.123456Z"));
        assertThat(session.version()).isEqualTo(3);
    }

    @Test
    void an_archived_session_rejects_commands() {
        var session = ChatSession.create(sessionId, "user-1", Optional.empty(), clock);
        session.archive();
        assertThat(session.status()).isEqualTo(SessionStatus.ARCHIVED);

        assertThatThrownBy(() -> session.addMessage(MessageContent.of("Hello?"), MessageRole.USER, List.of()))
                .isInstanceOf(InvalidStateException.class)
                .hasMessageContaining("ARCHIVED");
        assertThatThrownBy(session::archive).isInstanceOf(InvalidStateException.class);
        assertThat(session.version()).isEqualTo(2);
        assertThat(session.getUncommittedEvents()).hasSize(2);
    }

    @Test
    void replaying_the_events_reproduces_the_state() {
        var session = ChatSession.create(sessionId, "user-1", Optional.of("Trip"), clock);
        clock.advance(Duration.ofMinutes(1));
        session.addMessage(MessageContent.of("Hi"), MessageRole.USER, List.of("a.txt"));
        clock.advance(Duration.ofMinutes(1));
        session.archive();

        var replayed = new ChatSession(sessionId);
        replayed.loadFromHistory(session.getUncommittedEvents(), session.version());

        assertThat(replayed.state()).isEqualTo(session.state());
        assertThat(replayed.version()).isEqualTo(3);
        assertThat(replayed.getUncommittedEvents()).isEmpty();
    }

    @Test
    void a_history_that_does_not_start_with_the_session_being_created_is_rejected() {
        var replayed = new ChatSession(sessionId);

        assertThatThrownBy(() -> replayed.loadFromHistory(List.of(new SessionArchived(sessionId.value(), OffsetDateTime.now(clock))), 1))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining(sessionId.value())
                .hasMessageContaining("SessionArchived");
    }

    @Test
    void reconstructing_a_stream_without_its_creation_event_fails() {
        // Given
        var eventStore = new InMemoryEventStore(new EventSerializer(ChatSessionsFixture.eventTypeRegistry(), new JacksonJSONSerializer()));
        eventStore.append(ChatSession.AGGREGATE_TYPE, sessionId.value(), 0, List.of(new MessageAdded(sessionId.value(),
                                                                                                     "message-1",
                                                                                                     MessageRole.USER,
                                                                                                     "Hello",
                                                                                                     List.of(),
                                                                                                     OffsetDateTime.now(clock))));
        var stream = eventStore.getStream(ChatSession.AGGREGATE_TYPE, sessionId.value()).orElseThrow();

        // Then
        assertThatThrownBy(() -> ChatSessionsFixture.reconstructor().reconstruct(stream))
                .isExactlyInstanceOf(AggregateException.class)
                .hasMessageContaining("MessageAdded");
    }
}
