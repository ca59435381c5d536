package dk.cloudcreate.essentials.sessions.chat;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MessageContentTest {
    @Test
    void content_is_trimmed() {
        assertThat(MessageContent.of("  Hello\n").value()).isEqualTo("Hello");
    }

    @Test
    void blank_content_is_rejected() {
        assertThatThrownBy(() -> MessageContent.of(" \t\n ")).isInstanceOf(MessageContent.EmptyMessageException.class);
    }

    @Test
    void content_may_be_exactly_the_maximum_length() {
        assertThat(MessageContent.of("x".repeat(MessageContent.MAX_LENGTH)).length()).isEqualTo(MessageContent.MAX_LENGTH);
    }

    @Test
    void content_longer_than_the_maximum_is_rejected_after_trimming() {
        assertThat(MessageContent.of("  " + "x".repeat(MessageContent.MAX_LENGTH) + "  ").length()).isEqualTo(MessageContent.MAX_LENGTH);
        assertThatThrownBy(() -> MessageContent.of("x".repeat(MessageContent.MAX_LENGTH + 1)))
                .isInstanceOf(MessageContent.MessageTooLongException.class)
                .hasMessage("Message too long: 100001 characters (max: 100000)");
    }
}
