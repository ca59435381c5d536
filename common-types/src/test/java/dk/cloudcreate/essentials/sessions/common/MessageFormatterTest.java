package dk.cloudcreate.essentials.sessions.common;

import org.junit.jupiter.api.Test;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.*;
import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.NamedArgumentBinding.arg;
import static org.assertj.core.api.Assertions.*;

class MessageFormatterTest {
    @Test
    void msg_replaces_positional_placeholders_in_order() {
        assertThat(msg("Failed to load '{}' with id '{}'", "ChatSession", 42)).isEqualTo("Failed to load 'ChatSession' with id '42'");
        assertThat(msg("No placeholders")).isEqualTo("No placeholders");
        assertThat(msg("Missing '{}' and '{}'", "one")).isEqualTo("Missing 'one' and '{}'");
    }

    @Test
    void bind_replaces_every_named_placeholder() {
        var sql = bind("SELECT * FROM {:tableName} WHERE aggregate_id = :id AND {:column} > 0 -- {:tableName}",
                       arg("tableName", "chat_session_events"),
                       arg("column", "version"));

        assertThat(sql).isEqualTo("SELECT * FROM chat_session_events WHERE aggregate_id = :id AND version > 0 -- chat_session_events");
    }

    @Test
    void bind_rejects_a_placeholder_without_an_argument() {
        assertThatThrownBy(() -> bind("SELECT * FROM {:tableName}", arg("other", "x")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("{:tableName}");
    }

    @Test
    void replacement_values_are_inserted_literally() {
        assertThat(bind("{:value}", arg("value", "$1 \\ cost"))).isEqualTo("$1 \\ cost");
    }
}
