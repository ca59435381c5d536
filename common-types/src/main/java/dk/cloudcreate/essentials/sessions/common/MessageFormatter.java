package dk.cloudcreate.essentials.sessions.common;

import java.util.Map;
import java.util.regex.*;

import static java.util.Objects.requireNonNull;

/**
 * Message templating used for exception messages, log statements and SQL generation.
 * <ul>
 *     <li>{@link #msg(String, Object...)} replaces positional <code>{}</code> placeholders (SLF4J syntax)</li>
 *     <li>{@link #bind(String, NamedArgumentBinding...)} replaces named <code>{:name}</code> placeholders</li>
 * </ul>
 */
public final class MessageFormatter {
    private static final Pattern NAMED_PLACEHOLDER = Pattern.compile("\\{:(\\w+)}");

    private MessageFormatter() {
    }

    /**
     * Format a message using SLF4J style <code>{}</code> placeholders<br>
     * Example: <code>msg("Failed to load '{}' with id '{}'", "ChatSession", id)</code>
     *
     * @param message  the message template
     * @param messageArguments the arguments, applied in order
     * @return the formatted message
     */
    public static String msg(String message, Object... messageArguments) {
        requireNonNull(message, "No message provided");
        return org.slf4j.helpers.MessageFormatter.arrayFormat(message, messageArguments).getMessage();
    }

    /**
     * Replace all named <code>{:name}</code> placeholders in the template<br>
     * Example: <code>bind("SELECT * FROM {:tableName}", arg("tableName", "chat_session_events"))</code>
     *
     * @param template  the template
     * @param arguments the named arguments
     * @return the template with every known placeholder replaced
     * @throws IllegalArgumentException if the template refers to a placeholder without a matching argument
     */
    public static String bind(String template, NamedArgumentBinding... arguments) {
        requireNonNull(template, "No template provided");
        requireNonNull(arguments, "No arguments provided");
        var bindings = new java.util.HashMap<String, Object>();
        for (var argument : arguments) {
            bindings.put(argument.name, argument.value);
        }
        return bind(template, bindings);
    }

    private static String bind(String template, Map<String, Object> bindings) {
        var matcher = NAMED_PLACEHOLDER.matcher(template);
        var result  = new StringBuilder();
        while (matcher.find()) {
            var name = matcher.group(1);
            if (!bindings.containsKey(name)) {
                throw new IllegalArgumentException(msg("No argument provided for placeholder '{:{}}'", name));
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(String.valueOf(bindings.get(name))));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * A named argument used with {@link #bind(String, NamedArgumentBinding...)}
     */
    public static final class NamedArgumentBinding {
        public final String name;
        public final Object value;

        private NamedArgumentBinding(String name, Object value) {
            this.name = requireNonNull(name, "No name provided");
            this.value = value;
        }

        public static NamedArgumentBinding arg(String name, Object value) {
            return new NamedArgumentBinding(name, value);
        }
    }
}
