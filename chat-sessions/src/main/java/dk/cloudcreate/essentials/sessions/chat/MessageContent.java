package dk.cloudcreate.essentials.sessions.chat;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * The text of a chat message. Leading and trailing whitespace is removed and the remaining text must contain between 1 and
 * {@link #MAX_LENGTH} characters
 */
public final class MessageContent {
    public static final int MAX_LENGTH = 100_000;

    private final String value;

    private MessageContent(String value) {
        this.value = value;
    }

    /**
     * @param text the raw text
     * @return the trimmed content
     * @throws EmptyMessageException   if the text is blank
     * @throws MessageTooLongException if the trimmed text is longer than {@link #MAX_LENGTH}
     */
    public static MessageContent of(String text) {
        requireNonNull(text, "No message text provided");
        var trimmed = text.trim();
        if (trimmed.isEmpty()) {
            throw new EmptyMessageException();
        }
        if (trimmed.length() > MAX_LENGTH) {
            throw new MessageTooLongException(trimmed.length());
        }
        return new MessageContent(trimmed);
    }

    public String value() {
        return value;
    }

    public int length() {
        return value.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MessageContent)) return false;
        return value.equals(((MessageContent) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }

    public static class EmptyMessageException extends IllegalArgumentException {
        public EmptyMessageException() {
            super("Message content cannot be empty");
        }
    }

    public static class MessageTooLongException extends IllegalArgumentException {
        public final int length;

        public MessageTooLongException(int length) {
            super(msg("Message too long: {} characters (max: {})", length, MAX_LENGTH));
            this.length = length;
        }
    }
}
