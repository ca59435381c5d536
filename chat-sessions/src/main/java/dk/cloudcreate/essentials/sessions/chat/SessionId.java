package dk.cloudcreate.essentials.sessions.chat;

import java.util.UUID;

import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * Identifier of a {@link ChatSession}. Always a UUID in its canonical lower case form
 */
public final class SessionId implements Comparable<SessionId> {
    private final String value;

    private SessionId(String value) {
        this.value = value;
    }

    /**
     * @param value the UUID value
     * @return the session id
     * @throws InvalidSessionIdException if <code>value</code> isn't a UUID
     */
    public static SessionId of(String value) {
        requireNonNull(value, "No session id value provided");
        try {
            var uuid = UUID.fromString(value.trim());
            if (!uuid.toString().equalsIgnoreCase(value.trim())) {
                throw new InvalidSessionIdException(value);
            }
            return new SessionId(uuid.toString());
        } catch (IllegalArgumentException e) {
            throw new InvalidSessionIdException(value);
        }
    }

    public static SessionId random() {
        return new SessionId(UUID.randomUUID().toString());
    }

    public String value() {
        return value;
    }

    @Override
    public int compareTo(SessionId o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SessionId)) return false;
        return value.equals(((SessionId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }

    public static class InvalidSessionIdException extends IllegalArgumentException {
        public InvalidSessionIdException(String value) {
            super(msg("Invalid session id '{}'. Expected a UUID", value));
        }
    }
}
