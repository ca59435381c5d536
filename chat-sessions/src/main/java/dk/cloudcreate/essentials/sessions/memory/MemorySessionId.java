package dk.cloudcreate.essentials.sessions.memory;

import java.util.UUID;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Identifier of a {@link MemorySession}. Generated ids have the form <code>ms-&lt;uuid&gt;</code>
 */
public final class MemorySessionId {
    private final String value;

    private MemorySessionId(String value) {
        this.value = value;
    }

    public static MemorySessionId of(String value) {
        requireNonNull(value, "No memory session id value provided");
        checkArgument(!value.isBlank(), "Memory session id cannot be blank");
        return new MemorySessionId(value);
    }

    public static MemorySessionId generate() {
        return new MemorySessionId("ms-" + UUID.randomUUID());
    }

    public String value() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemorySessionId)) return false;
        return value.equals(((MemorySessionId) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
