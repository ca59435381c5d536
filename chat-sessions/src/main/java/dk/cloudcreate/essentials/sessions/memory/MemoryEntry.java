package dk.cloudcreate.essentials.sessions.memory;

import com.fasterxml.jackson.annotation.*;
import dk.cloudcreate.essentials.sessions.chat.MessageRole;

import java.time.OffsetDateTime;
import java.util.*;

import static java.util.Objects.requireNonNull;

/**
 * A single remembered utterance in a {@link MemorySession}
 */
public final class MemoryEntry {
    public final String              entryId;
    public final MessageRole         role;
    public final String              content;
    public final OffsetDateTime      storedAt;
    public final Map<String, String> metadata;

    @JsonCreator
    public MemoryEntry(@JsonProperty("entryId") String entryId,
                       @JsonProperty("role") MessageRole role,
                       @JsonProperty("content") String content,
                       @JsonProperty("storedAt") OffsetDateTime storedAt,
                       @JsonProperty("metadata") Map<String, String> metadata) {
        this.entryId = requireNonNull(entryId, "No entryId provided");
        this.role = requireNonNull(role, "No role provided");
        this.content = requireNonNull(content, "No content provided");
        this.storedAt = requireNonNull(storedAt, "No storedAt provided");
        this.metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    boolean contentContainsIgnoreCase(String lowerCaseQuery) {
        return content.toLowerCase(Locale.ROOT).contains(lowerCaseQuery);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemoryEntry)) return false;
        var that = (MemoryEntry) o;
        return entryId.equals(that.entryId) &&
                role == that.role &&
                content.equals(that.content) &&
                storedAt.isEqual(that.storedAt) &&
                metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entryId, role, content, storedAt.toInstant(), metadata);
    }

    @Override
    public String toString() {
        return "MemoryEntry{" +
                "entryId='" + entryId + '\'' +
                ", role=" + role +
                ", storedAt=" + storedAt +
                ", metadata=" + metadata +
                '}';
    }
}
