package dk.cloudcreate.essentials.sessions.projection.deadletter;

import org.slf4j.*;

import java.util.*;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

public final class InMemoryDeadLetterChannel implements DeadLetterChannel {
    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterChannel.class);

    private final Map<String, DeadLetterMessage> messages = new LinkedHashMap<>();

    @Override
    public synchronized void send(DeadLetterMessage message) {
        requireNonNull(message, "No message provided");
        var existing = messages.values()
                               .stream()
                               .filter(deadLetter -> deadLetter.projectorName.equals(message.projectorName) && deadLetter.event.eventId.equals(message.event.eventId))
                               .findFirst();
        if (existing.isPresent()) {
            log.debug("[{}] Event '{}' is already dead lettered, incrementing delivery attempts", message.projectorName, message.event.eventId);
            messages.put(existing.get().id, existing.get().withFailedRedelivery(message.lastError));
        } else {
            log.debug("[{}] Dead lettering event '{}'", message.projectorName, message.event.eventId);
            messages.put(message.id, message);
        }
    }

    @Override
    public synchronized List<DeadLetterMessage> getDeadLetterMessages(String projectorName) {
        requireNonNull(projectorName, "No projectorName provided");
        return messages.values()
                       .stream()
                       .filter(message -> message.projectorName.equals(projectorName))
                       .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean recordFailedRedelivery(String id, Exception cause) {
        var message = messages.get(requireNonNull(id, "No id provided"));
        if (message == null) {
            return false;
        }
        messages.put(id, message.withFailedRedelivery(DeadLetterMessage.describe(cause)));
        return true;
    }

    @Override
    public synchronized boolean delete(String id) {
        return messages.remove(requireNonNull(id, "No id provided")) != null;
    }
}
