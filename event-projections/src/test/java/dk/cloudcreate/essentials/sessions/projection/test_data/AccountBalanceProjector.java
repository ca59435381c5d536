package dk.cloudcreate.essentials.sessions.projection.test_data;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.StoredEvent;
import dk.cloudcreate.essentials.sessions.projection.Projector;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Balance per account, keyed by event id so redelivered events aren't counted twice
 */
public class AccountBalanceProjector implements Projector {
    private final Map<String, Map<String, Long>> depositsPerAccount = new ConcurrentHashMap<>();
    private final Map<String, String>            owners             = new ConcurrentHashMap<>();
    private volatile boolean                     failing;

    @Override
    public String name() {
        return "AccountBalance";
    }

    @Override
    public void project(StoredEvent event) {
        if (failing) {
            throw new IllegalStateException("Read model store unavailable");
        }
        event.eventData.deserialize().ifPresent(payload -> {
            if (payload instanceof AccountEvent.AccountOpened) {
                owners.put(event.aggregateId, ((AccountEvent.AccountOpened) payload).owner);
            } else if (payload instanceof AccountEvent.AmountDeposited) {
                depositsPerAccount.computeIfAbsent(event.aggregateId, id -> new ConcurrentHashMap<>())
                                  .put(event.eventId, ((AccountEvent.AmountDeposited) payload).amount);
            }
        });
    }

    @Override
    public void reset() {
        depositsPerAccount.clear();
        owners.clear();
    }

    public void setFailing(boolean failing) {
        this.failing = failing;
    }

    public long balanceOf(String accountId) {
        return depositsPerAccount.getOrDefault(accountId, Map.of()).values().stream().mapToLong(Long::longValue).sum();
    }

    public Optional<String> ownerOf(String accountId) {
        return Optional.ofNullable(owners.get(accountId));
    }

    public Map<String, Long> balances() {
        var balances = new TreeMap<String, Long>();
        depositsPerAccount.keySet().forEach(accountId -> balances.put(accountId, balanceOf(accountId)));
        owners.keySet().forEach(accountId -> balances.putIfAbsent(accountId, 0L));
        return balances;
    }
}
