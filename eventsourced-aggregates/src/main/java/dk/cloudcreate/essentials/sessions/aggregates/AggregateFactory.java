package dk.cloudcreate.essentials.sessions.aggregates;

/**
 * Creates an empty (version 0) aggregate instance for a stream id, ready to have its history replayed
 *
 * @param <A> the aggregate type
 */
@FunctionalInterface
public interface AggregateFactory<A extends Aggregate<?, ?>> {
    A newInstance(String aggregateId);
}
