package dk.cloudcreate.essentials.sessions.eventstore.persistence;

import dk.cloudcreate.essentials.sessions.eventstore.eventstream.AggregateType;

import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Configuration for the persistence of the event streams belonging to a given {@link AggregateType}.
 * All event streams of an {@link AggregateType} share the same table.
 */
public final class AggregateTypeConfiguration {
    /**
     * The type of Aggregate this configuration relates to
     */
    public final AggregateType  aggregateType;
    /**
     * The name of the table where the event streams are persisted
     */
    public final String         eventStreamTableName;
    /**
     * The SQL fetch size for Queries
     */
    public final int            queryFetchSize;
    public final JSONColumnType jsonColumnType;

    public AggregateTypeConfiguration(AggregateType aggregateType,
                                      String eventStreamTableName,
                                      int queryFetchSize,
                                      JSONColumnType jsonColumnType) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.eventStreamTableName = requireNonNull(eventStreamTableName, "No eventStreamTableName provided").toLowerCase();
        checkArgument(this.eventStreamTableName.matches("[a-z_][a-z0-9_]*"), "Invalid eventStreamTableName '%s'", eventStreamTableName);
        checkArgument(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
        this.jsonColumnType = requireNonNull(jsonColumnType, "No jsonColumnType provided");
    }

    /**
     * Standard configuration: table <code>{@link AggregateType#toTableName()}</code>, fetch size 100 and {@link JSONColumnType#JSON} columns
     */
    public static AggregateTypeConfiguration standardConfiguration(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return new AggregateTypeConfiguration(aggregateType,
                                              aggregateType.toTableName(),
                                              100,
                                              JSONColumnType.JSON);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateTypeConfiguration)) return false;
        AggregateTypeConfiguration that = (AggregateTypeConfiguration) o;
        return aggregateType.equals(that.aggregateType);
    }

    @Override
    public int hashCode() {
        return Objects.hash(aggregateType);
    }

    @Override
    public String toString() {
        return "AggregateTypeConfiguration{" +
                "aggregateType=" + aggregateType +
                ", eventStreamTableName='" + eventStreamTableName + '\'' +
                '}';
    }
}
