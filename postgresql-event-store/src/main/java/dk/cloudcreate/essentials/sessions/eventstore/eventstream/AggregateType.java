package dk.cloudcreate.essentials.sessions.eventstore.eventstream;

import com.google.common.base.CaseFormat;

import java.util.regex.Pattern;

import static com.google.common.base.Preconditions.checkArgument;
import static dk.cloudcreate.essentials.sessions.common.MessageFormatter.msg;
import static java.util.Objects.requireNonNull;

/**
 * The type of Aggregate, e.g. <code>ChatSession</code>. It's the discriminator that separates the event streams of
 * different kinds of aggregates and is used to name the underlying event stream storage (see {@link #toTableName()}).
 */
public final class AggregateType implements Comparable<AggregateType> {
    private static final Pattern VALID_AGGREGATE_TYPE = Pattern.compile("[A-Z][A-Za-z0-9]*");

    private final String value;

    private AggregateType(String value) {
        requireNonNull(value, "No value provided");
        checkArgument(VALID_AGGREGATE_TYPE.matcher(value).matches(),
                      msg("AggregateType '{}' must be an UpperCamelCase name consisting of letters and digits", value));
        this.value = value;
    }

    public static AggregateType of(String value) {
        return new AggregateType(value);
    }

    public String value() {
        return value;
    }

    /**
     * @return the name of the table the event streams are stored in, e.g. <code>chat_session_events</code>
     */
    public String toTableName() {
        return CaseFormat.UPPER_CAMEL.to(CaseFormat.LOWER_UNDERSCORE, value) + "_events";
    }

    @Override
    public int compareTo(AggregateType o) {
        return value.compareTo(o.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AggregateType)) return false;
        return value.equals(((AggregateType) o).value);
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
