package dk.cloudcreate.essentials.sessions.common.functional;

/**
 * Variant of {@link java.util.function.Consumer} that is allowed to throw checked exceptions
 *
 * @param <T> the type of argument
 */
@FunctionalInterface
public interface CheckedConsumer<T> {
    void accept(T argument) throws Exception;
}
