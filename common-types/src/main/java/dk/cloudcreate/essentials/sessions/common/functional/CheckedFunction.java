package dk.cloudcreate.essentials.sessions.common.functional;

/**
 * Variant of {@link java.util.function.Function} that is allowed to throw checked exceptions
 *
 * @param <T> the type of argument
 * @param <R> the type of result
 */
@FunctionalInterface
public interface CheckedFunction<T, R> {
    R apply(T argument) throws Exception;
}
