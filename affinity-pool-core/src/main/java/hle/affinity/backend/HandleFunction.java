package hle.affinity.backend;

/**
 * A function that runs against a resource handle on the handle's worker thread.
 * This is similar to {@link java.util.function.Function} but can throw checked exceptions.
 *
 * @param <T> the type of result returned by this function
 */
@FunctionalInterface
public interface HandleFunction<T> {

    /**
     * Applies this function to the given handle.
     *
     * @param handle the handle, only valid for the duration of the call
     * @return the result
     * @throws Exception if the function fails
     */
    T apply(ResourceHandle handle) throws Exception;
}
