package hle.affinity.backend;

/**
 * An initialized backend resource.
 *
 * <p>Thread Safety: implementations are NOT required to be thread-safe. Every call,
 * including {@link #release()}, is made from the worker thread that created the
 * handle, and never concurrently.
 */
public interface ResourceHandle {

    /**
     * Executes an opaque command against this resource.
     *
     * @param operation the operation identifier
     * @param params the opaque parameter payload
     * @return the result payload; the pool converts byte arrays, character sequences
     *         and scalar values into result bytes
     * @throws CommandExecutionException if the backend reports a failure
     */
    Object execute(String operation, String params) throws CommandExecutionException;

    /**
     * Releases everything this handle holds. Called exactly once, after the last command.
     */
    void release();
}
