package hle.affinity.pool;

/**
 * Thrown when a backend returned a payload that cannot be turned into result bytes.
 */
public class ResultShapeException extends ResourcePoolException {

    public ResultShapeException(String message) {
        super(message);
    }
}
