package geoflow.coordinator.error;

/**
 * Thrown when a request is malformed or cannot be satisfied as stated,
 * e.g. a query that matches no granules or conflicting subset parameters.
 * Never retried. Mapped to HTTP 400.
 */
public class RequestValidationException extends IllegalArgumentException {

    public RequestValidationException(String message) {
        super(message);
    }
}
