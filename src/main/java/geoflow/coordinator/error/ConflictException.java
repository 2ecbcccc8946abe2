package geoflow.coordinator.error;

/**
 * Thrown when a state change is requested that the current state does not allow,
 * such as canceling a job that already finished. Mapped to HTTP 409.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
