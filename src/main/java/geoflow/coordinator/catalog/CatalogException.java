package geoflow.coordinator.catalog;

/**
 * Failure of the remote catalog search. Retriable failures (timeouts, 5xx, I/O)
 * are retried with backoff at the discovery boundary; others surface immediately.
 */
public class CatalogException extends RuntimeException {

    private final boolean retriable;

    public CatalogException(String message, boolean retriable) {
        super(message);
        this.retriable = retriable;
    }

    public CatalogException(String message, Throwable cause, boolean retriable) {
        super(message, cause);
        this.retriable = retriable;
    }

    public boolean isRetriable() {
        return retriable;
    }
}
