package geoflow.coordinator.catalog;

import com.github.rholder.retry.Attempt;
import com.github.rholder.retry.RetryException;
import com.github.rholder.retry.RetryListener;
import com.github.rholder.retry.Retryer;
import com.github.rholder.retry.RetryerBuilder;
import com.github.rholder.retry.StopStrategies;
import com.github.rholder.retry.WaitStrategies;
import com.google.common.base.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Decorates a catalog client with bounded exponential-backoff retries of retriable failures.
 * Exhausted retries surface as a non-retriable {@link CatalogException}.
 */
public class RetryingCatalogClient implements CatalogClient {

    private static final Logger log = LoggerFactory.getLogger(RetryingCatalogClient.class);

    private static final Predicate<Throwable> RETRIABLE =
            t -> t instanceof CatalogException && ((CatalogException) t).isRetriable();

    private final CatalogClient delegate;
    private final int attempts;
    private final long backoffMultiplierMs;
    private final long maxBackoffMs;

    public RetryingCatalogClient(CatalogClient delegate, int attempts, Duration initialBackoff, Duration maxBackoff) {
        if (attempts < 1) {
            throw new IllegalArgumentException("attempts must be at least 1");
        }
        this.delegate = delegate;
        this.attempts = attempts;
        // exponentialWait sleeps multiplier * 2^n after the n-th failure
        this.backoffMultiplierMs = Math.max(1, initialBackoff.toMillis() / 2);
        this.maxBackoffMs = maxBackoff.toMillis();
    }

    @Override
    public CatalogPage search(CatalogQuery query, String cursor, int pageLimit) {
        Retryer<CatalogPage> retryer = RetryerBuilder.<CatalogPage>newBuilder()
                .retryIfException(RETRIABLE)
                .withWaitStrategy(WaitStrategies.exponentialWait(backoffMultiplierMs, maxBackoffMs, TimeUnit.MILLISECONDS))
                .withStopStrategy(StopStrategies.stopAfterAttempt(attempts))
                .withRetryListener(new RetryListener() {
                    @Override
                    public <V> void onRetry(Attempt<V> attempt) {
                        if (attempt.hasException()) {
                            log.warn("Catalog search for {} failed (attempt {} of {}): {}",
                                    query.collectionId(), attempt.getAttemptNumber(), attempts,
                                    attempt.getExceptionCause().getMessage());
                        }
                    }
                })
                .build();

        try {
            return retryer.call(() -> delegate.search(query, cursor, pageLimit));
        } catch (RetryException e) {
            Attempt<?> last = e.getLastFailedAttempt();
            Throwable cause = last.hasException() ? last.getExceptionCause() : e;
            throw new CatalogException("Catalog search failed after " + e.getNumberOfFailedAttempts()
                    + " attempts: " + cause.getMessage(), cause, false);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CatalogException catalogException) {
                throw catalogException;
            }
            throw new CatalogException("Catalog search failed: " + cause.getMessage(), cause, false);
        }
    }
}
