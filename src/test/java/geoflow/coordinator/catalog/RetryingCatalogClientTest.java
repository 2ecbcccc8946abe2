package geoflow.coordinator.catalog;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RetryingCatalogClientTest {

    private static final CatalogQuery QUERY = new CatalogQuery("C1", null, null, null, "token");

    @Mock
    private CatalogClient delegate;

    @Test
    void retriesRetriableFailuresUntilSuccess() {
        CatalogPage page = new CatalogPage(3, List.of(), null);
        when(delegate.search(any(), isNull(), anyInt()))
                .thenThrow(new CatalogException("503", true))
                .thenReturn(page);

        CatalogPage result = client(3).search(QUERY, null, 0);

        assertSame(page, result);
        verify(delegate, times(2)).search(any(), isNull(), anyInt());
    }

    @Test
    void nonRetriableFailureSurfacesImmediately() {
        when(delegate.search(any(), isNull(), anyInt())).thenThrow(new CatalogException("400 bad query", false));

        CatalogException e = assertThrows(CatalogException.class, () -> client(3).search(QUERY, null, 0));

        assertEquals("400 bad query", e.getMessage());
        verify(delegate, times(1)).search(any(), isNull(), anyInt());
    }

    @Test
    void exhaustedRetriesBecomeNonRetriable() {
        when(delegate.search(any(), isNull(), anyInt())).thenThrow(new CatalogException("timeout", true));

        CatalogException e = assertThrows(CatalogException.class, () -> client(3).search(QUERY, null, 0));

        assertFalse(e.isRetriable());
        assertTrue(e.getMessage().contains("after 3 attempts"));
        verify(delegate, times(3)).search(any(), isNull(), anyInt());
    }

    private RetryingCatalogClient client(int attempts) {
        return new RetryingCatalogClient(delegate, attempts, Duration.ofMillis(2), Duration.ofMillis(10));
    }
}
