package geoflow.coordinator.service;

import geoflow.coordinator.storage.FileObjectStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OutputSizeResolverTest {

    @TempDir
    Path root;

    @Test
    void fillsMissingSizesFromStoreThenFallback() {
        FileObjectStore store = new FileObjectStore(root);
        String stored = store.put("job/out.nc", new byte[42]);
        OutputSizeResolver resolver = new OutputSizeResolver(store, 7);

        List<Long> sizes = resolver.resolve(
                List.of("s3://bucket/a.nc", stored, "s3://bucket/c.nc"),
                Arrays.asList(100L, null, 0L));

        assertEquals(List.of(100L, 42L, 7L), sizes);
    }

    @Test
    void emptyReportedSizesUseLookup() {
        OutputSizeResolver resolver = new OutputSizeResolver(new FileObjectStore(root), 0);

        assertEquals(List.of(1L, 1L), resolver.resolve(List.of("https://x/a", "https://x/b"), List.of()));
    }
}
