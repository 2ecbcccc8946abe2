package geoflow.coordinator.storage;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FileObjectStoreTest {

    @TempDir
    Path root;

    @Test
    void putReturnsReadableFileLocation() {
        FileObjectStore store = new FileObjectStore(root);

        String location = store.put("job-1/batches/1/b0/catalog.json", "{}".getBytes(StandardCharsets.UTF_8));

        assertTrue(location.startsWith("file:"));
        assertEquals("{}", new String(store.get(location), StandardCharsets.UTF_8));
        assertEquals(Optional.of(2L), store.size(location));
    }

    @Test
    void relativeLocationsResolveAgainstRoot() {
        FileObjectStore store = new FileObjectStore(root);
        store.put("a/b.json", new byte[7]);

        assertEquals(Optional.of(7L), store.size("a/b.json"));
    }

    @Test
    void remoteAndMissingLocationsHaveNoSize() {
        FileObjectStore store = new FileObjectStore(root);

        assertTrue(store.size("s3://bucket/key.nc").isEmpty());
        assertTrue(store.size("missing.json").isEmpty());
        assertTrue(store.size(null).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.get("https://example.org/x"));
    }

    @Test
    void pathsMayNotEscapeRoot() {
        FileObjectStore store = new FileObjectStore(root);

        assertThrows(IllegalArgumentException.class, () -> store.put("../outside.json", new byte[1]));
    }
}
