package geoflow.coordinator.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Object store backed by a local directory. Locations are {@code file:} URIs.
 */
public class FileObjectStore implements ObjectStore {

    private static final Logger log = LoggerFactory.getLogger(FileObjectStore.class);

    private final Path root;

    public FileObjectStore(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create object store root " + this.root, e);
        }
        log.info("Object store rooted at {}", this.root);
    }

    public Path root() {
        return root;
    }

    @Override
    public String put(String path, byte[] content) {
        Path target = root.resolve(path).normalize();
        if (!target.startsWith(root)) {
            throw new IllegalArgumentException("Path escapes the object store root: " + path);
        }
        try {
            Files.createDirectories(target.getParent());
            Files.write(target, content);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + target, e);
        }
        return target.toUri().toString();
    }

    @Override
    public byte[] get(String location) {
        Path path = resolve(location)
                .orElseThrow(() -> new IllegalArgumentException("Not an object store location: " + location));
        try {
            return Files.readAllBytes(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + location, e);
        }
    }

    @Override
    public Optional<Long> size(String location) {
        Optional<Path> path = resolve(location);
        if (path.isEmpty() || !Files.isRegularFile(path.get())) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.size(path.get()));
        } catch (IOException e) {
            log.warn("Could not stat {}: {}", location, e.getMessage());
            return Optional.empty();
        }
    }

    private Optional<Path> resolve(String location) {
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        if (location.startsWith("file:")) {
            return Optional.of(Paths.get(URI.create(location)));
        }
        if (location.contains("://")) {
            // remote schemes are not served here
            return Optional.empty();
        }
        Path path = Paths.get(location);
        return Optional.of(path.isAbsolute() ? path : root.resolve(path).normalize());
    }
}
