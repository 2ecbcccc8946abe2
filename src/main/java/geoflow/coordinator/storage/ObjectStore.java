package geoflow.coordinator.storage;

import java.util.Optional;

/**
 * Blob storage for granule catalogs and batch catalogs.
 * Paths are written once; every writer uses a unique path.
 */
public interface ObjectStore {

    /**
     * Write {@code content} at {@code path}, relative to the store root.
     *
     * @return the location string readers use to fetch it
     */
    String put(String path, byte[] content);

    byte[] get(String location);

    /**
     * Size of the object at {@code location}, empty when the location is not
     * served by this store or does not exist.
     */
    Optional<Long> size(String location);
}
