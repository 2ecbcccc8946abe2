package geoflow.coordinator.catalog;

/**
 * Remote catalog search collaborator.
 */
public interface CatalogClient {

    /**
     * Search one page of granules.
     *
     * @param query     search constraints
     * @param cursor    opaque cursor from the previous page, null for the first page
     * @param pageLimit maximum granules to return; 0 only reports the hit count
     * @throws CatalogException when the search fails
     */
    CatalogPage search(CatalogQuery query, String cursor, int pageLimit);
}
