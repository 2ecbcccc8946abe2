package geoflow.coordinator.catalog;

import geoflow.coordinator.model.DataOperation;
import geoflow.coordinator.model.Source;
import geoflow.coordinator.model.Temporal;

import java.util.List;

/**
 * Granule search constraints for one source collection.
 *
 * @param accessToken plaintext user token, may be null
 */
public record CatalogQuery(
        String collectionId,
        List<Double> bbox,
        Temporal temporal,
        String shape,
        String accessToken) {

    public static CatalogQuery of(DataOperation operation, Source source, String accessToken) {
        return new CatalogQuery(
                source.collectionId(),
                operation.subset().bbox(),
                operation.subset().temporal(),
                operation.subset().shape(),
                accessToken);
    }

    @Override
    public String toString() {
        // keep the token out of logs
        return "CatalogQuery{collectionId='" + collectionId + "', bbox=" + bbox + ", temporal=" + temporal
                + ", shape=" + shape + '}';
    }
}
