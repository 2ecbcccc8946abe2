package geoflow.coordinator.model;

import geoflow.coordinator.error.RequestValidationException;
import geoflow.coordinator.util.Json;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DataOperationTest {

    @Test
    void parsesRequestJson() {
        DataOperation op = Json.read("""
                {
                  "requestId": "r-1",
                  "sources": [{"collection": "C1", "variables": ["sst"]}],
                  "subset": {"bbox": [-10, -5, 10, 5], "temporal": {"start": "2020-01-01T00:00:00Z"}},
                  "format": "application/x-zarr",
                  "maxResults": 7
                }
                """, DataOperation.class);

        assertEquals("C1", op.sources().get(0).collectionId());
        assertEquals(List.of("sst"), op.sources().get(0).variables());
        assertEquals(4, op.subset().bbox().size());
        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), op.subset().temporal().start());
        assertEquals(7, op.maxResults());
        assertDoesNotThrow(op::validate);
    }

    @Test
    void withSourceGranuleCountLeavesOriginalUntouched() {
        DataOperation op = operation(new Subset(null, null, null), null);

        DataOperation counted = op.withSourceGranuleCount(0, 12);

        assertNull(op.sources().get(0).granuleCount());
        assertEquals(12, counted.sources().get(0).granuleCount());
        assertEquals(12, counted.granuleCount());
    }

    @Test
    void rejectsMissingSources() {
        DataOperation op = new DataOperation(null, List.of(), null, null, false, null, null);
        assertThrows(RequestValidationException.class, op::validate);
    }

    @Test
    void rejectsBboxTogetherWithShape() {
        DataOperation op = operation(new Subset(List.of(0.0, 0.0, 1.0, 1.0), "file:/shape.json", null), null);
        RequestValidationException e = assertThrows(RequestValidationException.class, op::validate);
        assertTrue(e.getMessage().contains("bounding box and a shape"));
    }

    @Test
    void acceptsWellFormedBbox() {
        DataOperation op = operation(new Subset(List.of(-180.0, -90.0, 180.0, 90.0), null, null), null);
        assertDoesNotThrow(op::validate);
    }

    @Test
    void rejectsBboxWithWrongArity() {
        DataOperation op = operation(new Subset(List.of(0.0, 0.0, 1.0), null, null), null);
        RequestValidationException e = assertThrows(RequestValidationException.class, op::validate);
        assertTrue(e.getMessage().contains("exactly 4 values"));
    }

    @Test
    void rejectsInvertedLatitudes() {
        DataOperation op = operation(new Subset(List.of(0.0, 10.0, 1.0, -10.0), null, null), null);
        assertThrows(RequestValidationException.class, op::validate);
    }

    @Test
    void rejectsInvertedTemporalRange() {
        Temporal backwards = new Temporal(Instant.parse("2021-01-01T00:00:00Z"), Instant.parse("2020-01-01T00:00:00Z"));
        DataOperation op = operation(new Subset(null, null, backwards), null);
        assertThrows(RequestValidationException.class, op::validate);
    }

    @Test
    void rejectsNonPositiveMaxResults() {
        assertThrows(RequestValidationException.class, () -> operation(Subset.none(), 0).validate());
    }

    private static DataOperation operation(Subset subset, Integer maxResults) {
        return new DataOperation(null, List.of(new Source("C1", List.of())), subset, null, false, null, maxResults);
    }
}
