package geoflow.coordinator.model;

/**
 * One upstream output waiting for (or assigned to) a batch of a batched step.
 * Ordered by the producing work item's sort index, then by its position in that
 * item's results. A placeholder has no location and stands in for a producer that
 * succeeded without outputs.
 */
public record BatchItem(
        String jobId,
        int stepIndex,
        long producerIndex,
        int outputIndex,
        String location,
        long sizeBytes,
        String batchId) {

    public static BatchItem output(String jobId, int stepIndex, long producerIndex, int outputIndex,
            String location, long sizeBytes) {
        return new BatchItem(jobId, stepIndex, producerIndex, outputIndex, location, sizeBytes, null);
    }

    public static BatchItem placeholder(String jobId, int stepIndex, long producerIndex) {
        return new BatchItem(jobId, stepIndex, producerIndex, 0, null, 0L, null);
    }

    public boolean isPlaceholder() {
        return location == null;
    }
}
