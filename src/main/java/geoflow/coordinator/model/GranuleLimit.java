package geoflow.coordinator.model;

/**
 * Effective granule cap for one source of a request and the candidate that produced it.
 * Not persisted.
 */
public record GranuleLimit(int maxGranules, GranuleLimitReason reason) {

    public static final GranuleLimit UNLIMITED = new GranuleLimit(Integer.MAX_VALUE, GranuleLimitReason.NONE);

    /**
     * Build the capacity advisory shown to the user when the catalog matched more
     * granules than will be processed.
     *
     * @param hits         granules the catalog identified
     * @param collectionId collection the granules belong to
     * @param serviceName  service chain name
     * @param maxResults   caller-supplied maxResults, may be null
     * @return the message, or null when nothing was limited
     */
    public String advisoryMessage(int hits, String collectionId, String serviceName, Integer maxResults) {
        if (reason == GranuleLimitReason.NONE || hits <= maxGranules) {
            return null;
        }
        String message = "CMR query identified " + hits + " granules, but the request has been limited "
                + "to process only the first " + maxGranules + " granules";
        return switch (reason) {
            case MAX_RESULTS -> message + " because you requested " + maxResults + " maxResults.";
            case SERVICE -> message + " because the service " + serviceName + " is limited to " + maxGranules + ".";
            case COLLECTION -> message + " because collection " + collectionId + " is limited to " + maxGranules
                    + " for the " + serviceName + " service.";
            default -> message + " because of system constraints.";
        };
    }
}
