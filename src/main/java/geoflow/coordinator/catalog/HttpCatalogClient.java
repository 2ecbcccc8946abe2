package geoflow.coordinator.catalog;

import com.fasterxml.jackson.databind.JsonNode;
import geoflow.coordinator.model.Temporal;
import geoflow.coordinator.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.UUID;

/**
 * CMR-style granule search over HTTP.
 *
 * <p>Cursors have the form {@code sessionKey:searchAfter}. The session key identifies one paging
 * session in logs; the search-after value is sent back in the {@code CMR-Search-After} header.
 */
public class HttpCatalogClient implements CatalogClient {

    private static final Logger log = LoggerFactory.getLogger(HttpCatalogClient.class);

    private static final String HITS_HEADER = "CMR-Hits";
    private static final String SEARCH_AFTER_HEADER = "CMR-Search-After";
    private static final String DATA_REL_SUFFIX = "/data#";
    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final String baseUrl;
    private final HttpClient httpClient;

    public HttpCatalogClient(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public CatalogPage search(CatalogQuery query, String cursor, int pageLimit) {
        if (query.shape() != null) {
            throw new CatalogException("Shape-constrained searches are not supported by " + baseUrl, false);
        }

        String sessionKey;
        String searchAfter = null;
        if (cursor != null) {
            int split = cursor.indexOf(':');
            if (split < 0) {
                throw new CatalogException("Malformed catalog cursor", false);
            }
            sessionKey = cursor.substring(0, split);
            searchAfter = cursor.substring(split + 1);
        } else {
            sessionKey = UUID.randomUUID().toString();
        }

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/search/granules.json?" + queryString(query, pageLimit)))
                .timeout(Duration.ofSeconds(60))
                .header("Accept", "application/json")
                .GET();
        if (searchAfter != null && !searchAfter.isEmpty()) {
            request.header(SEARCH_AFTER_HEADER, searchAfter);
        }
        if (query.accessToken() != null) {
            request.header("Authorization", "Bearer " + query.accessToken());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new CatalogException("Catalog request failed: " + e.getMessage(), e, true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CatalogException("Interrupted while querying the catalog", e, false);
        }

        int status = response.statusCode();
        if (status >= 500 || status == 429) {
            throw new CatalogException("Catalog returned HTTP " + status, true);
        }
        if (status >= 400) {
            throw new CatalogException("Catalog rejected the query with HTTP " + status + ": " + response.body(), false);
        }

        int hits = response.headers().firstValue(HITS_HEADER).map(Integer::parseInt).orElse(0);
        List<Granule> granules = parseGranules(response.body(), query.collectionId());
        String next = response.headers().firstValue(SEARCH_AFTER_HEADER)
                .filter(v -> !granules.isEmpty())
                .map(v -> sessionKey + ":" + v)
                .orElse(null);

        log.debug("Catalog page for {} (session {}): {} granules of {} hits",
                query.collectionId(), sessionKey, granules.size(), hits);
        return new CatalogPage(hits, granules, next);
    }

    private String queryString(CatalogQuery query, int pageLimit) {
        StringJoiner params = new StringJoiner("&");
        params.add("collection_concept_id=" + encode(query.collectionId()));
        params.add("page_size=" + pageLimit);
        params.add("sort_key=start_date");
        if (query.bbox() != null) {
            StringJoiner bbox = new StringJoiner(",");
            query.bbox().forEach(v -> bbox.add(String.valueOf(v)));
            params.add("bounding_box=" + encode(bbox.toString()));
        }
        Temporal temporal = query.temporal();
        if (temporal != null && (temporal.start() != null || temporal.end() != null)) {
            String start = temporal.start() != null ? temporal.start().toString() : "";
            String end = temporal.end() != null ? temporal.end().toString() : "";
            params.add("temporal=" + encode(start + "," + end));
        }
        return params.toString();
    }

    private List<Granule> parseGranules(String body, String collectionId) {
        List<Granule> granules = new ArrayList<>();
        JsonNode entries = Json.read(body, JsonNode.class).path("feed").path("entry");
        for (JsonNode entry : entries) {
            List<String> links = new ArrayList<>();
            for (JsonNode link : entry.path("links")) {
                String rel = link.path("rel").asText("");
                if (rel.endsWith(DATA_REL_SUFFIX) && !link.path("inherited").asBoolean(false)) {
                    links.add(link.path("href").asText());
                }
            }
            Long size = null;
            if (entry.hasNonNull("granule_size")) {
                double megabytes = entry.path("granule_size").asDouble(-1);
                size = megabytes >= 0 ? Math.round(megabytes * BYTES_PER_MB) : null;
            }
            granules.add(new Granule(
                    entry.path("id").asText(),
                    entry.path("title").asText(),
                    collectionId,
                    links,
                    size));
        }
        return granules;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
