package fun.fengwk.discovery.core.facade.search.places.google;

import fun.fengwk.discovery.core.facade.search.places.PlacesClient;
import fun.fengwk.discovery.core.facade.search.places.PlacesClientResponse;
import fun.fengwk.discovery.core.facade.search.places.PlacesRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Google Places HTTP client.
 *
 * <p>Uses nearby search when the request carries a location and text search otherwise.</p>
 *
 * @author fengwk
 */
@Slf4j
@Component
public class GooglePlacesClient implements PlacesClient {

    static final String NEARBY_SEARCH_PATH = "/nearbysearch/json";
    static final String TEXT_SEARCH_PATH = "/textsearch/json";
    static final String PHOTO_PATH = "/photo";

    private final GooglePlacesProperties properties;
    private final HttpClient httpClient;

    public GooglePlacesClient(GooglePlacesProperties properties) {
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getTimeoutMs()))
            .build();
    }

    @Override
    public boolean isConfigured() {
        return StringUtils.hasText(properties.getApiKey());
    }

    @Override
    public PlacesClientResponse search(PlacesRequest request) {
        Map<String, String> params = new LinkedHashMap<>();
        String path;
        if (request.hasLocation()) {
            path = NEARBY_SEARCH_PATH;
            params.put("location", request.getLatitude() + "," + request.getLongitude());
            params.put("radius", String.valueOf(request.getRadiusMeters()));
            params.put("keyword", request.getQuery());
        } else {
            path = TEXT_SEARCH_PATH;
            params.put("query", request.getQuery());
        }
        params.put("type", "establishment");
        params.put("key", properties.getApiKey());

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(buildUri(path, buildQueryString(params)))
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json")
            .GET()
            .build();
        try {
            HttpResponse<String> response = httpClient.send(
                httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return PlacesClientResponse.builder()
                .statusCode(response.statusCode())
                .body(response.body())
                .build();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.warn("places request interrupted, path={}", path);
            return PlacesClientResponse.builder().error(ex).build();
        } catch (IOException ex) {
            log.warn("places request failed, path={}, error={}", path, ex.getMessage());
            return PlacesClientResponse.builder().error(ex).build();
        }
    }

    @Override
    public String photoUrl(String photoReference) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("maxwidth", String.valueOf(properties.getPhotoMaxWidth()));
        params.put("photoreference", photoReference);
        params.put("key", properties.getApiKey());
        return buildUri(PHOTO_PATH, buildQueryString(params)).toString();
    }

    private URI buildUri(String path, String queryString) {
        String baseUrl = StringUtils.hasText(properties.getBaseUrl())
            ? properties.getBaseUrl().trim()
            : "";
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return URI.create(baseUrl + path + "?" + queryString);
    }

    private String buildQueryString(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            String value = URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8);
            joiner.add(key + "=" + value);
        }
        return joiner.toString();
    }

}
