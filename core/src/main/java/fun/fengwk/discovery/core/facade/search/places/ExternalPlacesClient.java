package fun.fengwk.discovery.core.facade.search.places;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.discovery.core.configuration.DiscoveryProperties;
import fun.fengwk.discovery.core.exception.ExternalProviderDegradedException;
import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.BusinessSource;
import fun.fengwk.discovery.core.facade.search.model.CategorySummary;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.geo.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Searches the external places provider and maps its places into business results.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExternalPlacesClient {

    /**
     * Id prefix marking provider provenance.
     */
    public static final String ID_PREFIX = "google_";

    static final String LOCATION_ID_PREFIX = "google_location_";
    static final int MAX_CATEGORIES = 3;

    private final PlacesClient placesClient;
    private final DiscoveryProperties properties;
    private final ObjectMapper objectMapper;

    /**
     * Return provider places matching the query, tagged {@code external}.
     *
     * @throws ExternalProviderDegradedException if the provider fails or answers with an error
     */
    public List<BusinessResult> search(SearchQuery query) {
        if (!placesClient.isConfigured()) {
            log.warn("places provider not configured, returning empty results");
            return List.of();
        }

        PlacesRequest request = PlacesRequest.builder()
            .query(query.getQuery().trim())
            .latitude(query.getLatitude())
            .longitude(query.getLongitude())
            .radiusMeters(query.getRadiusMeters())
            .build();
        PlacesClientResponse response = placesClient.search(request);
        if (response.hasError()) {
            throw new ExternalProviderDegradedException(
                "places request failed: " + response.getError().getMessage(), response.getError());
        }
        if (response.getStatusCode() != 200) {
            throw new ExternalProviderDegradedException("places request failed with http " + response.getStatusCode());
        }
        if (!StringUtils.hasText(response.getBody())) {
            throw new ExternalProviderDegradedException("empty places response body");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(response.getBody());
        } catch (JsonProcessingException ex) {
            throw new ExternalProviderDegradedException("unparsable places response: " + ex.getOriginalMessage(), ex);
        }
        String status = textOrNull(root.get("status"));
        if (!"OK".equals(status) && !"ZERO_RESULTS".equals(status)) {
            throw new ExternalProviderDegradedException(
                "places status " + status + ": " + textOrNull(root.get("error_message")));
        }

        List<BusinessResult> results = new ArrayList<>();
        JsonNode places = root.get("results");
        if (places == null || !places.isArray()) {
            return results;
        }
        Set<String> seenIds = new HashSet<>();
        int maxResults = Math.max(0, properties.getMaxExternalResults());
        for (JsonNode place : places) {
            if (results.size() >= maxResults) {
                break;
            }
            String placeId = textOrNull(place.get("place_id"));
            if (!StringUtils.hasText(placeId) || !seenIds.add(placeId)) {
                continue;
            }
            BusinessResult result = toResult(placeId, place, query);
            if (matchesFilters(result, query)) {
                results.add(result);
            }
        }
        return results;
    }

    private BusinessResult toResult(String placeId, JsonNode place, SearchQuery query) {
        Double rating = doubleOrNull(place.get("rating"));
        JsonNode countNode = place.get("user_ratings_total");
        int ratingCount = countNode != null && countNode.isNumber() ? Math.max(0, countNode.intValue()) : 0;
        String photoUrl = firstPhotoUrl(place.get("photos"));

        JsonNode geo = place.path("geometry").path("location");
        BusinessLocation location = BusinessLocation.builder()
            .id(LOCATION_ID_PREFIX + placeId)
            .address(firstText(place.get("vicinity"), place.get("formatted_address")))
            .latitude(doubleOrNull(geo.get("lat")))
            .longitude(doubleOrNull(geo.get("lng")))
            .build();

        Double distance = null;
        if (query.hasLocation() && location.hasCoordinates()) {
            distance = GeoMath.distanceMeters(query.getLatitude(), query.getLongitude(),
                location.getLatitude(), location.getLongitude());
        }

        List<BusinessLocation> locations = new ArrayList<>();
        locations.add(location);
        return BusinessResult.builder()
            .id(ID_PREFIX + placeId)
            .name(textOrNull(place.get("name")))
            .logoUrl(photoUrl)
            .rating(rating)
            .ratingCount(ratingCount)
            .distanceMeters(distance)
            .source(BusinessSource.EXTERNAL)
            .categories(toCategories(place.get("types")))
            .locations(locations)
            .externalPlaceId(placeId)
            .externalRating(rating)
            .externalRatingCount(ratingCount)
            .externalPhotoUrl(photoUrl)
            .build();
    }

    /**
     * The provider knows nothing about catalog categories, so only the rating floor and radius apply.
     */
    private static boolean matchesFilters(BusinessResult result, SearchQuery query) {
        if (query.getRating() != null && (result.getRating() == null || result.getRating() < query.getRating())) {
            return false;
        }
        return result.getDistanceMeters() == null
            || GeoMath.withinRadius(result.getDistanceMeters(), query.getRadiusMeters());
    }

    private String firstPhotoUrl(JsonNode photos) {
        if (photos == null || !photos.isArray() || photos.isEmpty()) {
            return null;
        }
        String reference = textOrNull(photos.get(0).get("photo_reference"));
        return StringUtils.hasText(reference) ? placesClient.photoUrl(reference) : null;
    }

    private static List<CategorySummary> toCategories(JsonNode types) {
        List<CategorySummary> categories = new ArrayList<>();
        if (types == null || !types.isArray()) {
            return categories;
        }
        for (JsonNode type : types) {
            if (categories.size() >= MAX_CATEGORIES) {
                break;
            }
            String value = textOrNull(type);
            if (StringUtils.hasText(value)) {
                categories.add(new CategorySummary(value, humanize(value)));
            }
        }
        return categories;
    }

    /**
     * meal_takeaway -> Meal Takeaway
     */
    static String humanize(String type) {
        StringBuilder label = new StringBuilder(type.length());
        for (String word : type.toLowerCase(Locale.ROOT).split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (label.length() > 0) {
                label.append(' ');
            }
            label.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return label.toString();
    }

    private static String firstText(JsonNode first, JsonNode second) {
        String value = textOrNull(first);
        if (StringUtils.hasText(value)) {
            return value;
        }
        value = textOrNull(second);
        return value == null ? "" : value;
    }

    private static Double doubleOrNull(JsonNode node) {
        if (node == null || !node.isNumber()) {
            return null;
        }
        return node.doubleValue();
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return node.asText();
    }

}
