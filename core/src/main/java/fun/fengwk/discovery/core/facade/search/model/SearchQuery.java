package fun.fengwk.discovery.core.facade.search.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Business search input, already parsed by the inbound layer.
 *
 * @author fengwk
 */
@Value
@Builder(toBuilder = true)
public class SearchQuery {

    public static final int DEFAULT_PAGE = 1;
    public static final int DEFAULT_LIMIT = 20;
    public static final int DEFAULT_RADIUS_METERS = 5000;

    /**
     * Free text matched against name, handle and description.
     */
    String query;

    /**
     * Category filter, a business matches when it has any of them.
     */
    @Builder.Default
    List<String> categoryIds = List.of();

    /**
     * Minimum average rating, 1.0 to 5.0.
     */
    Double rating;

    /**
     * Search radius around the location.
     */
    @Builder.Default
    int radiusMeters = DEFAULT_RADIUS_METERS;

    Double latitude;

    Double longitude;

    /**
     * Page number, starting from 1.
     */
    @Builder.Default
    int page = DEFAULT_PAGE;

    @Builder.Default
    int limit = DEFAULT_LIMIT;

    @Builder.Default
    SortBy sortBy = SortBy.RATING;

    @Builder.Default
    SortOrder sortOrder = SortOrder.DESC;

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

}
