package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Single business in a search response.
 *
 * @author fengwk
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BusinessResult {

    /**
     * Catalog id, or provider tag plus place id for external-only hits.
     */
    private String id;

    private String name;

    /**
     * Catalog handle, absent for external-only hits.
     */
    private String username;

    private String logoUrl;

    private String about;

    /**
     * Average rating rounded to one decimal, null without reviews.
     */
    private Double rating;

    private int ratingCount;

    /**
     * Meters to the nearest location, present only when the query carried a location.
     */
    private Double distanceMeters;

    private BusinessSource source;

    @Builder.Default
    private List<CategorySummary> categories = new ArrayList<>();

    @Builder.Default
    private List<BusinessLocation> locations = new ArrayList<>();

    /**
     * Provider place id, set on external and merged records.
     */
    private String externalPlaceId;

    private Double externalRating;

    private Integer externalRatingCount;

    private String externalPhotoUrl;

}
