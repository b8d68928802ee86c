package fun.fengwk.discovery.core.facade.search.catalog;

import fun.fengwk.discovery.core.geo.GeoMath;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Read query sent to the catalog store.
 *
 * @author fengwk
 */
@Value
@Builder
public class CatalogQuery {

    /**
     * Text matched case-insensitively as a substring of name, username or about.
     */
    String text;

    /**
     * Any-of category filter, empty means no filter.
     */
    @Builder.Default
    List<String> categoryIds = List.of();

    /**
     * Minimum average rating, null means no floor. The store may return businesses slightly below it,
     * the exact floor is applied to the rounded rating.
     */
    Double minRating;

    /**
     * Only businesses with a location inside this box, null means no location filter.
     */
    GeoMath.BoundingBox boundingBox;

}
