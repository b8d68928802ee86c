package fun.fengwk.discovery.core.facade.search.catalog;

import fun.fengwk.discovery.core.exception.DiscoveryException;
import fun.fengwk.discovery.core.exception.StorageUnavailableException;
import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.BusinessSource;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.geo.GeoMath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Searches the platform's own catalog.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LocalCatalogSearch {

    private final CatalogReader catalogReader;

    /**
     * Return catalog businesses matching the query, unordered, tagged {@code local}.
     *
     * @throws StorageUnavailableException if the catalog cannot be read
     */
    public List<BusinessResult> search(SearchQuery query) {
        CatalogQuery catalogQuery = CatalogQuery.builder()
            .text(query.getQuery().trim())
            .categoryIds(new ArrayList<>(new LinkedHashSet<>(query.getCategoryIds())))
            .minRating(query.getRating())
            .boundingBox(query.hasLocation()
                ? GeoMath.boundingBox(query.getLatitude(), query.getLongitude(), query.getRadiusMeters())
                : null)
            .build();

        List<CatalogBusinessRecord> records;
        try {
            records = catalogReader.findBusinesses(catalogQuery);
        } catch (DiscoveryException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new StorageUnavailableException("catalog read failed: " + ex.getMessage(), ex);
        }

        List<BusinessResult> results = new ArrayList<>(records.size());
        for (CatalogBusinessRecord record : records) {
            Double distance = null;
            if (query.hasLocation()) {
                distance = nearestDistanceWithin(record.getLocations(), query.getLatitude(), query.getLongitude(),
                    query.getRadiusMeters());
                if (distance == null) {
                    continue;
                }
            }
            BusinessResult result = toResult(record, distance);
            if (!meetsRatingFloor(result.getRating(), query.getRating())) {
                continue;
            }
            results.add(result);
        }
        log.debug("local catalog search done, query={}, candidates={}, matched={}",
            catalogQuery.getText(), records.size(), results.size());
        return results;
    }

    /**
     * Distance to the nearest location inside the radius, or null when none is.
     */
    private static Double nearestDistanceWithin(List<BusinessLocation> locations, double latitude, double longitude,
                                                int radiusMeters) {
        Double nearest = null;
        for (BusinessLocation location : locations) {
            if (!location.hasCoordinates()) {
                continue;
            }
            double distance = GeoMath.distanceMeters(latitude, longitude, location.getLatitude(), location.getLongitude());
            if (GeoMath.withinRadius(distance, radiusMeters) && (nearest == null || distance < nearest)) {
                nearest = distance;
            }
        }
        return nearest;
    }

    /**
     * Compares the displayed one-decimal rating, the same value external places are filtered on.
     */
    static boolean meetsRatingFloor(Double rating, Double minRating) {
        return minRating == null || (rating != null && rating >= minRating);
    }

    private static BusinessResult toResult(CatalogBusinessRecord record, Double distance) {
        int ratingCount = Math.max(0, record.getRatingCount());
        return BusinessResult.builder()
            .id(record.getId())
            .name(record.getName())
            .username(record.getUsername())
            .logoUrl(record.getLogoUrl())
            .about(record.getAbout())
            .rating(averageRating(record.getRatingSum(), ratingCount))
            .ratingCount(ratingCount)
            .distanceMeters(distance)
            .source(BusinessSource.LOCAL)
            .categories(new ArrayList<>(record.getCategories()))
            .locations(new ArrayList<>(record.getLocations()))
            .build();
    }

    static Double averageRating(double ratingSum, int ratingCount) {
        if (ratingCount <= 0) {
            return null;
        }
        return BigDecimal.valueOf(ratingSum / ratingCount).setScale(1, RoundingMode.HALF_UP).doubleValue();
    }

}
