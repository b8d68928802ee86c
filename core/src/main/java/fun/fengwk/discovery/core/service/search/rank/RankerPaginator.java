package fun.fengwk.discovery.core.service.search.rank;

import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.Pagination;
import fun.fengwk.discovery.core.facade.search.model.SortBy;
import fun.fengwk.discovery.core.facade.search.model.SortOrder;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/**
 * Orders merged results and cuts out the requested page.
 *
 * <p>Records missing the sort key go last whatever the order, ties fall back to id ascending.
 *
 * @author fengwk
 */
@Component
public class RankerPaginator {

    public RankedPage rank(List<BusinessResult> results, SortBy sortBy, SortOrder sortOrder,
                           boolean hasLocation, int page, int limit) {
        SortBy applied = effectiveSortBy(sortBy, hasLocation);
        List<BusinessResult> sorted = new ArrayList<>(results);
        sorted.sort(comparator(applied, sortOrder == null ? SortOrder.DESC : sortOrder));

        int total = sorted.size();
        Pagination pagination = Pagination.of(page, limit, total);
        long from = (long) (page - 1) * limit;
        List<BusinessResult> items = from >= total
            ? new ArrayList<>()
            : new ArrayList<>(sorted.subList((int) from, (int) Math.min(total, from + limit)));
        return new RankedPage(items, pagination, applied);
    }

    /**
     * Distance is meaningless without a location, rating takes its place.
     */
    public static SortBy effectiveSortBy(SortBy sortBy, boolean hasLocation) {
        if (sortBy == null) {
            return SortBy.RATING;
        }
        if (sortBy == SortBy.DISTANCE && !hasLocation) {
            return SortBy.RATING;
        }
        return sortBy;
    }

    static Comparator<BusinessResult> comparator(SortBy sortBy, SortOrder sortOrder) {
        Comparator<BusinessResult> primary = switch (sortBy) {
            case RATING -> nullsLast(BusinessResult::getRating, sortOrder);
            case REVIEWS -> nullsLast(result -> result.getRatingCount(), sortOrder);
            case NAME -> nullsLast(result -> result.getName() == null ? null : result.getName().toLowerCase(Locale.ROOT), sortOrder);
            case DISTANCE -> nullsLast(BusinessResult::getDistanceMeters, sortOrder);
        };
        return primary.thenComparing(BusinessResult::getId, Comparator.nullsLast(Comparator.naturalOrder()));
    }

    private static <K extends Comparable<? super K>> Comparator<BusinessResult> nullsLast(
        Function<BusinessResult, K> keyExtractor, SortOrder sortOrder) {
        Comparator<K> natural = Comparator.naturalOrder();
        Comparator<K> ordered = sortOrder.isDescending() ? natural.reversed() : natural;
        return Comparator.comparing(keyExtractor, Comparator.nullsLast(ordered));
    }

}
