package fun.fengwk.discovery.core.service.search.impl;

import fun.fengwk.discovery.core.exception.SearchValidationException;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.facade.search.model.SortBy;
import fun.fengwk.discovery.core.facade.search.model.SortOrder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Range checks for search input.
 *
 * @author fengwk
 */
@Component
public class SearchQueryValidator {

    static final int MAX_QUERY_LENGTH = 255;
    static final int MAX_CATEGORY_IDS = 10;
    static final double MIN_RATING = 1.0;
    static final double MAX_RATING = 5.0;
    static final int MIN_RADIUS_METERS = 100;
    static final int MAX_RADIUS_METERS = 50_000;
    static final int MAX_LIMIT = 100;

    /**
     * Check every field and return the query with text trimmed, category ids deduplicated and
     * missing sort options defaulted.
     *
     * @throws SearchValidationException on the first violation
     */
    public SearchQuery validate(SearchQuery query) {
        if (query == null) {
            throw new SearchValidationException("search query is required");
        }
        if (!StringUtils.hasText(query.getQuery())) {
            throw new SearchValidationException("query is blank");
        }
        String text = query.getQuery().trim();
        if (text.length() > MAX_QUERY_LENGTH) {
            throw new SearchValidationException("query longer than " + MAX_QUERY_LENGTH + " characters");
        }

        List<String> categoryIds = normalizeCategoryIds(query.getCategoryIds());
        if (categoryIds.size() > MAX_CATEGORY_IDS) {
            throw new SearchValidationException("at most " + MAX_CATEGORY_IDS + " category ids are allowed");
        }

        Double rating = query.getRating();
        if (rating != null && (rating.isNaN() || rating < MIN_RATING || rating > MAX_RATING)) {
            throw new SearchValidationException("rating must be between 1.0 and 5.0");
        }
        if (query.getRadiusMeters() < MIN_RADIUS_METERS || query.getRadiusMeters() > MAX_RADIUS_METERS) {
            throw new SearchValidationException("radius must be between " + MIN_RADIUS_METERS + " and "
                + MAX_RADIUS_METERS + " meters");
        }
        validateLocation(query.getLatitude(), query.getLongitude());
        validatePaging(query.getPage(), query.getLimit());

        return query.toBuilder()
            .query(text)
            .categoryIds(categoryIds)
            .sortBy(query.getSortBy() == null ? SortBy.RATING : query.getSortBy())
            .sortOrder(query.getSortOrder() == null ? SortOrder.DESC : query.getSortOrder())
            .build();
    }

    public void validatePaging(int page, int limit) {
        if (page < 1) {
            throw new SearchValidationException("page must be at least 1");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new SearchValidationException("limit must be between 1 and " + MAX_LIMIT);
        }
    }

    public String validateUserId(String userId) {
        if (!StringUtils.hasText(userId)) {
            throw new SearchValidationException("user id is required");
        }
        return userId.trim();
    }

    private static void validateLocation(Double latitude, Double longitude) {
        if (latitude == null && longitude == null) {
            return;
        }
        if (latitude == null || longitude == null) {
            throw new SearchValidationException("latitude and longitude must be given together");
        }
        if (latitude.isNaN() || latitude < -90D || latitude > 90D) {
            throw new SearchValidationException("latitude must be between -90 and 90");
        }
        if (longitude.isNaN() || longitude < -180D || longitude > 180D) {
            throw new SearchValidationException("longitude must be between -180 and 180");
        }
    }

    private static List<String> normalizeCategoryIds(List<String> categoryIds) {
        Set<String> distinct = new LinkedHashSet<>();
        if (categoryIds != null) {
            for (String categoryId : categoryIds) {
                if (StringUtils.hasText(categoryId)) {
                    distinct.add(categoryId.trim());
                }
            }
        }
        return new ArrayList<>(distinct);
    }

}
