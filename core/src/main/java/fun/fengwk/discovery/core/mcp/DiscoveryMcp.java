package fun.fengwk.discovery.core.mcp;

import fun.fengwk.discovery.core.exception.DiscoveryException;
import fun.fengwk.discovery.core.exception.SearchValidationException;
import fun.fengwk.discovery.core.facade.search.model.ClearRecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.RecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryEntry;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.facade.search.model.SearchResponse;
import fun.fengwk.discovery.core.facade.search.model.SortBy;
import fun.fengwk.discovery.core.facade.search.model.SortOrder;
import fun.fengwk.discovery.core.service.search.SearchOrchestrator;
import fun.fengwk.discovery.core.utils.TextToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DiscoveryMcp {

    static final String ERROR_TEMPLATE = "discovery_error.ftl";

    private final SearchOrchestrator searchOrchestrator;
    private final McpFormatter mcpFormatter;

    @Tool(name = "search_businesses",
        description = """
            Find businesses matching a text query, optionally near a location.
            Merges the platform catalog with an external places provider and collapses duplicates.
            Return format: page of businesses with source (local/external/merged), rating, reviews, distance, \
            categories and address, followed by pagination and source counts; or an error with status code.""",
        resultConverter = TextToolCallResultConverter.class)
    public String searchBusinesses(
        @ToolParam(description = "free text matched against business name, handle and description, 1-255 chars") String query,
        @ToolParam(description = "caller user id, the search is added to their history when present", required = false) String userId,
        @ToolParam(description = "category ids, a business matches when it has any of them, at most 10", required = false) List<String> categoryIds,
        @ToolParam(description = "minimum average rating, 1.0-5.0", required = false) Double rating,
        @ToolParam(description = "search radius in meters, 100-50000, default 5000", required = false) Integer radius,
        @ToolParam(description = "latitude of the search center, requires longitude", required = false) Double latitude,
        @ToolParam(description = "longitude of the search center, requires latitude", required = false) Double longitude,
        @ToolParam(description = "page number, default 1", required = false) Integer page,
        @ToolParam(description = "page size, 1-100, default 20", required = false) Integer limit,
        @ToolParam(description = "sort key: rating/reviews/name/distance, default rating", required = false) String sortBy,
        @ToolParam(description = "sort order: asc/desc, default desc", required = false) String sortOrder
    ) {
        return execute(() -> {
            SearchQuery.SearchQueryBuilder builder = SearchQuery.builder()
                .query(query)
                .latitude(latitude)
                .longitude(longitude)
                .rating(rating)
                .sortBy(SortBy.fromValue(sortBy))
                .sortOrder(SortOrder.fromValue(sortOrder));
            if (categoryIds != null) {
                builder.categoryIds(categoryIds);
            }
            if (radius != null) {
                builder.radiusMeters(radius);
            }
            if (page != null) {
                builder.page(page);
            }
            if (limit != null) {
                builder.limit(limit);
            }
            SearchResponse response = searchOrchestrator.search(userId, builder.build());
            return mcpFormatter.format("discovery_search_result.ftl", response);
        });
    }

    @Tool(name = "recent_searches",
        description = """
            List the distinct queries a user searched most recently, newest first.
            Return format: numbered query list; or 'No recent searches.'; or an error with status code.""",
        resultConverter = TextToolCallResultConverter.class)
    public String recentSearches(@ToolParam(description = "user id") String userId) {
        return execute(() -> {
            RecentSearchesResponse response = searchOrchestrator.recentSearches(userId);
            return mcpFormatter.format("discovery_recent_searches.ftl", response);
        });
    }

    @Tool(name = "clear_recent_searches",
        description = """
            Remove every entry from a user's recent searches. The durable search history is kept.
            Return format: number of removed entries; or an error with status code.""",
        resultConverter = TextToolCallResultConverter.class)
    public String clearRecentSearches(@ToolParam(description = "user id") String userId) {
        return execute(() -> {
            ClearRecentSearchesResponse response = searchOrchestrator.clearRecentSearches(userId);
            return mcpFormatter.format("discovery_clear_result.ftl", response);
        });
    }

    @Tool(name = "search_history",
        description = """
            Page through a user's durable search history, newest first.
            Return format: entries with time and query text, followed by pagination; or an error with status code.""",
        resultConverter = TextToolCallResultConverter.class)
    public String searchHistory(
        @ToolParam(description = "user id") String userId,
        @ToolParam(description = "page number, default 1", required = false) Integer page,
        @ToolParam(description = "page size, 1-100, default 20", required = false) Integer limit
    ) {
        return execute(() -> {
            SearchHistoryResponse response = searchOrchestrator.searchHistory(userId, page, limit);
            List<Map<String, String>> entries = new ArrayList<>();
            for (SearchHistoryEntry entry : response.getSearches()) {
                entries.add(Map.of(
                    "time", entry.getCreatedAt() == null ? "-" : entry.getCreatedAt().toString(),
                    "text", entry.getSearchText() == null ? "" : entry.getSearchText()
                ));
            }
            return mcpFormatter.format("discovery_search_history.ftl", Map.of(
                "entries", entries,
                "pagination", response.getPagination()
            ));
        });
    }

    private String execute(Supplier<String> action) {
        try {
            return action.get();
        } catch (DiscoveryException ex) {
            int statusCode = ex instanceof SearchValidationException ? 400 : 503;
            if (statusCode != 400) {
                log.warn("discovery tool failed, statusCode={}, error={}", statusCode, ex.getMessage());
            }
            return mcpFormatter.format(ERROR_TEMPLATE, Map.of(
                "statusCode", statusCode,
                "error", String.valueOf(ex.getMessage()),
                "retryable", ex.isRetryable()
            ));
        }
    }

}
