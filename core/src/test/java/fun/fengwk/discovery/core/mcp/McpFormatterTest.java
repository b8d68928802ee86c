package fun.fengwk.discovery.core.mcp;

import fun.fengwk.discovery.core.configuration.FreeMarkerConfiguration;
import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.BusinessSource;
import fun.fengwk.discovery.core.facade.search.model.CategorySummary;
import fun.fengwk.discovery.core.facade.search.model.ClearRecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.Pagination;
import fun.fengwk.discovery.core.facade.search.model.RecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchResponse;
import fun.fengwk.discovery.core.facade.search.model.SourceCounts;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Renders the real tool templates.
 *
 * @author fengwk
 */
@Slf4j
class McpFormatterTest {

    private McpFormatter mcpFormatter;

    @BeforeEach
    void setUp() {
        mcpFormatter = new McpFormatter(new FreeMarkerConfiguration().mcpTemplateConfiguration());
    }

    @Test
    void shouldRenderSearchResult() {
        List<CategorySummary> categories = new ArrayList<>(List.of(new CategorySummary("pizza", "Pizza")));
        List<BusinessLocation> locations = new ArrayList<>(List.of(
            BusinessLocation.builder().id("loc-1").address("1 Main St").latitude(40.7128).longitude(-74.006).build()));
        SearchResponse response = SearchResponse.builder()
            .businesses(List.of(
                BusinessResult.builder()
                    .id("biz-1")
                    .name("Tony's Pizza")
                    .username("tonys")
                    .rating(4.5)
                    .ratingCount(10)
                    .distanceMeters(28.4)
                    .source(BusinessSource.MERGED)
                    .categories(categories)
                    .locations(locations)
                    .externalPlaceId("abc")
                    .externalRating(4.2)
                    .externalRatingCount(120)
                    .build(),
                BusinessResult.builder()
                    .id("google_xyz")
                    .name("Joe's Burgers")
                    .source(BusinessSource.EXTERNAL)
                    .build()))
            .pagination(Pagination.of(1, 20, 2))
            .sources(new SourceCounts(1, 2, 1))
            .query("pizza")
            .build();

        String result = mcpFormatter.format("discovery_search_result.ftl", response);
        log.info("search result:\n{}", result);

        assertThat(result).contains("1. Tony's Pizza [merged] id=biz-1");
        assertThat(result).contains("rating: 4.5 (10 reviews), distance: 28 m");
        assertThat(result).contains("categories: Pizza");
        assertThat(result).contains("address: 1 Main St");
        assertThat(result).contains("external: place_id=abc, rating 4.2 (120 reviews)");
        assertThat(result).contains("2. Joe's Burgers [external] id=google_xyz");
        assertThat(result).contains("rating: n/a (0 reviews)");
        assertThat(result).contains("page 1/1, total 2, limit 20");
        assertThat(result).contains("sources: local=1, external=2, deduplicated=1");
        assertThat(result).doesNotContain("format error");
    }

    @Test
    void shouldRenderEmptySearchResult() {
        SearchResponse response = SearchResponse.builder()
            .pagination(Pagination.of(1, 20, 0))
            .sources(new SourceCounts(0, 0, 0))
            .query("sushi")
            .build();

        String result = mcpFormatter.format("discovery_search_result.ftl", response);

        assertThat(result).contains("No businesses found for \"sushi\".");
        assertThat(result).contains("page 1/1, total 0, limit 20");
    }

    @Test
    void shouldRenderRecentSearches() {
        assertThat(mcpFormatter.format("discovery_recent_searches.ftl", new RecentSearchesResponse(List.of("tacos", "pizza"), 2)))
            .contains("Recent searches (2):")
            .contains("1. tacos")
            .contains("2. pizza");
        assertThat(mcpFormatter.format("discovery_recent_searches.ftl", new RecentSearchesResponse(List.of(), 0)))
            .contains("No recent searches.");
    }

    @Test
    void shouldRenderClearResult() {
        assertThat(mcpFormatter.format("discovery_clear_result.ftl", new ClearRecentSearchesResponse(3L)))
            .contains("Cleared 3 recent searches.");
    }

    @Test
    void shouldRenderSearchHistory() {
        String result = mcpFormatter.format("discovery_search_history.ftl", Map.of(
            "entries", List.of(Map.of("time", "2024-05-01T10:00:00Z", "text", "pizza")),
            "pagination", Pagination.of(1, 20, 1)));

        assertThat(result).contains("1. 2024-05-01T10:00:00Z pizza");
        assertThat(result).contains("page 1/1, total 1, limit 20");
    }

    @Test
    void shouldRenderError() {
        String result = mcpFormatter.format("discovery_error.ftl", Map.of(
            "statusCode", 503,
            "error", "catalog store unavailable",
            "retryable", true));

        assertThat(result).contains("Error 503: catalog store unavailable");
        assertThat(result).contains("retryable: true");
    }

    @Test
    void shouldReportMissingTemplate() {
        assertThat(mcpFormatter.format("missing.ftl", Map.of())).startsWith("format error:");
        assertThat(mcpFormatter.format("discovery_error.ftl", null)).isEqualTo("empty response");
    }

}
