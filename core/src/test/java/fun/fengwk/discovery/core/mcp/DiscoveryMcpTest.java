package fun.fengwk.discovery.core.mcp;

import fun.fengwk.discovery.core.exception.SearchValidationException;
import fun.fengwk.discovery.core.exception.StorageUnavailableException;
import fun.fengwk.discovery.core.facade.search.model.ClearRecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.Pagination;
import fun.fengwk.discovery.core.facade.search.model.RecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryEntry;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.facade.search.model.SearchResponse;
import fun.fengwk.discovery.core.facade.search.model.SortBy;
import fun.fengwk.discovery.core.facade.search.model.SortOrder;
import fun.fengwk.discovery.core.service.search.SearchOrchestrator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
class DiscoveryMcpTest {

    @Mock
    private SearchOrchestrator searchOrchestrator;

    @Mock
    private McpFormatter mcpFormatter;

    private DiscoveryMcp discoveryMcp;

    @BeforeEach
    void setUp() {
        discoveryMcp = new DiscoveryMcp(searchOrchestrator, mcpFormatter);
    }

    @Test
    void shouldBuildQueryFromToolParams() {
        SearchResponse response = new SearchResponse();
        when(searchOrchestrator.search(eq("user-1"), any())).thenReturn(response);
        when(mcpFormatter.format("discovery_search_result.ftl", response)).thenReturn("ok");

        String result = discoveryMcp.searchBusinesses("pizza", "user-1", List.of("italian"), 4.0, 1500,
            40.7128, -74.006, 2, 10, "Distance", "ASC");

        assertThat(result).isEqualTo("ok");
        ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
        verify(searchOrchestrator).search(eq("user-1"), captor.capture());
        SearchQuery query = captor.getValue();
        assertThat(query.getQuery()).isEqualTo("pizza");
        assertThat(query.getCategoryIds()).containsExactly("italian");
        assertThat(query.getRating()).isEqualTo(4.0);
        assertThat(query.getRadiusMeters()).isEqualTo(1500);
        assertThat(query.getLatitude()).isEqualTo(40.7128);
        assertThat(query.getPage()).isEqualTo(2);
        assertThat(query.getLimit()).isEqualTo(10);
        assertThat(query.getSortBy()).isEqualTo(SortBy.DISTANCE);
        assertThat(query.getSortOrder()).isEqualTo(SortOrder.ASC);
    }

    @Test
    void shouldApplyDefaultsForMissingParams() {
        SearchResponse response = new SearchResponse();
        when(searchOrchestrator.search(isNull(), any())).thenReturn(response);
        when(mcpFormatter.format("discovery_search_result.ftl", response)).thenReturn("ok");

        discoveryMcp.searchBusinesses("pizza", null, null, null, null, null, null, null, null, null, null);

        ArgumentCaptor<SearchQuery> captor = ArgumentCaptor.forClass(SearchQuery.class);
        verify(searchOrchestrator).search(isNull(), captor.capture());
        SearchQuery query = captor.getValue();
        assertThat(query.getCategoryIds()).isEmpty();
        assertThat(query.getRadiusMeters()).isEqualTo(SearchQuery.DEFAULT_RADIUS_METERS);
        assertThat(query.getPage()).isEqualTo(1);
        assertThat(query.getLimit()).isEqualTo(20);
        assertThat(query.getSortBy()).isEqualTo(SortBy.RATING);
        assertThat(query.getSortOrder()).isEqualTo(SortOrder.DESC);
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldRenderValidationErrorAsBadRequest() {
        when(searchOrchestrator.search(any(), any())).thenThrow(new SearchValidationException("query is blank"));
        when(mcpFormatter.format(eq(DiscoveryMcp.ERROR_TEMPLATE), any())).thenReturn("Error 400: query is blank");

        String result = discoveryMcp.searchBusinesses(" ", "user-1", null, null, null, null, null, null, null, null, null);

        assertThat(result).isEqualTo("Error 400: query is blank");
        ArgumentCaptor<Object> modelCaptor = ArgumentCaptor.forClass(Object.class);
        verify(mcpFormatter).format(eq(DiscoveryMcp.ERROR_TEMPLATE), modelCaptor.capture());
        Map<String, Object> model = (Map<String, Object>) modelCaptor.getValue();
        assertThat(model).containsEntry("statusCode", 400);
        assertThat(model).containsEntry("error", "query is blank");
        assertThat(model).containsEntry("retryable", false);
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldRenderUnknownSortAsBadRequestWithoutSearching() {
        when(mcpFormatter.format(eq(DiscoveryMcp.ERROR_TEMPLATE), any())).thenReturn("error");

        discoveryMcp.searchBusinesses("pizza", "user-1", null, null, null, null, null, null, null, "popularity", null);

        verifyNoInteractions(searchOrchestrator);
        ArgumentCaptor<Object> modelCaptor = ArgumentCaptor.forClass(Object.class);
        verify(mcpFormatter).format(eq(DiscoveryMcp.ERROR_TEMPLATE), modelCaptor.capture());
        assertThat((Map<String, Object>) modelCaptor.getValue()).containsEntry("statusCode", 400);
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldRenderRetryableFailureAsUnavailable() {
        when(searchOrchestrator.searchHistory("user-1", null, null))
            .thenThrow(new StorageUnavailableException("history store unavailable", new RuntimeException()));
        when(mcpFormatter.format(eq(DiscoveryMcp.ERROR_TEMPLATE), any())).thenReturn("error");

        discoveryMcp.searchHistory("user-1", null, null);

        ArgumentCaptor<Object> modelCaptor = ArgumentCaptor.forClass(Object.class);
        verify(mcpFormatter).format(eq(DiscoveryMcp.ERROR_TEMPLATE), modelCaptor.capture());
        Map<String, Object> model = (Map<String, Object>) modelCaptor.getValue();
        assertThat(model).containsEntry("statusCode", 503);
        assertThat(model).containsEntry("retryable", true);
    }

    @Test
    void shouldRenderRecentSearchesAndClear() {
        RecentSearchesResponse recent = new RecentSearchesResponse(List.of("pizza"), 1);
        ClearRecentSearchesResponse cleared = new ClearRecentSearchesResponse(1L);
        when(searchOrchestrator.recentSearches("user-1")).thenReturn(recent);
        when(searchOrchestrator.clearRecentSearches("user-1")).thenReturn(cleared);
        when(mcpFormatter.format("discovery_recent_searches.ftl", recent)).thenReturn("recent");
        when(mcpFormatter.format("discovery_clear_result.ftl", cleared)).thenReturn("cleared");

        assertThat(discoveryMcp.recentSearches("user-1")).isEqualTo("recent");
        assertThat(discoveryMcp.clearRecentSearches("user-1")).isEqualTo("cleared");
    }

    @SuppressWarnings("unchecked")
    @Test
    void shouldFlattenHistoryEntriesForRendering() {
        SearchHistoryResponse response = new SearchHistoryResponse(List.of(
            SearchHistoryEntry.builder()
                .id("h-1")
                .searchText("pizza")
                .createdAt(Instant.parse("2024-05-01T10:00:00Z"))
                .build()),
            Pagination.of(1, 20, 1));
        when(searchOrchestrator.searchHistory("user-1", 1, 20)).thenReturn(response);
        when(mcpFormatter.format(eq("discovery_search_history.ftl"), any())).thenReturn("history");

        assertThat(discoveryMcp.searchHistory("user-1", 1, 20)).isEqualTo("history");

        ArgumentCaptor<Object> modelCaptor = ArgumentCaptor.forClass(Object.class);
        verify(mcpFormatter).format(eq("discovery_search_history.ftl"), modelCaptor.capture());
        Map<String, Object> model = (Map<String, Object>) modelCaptor.getValue();
        assertThat((List<Map<String, String>>) model.get("entries"))
            .containsExactly(Map.of("time", "2024-05-01T10:00:00Z", "text", "pizza"));
        assertThat(model.get("pagination")).isEqualTo(response.getPagination());
    }

}
