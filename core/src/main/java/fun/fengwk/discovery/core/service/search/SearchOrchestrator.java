package fun.fengwk.discovery.core.service.search;

import fun.fengwk.discovery.core.facade.search.model.ClearRecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.RecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.facade.search.model.SearchResponse;

/**
 * Entry point of business discovery.
 *
 * @author fengwk
 */
public interface SearchOrchestrator {

    /**
     * Search the catalog and the external provider, merge, rank and return one page.
     *
     * @param userId caller, history is recorded only when present
     * @throws fun.fengwk.discovery.core.exception.SearchValidationException if the query is out of range
     * @throws fun.fengwk.discovery.core.exception.StorageUnavailableException if the catalog cannot be read
     */
    SearchResponse search(String userId, SearchQuery query);

    RecentSearchesResponse recentSearches(String userId);

    ClearRecentSearchesResponse clearRecentSearches(String userId);

    /**
     * @param page  1-based, null for the first page
     * @param limit 1 to 100, null for the default
     */
    SearchHistoryResponse searchHistory(String userId, Integer page, Integer limit);

}
