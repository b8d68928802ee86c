package fun.fengwk.discovery.core.service.search.impl;

import fun.fengwk.discovery.core.configuration.DiscoveryConfiguration;
import fun.fengwk.discovery.core.configuration.DiscoveryProperties;
import fun.fengwk.discovery.core.exception.CacheUnavailableException;
import fun.fengwk.discovery.core.exception.DiscoveryException;
import fun.fengwk.discovery.core.exception.StorageUnavailableException;
import fun.fengwk.discovery.core.facade.search.cache.SearchCache;
import fun.fengwk.discovery.core.facade.search.catalog.LocalCatalogSearch;
import fun.fengwk.discovery.core.facade.search.history.SearchHistoryRepository;
import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.ClearRecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.Pagination;
import fun.fengwk.discovery.core.facade.search.model.RecentSearchesResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchFilters;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryEntry;
import fun.fengwk.discovery.core.facade.search.model.SearchHistoryResponse;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.facade.search.model.SearchResponse;
import fun.fengwk.discovery.core.facade.search.model.SourceCounts;
import fun.fengwk.discovery.core.facade.search.places.ExternalPlacesClient;
import fun.fengwk.discovery.core.service.search.SearchOrchestrator;
import fun.fengwk.discovery.core.service.search.dedup.DeduplicationResult;
import fun.fengwk.discovery.core.service.search.dedup.Deduplicator;
import fun.fengwk.discovery.core.service.search.rank.RankedPage;
import fun.fengwk.discovery.core.service.search.rank.RankerPaginator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * @author fengwk
 */
@Slf4j
@Component
public class SearchOrchestratorImpl implements SearchOrchestrator {

    private final SearchQueryValidator validator;
    private final LocalCatalogSearch localCatalogSearch;
    private final ExternalPlacesClient externalPlacesClient;
    private final Deduplicator deduplicator;
    private final RankerPaginator rankerPaginator;
    private final SearchCache searchCache;
    private final SearchHistoryRepository searchHistoryRepository;
    private final DiscoveryProperties properties;
    private final Executor executor;
    private final Clock clock;

    public SearchOrchestratorImpl(SearchQueryValidator validator,
                                  LocalCatalogSearch localCatalogSearch,
                                  ExternalPlacesClient externalPlacesClient,
                                  Deduplicator deduplicator,
                                  RankerPaginator rankerPaginator,
                                  SearchCache searchCache,
                                  SearchHistoryRepository searchHistoryRepository,
                                  DiscoveryProperties properties,
                                  @Qualifier(DiscoveryConfiguration.DISCOVERY_EXECUTOR) Executor executor,
                                  Clock clock) {
        this.validator = validator;
        this.localCatalogSearch = localCatalogSearch;
        this.externalPlacesClient = externalPlacesClient;
        this.deduplicator = deduplicator;
        this.rankerPaginator = rankerPaginator;
        this.searchCache = searchCache;
        this.searchHistoryRepository = searchHistoryRepository;
        this.properties = properties;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public SearchResponse search(String userId, SearchQuery rawQuery) {
        SearchQuery query = validator.validate(rawQuery);

        SearchResponse cached = lookupCachedResult(query);
        if (cached != null) {
            log.debug("search result cache hit, query={}", query.getQuery());
            recordHistoryAsync(userId, query.getQuery());
            return cached;
        }

        CompletableFuture<List<BusinessResult>> externalFuture = submitExternal(query);
        CompletableFuture<List<BusinessResult>> localFuture = submitLocal(query);
        List<BusinessResult> externalResults = awaitExternal(externalFuture, query);
        List<BusinessResult> localResults = awaitLocal(localFuture);

        DeduplicationResult deduplicated = deduplicator.deduplicate(localResults, externalResults);
        RankedPage page = rankerPaginator.rank(deduplicated.getResults(), query.getSortBy(), query.getSortOrder(),
            query.hasLocation(), query.getPage(), query.getLimit());

        SearchResponse response = SearchResponse.builder()
            .businesses(page.getItems())
            .pagination(page.getPagination())
            .sources(SourceCounts.builder()
                .local(deduplicated.getLocalCount())
                .external(deduplicated.getExternalCount())
                .deduplicated(deduplicated.getDeduplicatedCount())
                .build())
            .query(query.getQuery())
            .filters(SearchFilters.builder()
                .categoryIds(new ArrayList<>(query.getCategoryIds()))
                .rating(query.getRating())
                .radiusMeters(query.getRadiusMeters())
                .latitude(query.getLatitude())
                .longitude(query.getLongitude())
                .sortBy(page.getAppliedSortBy())
                .sortOrder(query.getSortOrder())
                .build())
            .build();
        log.info("business search done, query={}, local={}, external={}, deduplicated={}, total={}",
            query.getQuery(), deduplicated.getLocalCount(), deduplicated.getExternalCount(),
            deduplicated.getDeduplicatedCount(), page.getPagination().getTotal());

        recordHistoryAsync(userId, query.getQuery());
        cacheResultAsync(query, response);
        return response;
    }

    @Override
    public RecentSearchesResponse recentSearches(String userId) {
        List<String> searches = searchCache.getRecentSearches(validator.validateUserId(userId));
        return new RecentSearchesResponse(searches, searches.size());
    }

    @Override
    public ClearRecentSearchesResponse clearRecentSearches(String userId) {
        long cleared = searchCache.clearRecentSearches(validator.validateUserId(userId));
        log.info("recent searches cleared, userId={}, count={}", userId, cleared);
        return new ClearRecentSearchesResponse(cleared);
    }

    @Override
    public SearchHistoryResponse searchHistory(String userId, Integer page, Integer limit) {
        String validUserId = validator.validateUserId(userId);
        int validPage = page == null ? SearchQuery.DEFAULT_PAGE : page;
        int validLimit = limit == null ? SearchQuery.DEFAULT_LIMIT : limit;
        validator.validatePaging(validPage, validLimit);

        long total = searchHistoryRepository.countByUserId(validUserId);
        long offset = (long) (validPage - 1) * validLimit;
        List<SearchHistoryEntry> entries = offset >= total
            ? new ArrayList<>()
            : searchHistoryRepository.findByUserId(validUserId, offset, validLimit);
        return new SearchHistoryResponse(entries, Pagination.of(validPage, validLimit, total));
    }

    private SearchResponse lookupCachedResult(SearchQuery query) {
        try {
            return searchCache.getCachedResult(query);
        } catch (CacheUnavailableException ex) {
            log.warn("search result cache read failed, query={}, error={}", query.getQuery(), ex.getMessage());
            return null;
        }
    }

    private CompletableFuture<List<BusinessResult>> submitExternal(SearchQuery query) {
        try {
            return CompletableFuture.supplyAsync(() -> externalPlacesClient.search(query), executor);
        } catch (RejectedExecutionException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }

    private CompletableFuture<List<BusinessResult>> submitLocal(SearchQuery query) {
        try {
            return CompletableFuture.supplyAsync(() -> localCatalogSearch.search(query), executor);
        } catch (RejectedExecutionException ex) {
            log.warn("discovery executor saturated, searching catalog on caller thread");
            try {
                return CompletableFuture.completedFuture(localCatalogSearch.search(query));
            } catch (RuntimeException searchEx) {
                return CompletableFuture.failedFuture(searchEx);
            }
        }
    }

    /**
     * External failures of any kind degrade to an empty set.
     */
    private List<BusinessResult> awaitExternal(CompletableFuture<List<BusinessResult>> future, SearchQuery query) {
        try {
            return future.get(properties.getExternalTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            log.warn("external places search timed out, query={}, timeoutMs={}", query.getQuery(), properties.getExternalTimeoutMs());
            return List.of();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("interrupted while waiting for external places, query={}", query.getQuery());
            return List.of();
        } catch (ExecutionException ex) {
            log.warn("external places search degraded, query={}, error={}", query.getQuery(), ex.getCause().getMessage());
            return List.of();
        }
    }

    private List<BusinessResult> awaitLocal(CompletableFuture<List<BusinessResult>> future) {
        try {
            return future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new StorageUnavailableException("interrupted while searching catalog", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof DiscoveryException discoveryException) {
                throw discoveryException;
            }
            throw new StorageUnavailableException("catalog search failed: " + cause.getMessage(), cause);
        }
    }

    private void recordHistoryAsync(String userId, String queryText) {
        if (!StringUtils.hasText(userId)) {
            return;
        }
        // same key the read paths use
        String historyUserId = validator.validateUserId(userId);
        SearchHistoryEntry entry = SearchHistoryEntry.builder()
            .userId(historyUserId)
            .searchText(queryText)
            .status(SearchHistoryEntry.STATUS_ACTIVE)
            .createdAt(clock.instant())
            .build();
        runAsync("record search history", () -> {
            try {
                searchHistoryRepository.save(entry);
            } catch (RuntimeException ex) {
                log.warn("save search history failed, userId={}, error={}", historyUserId, ex.getMessage());
            }
            try {
                searchCache.addRecentSearch(historyUserId, queryText);
            } catch (RuntimeException ex) {
                log.warn("add recent search failed, userId={}, error={}", historyUserId, ex.getMessage());
            }
        });
    }

    private void cacheResultAsync(SearchQuery query, SearchResponse response) {
        runAsync("cache search result", () -> {
            try {
                searchCache.putCachedResult(query, response);
            } catch (RuntimeException ex) {
                log.warn("search result cache write failed, query={}, error={}", query.getQuery(), ex.getMessage());
            }
        });
    }

    private void runAsync(String taskName, Runnable task) {
        try {
            executor.execute(task);
        } catch (RejectedExecutionException ex) {
            log.warn("discovery executor saturated, skipped {}", taskName);
        }
    }

}
