package fun.fengwk.discovery.core.facade.search.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.discovery.core.configuration.DiscoveryProperties;
import fun.fengwk.discovery.core.exception.CacheUnavailableException;
import fun.fengwk.discovery.core.facade.search.model.SearchQuery;
import fun.fengwk.discovery.core.facade.search.model.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-user recent searches and short-lived result pages.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearchCache {

    static final String RECENT_SEARCHES_KEY_PREFIX = "discovery:recent_searches:";
    static final String SEARCH_RESULT_KEY_PREFIX = "discovery:search_result:";

    private final CacheStore cacheStore;
    private final DiscoveryProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Put the query on top of the user's recent list, evicting the oldest beyond capacity.
     */
    public void addRecentSearch(String userId, String query) {
        if (!StringUtils.hasText(userId) || !StringUtils.hasText(query)) {
            return;
        }
        String key = recentSearchesKey(userId);
        int capacity = Math.max(1, properties.getRecentSearchCapacity());
        cacheStore.sortedSetAdd(key, query.trim(), clock.millis());
        cacheStore.sortedSetRemoveRangeByRank(key, 0, -(capacity + 1L));
        cacheStore.expire(key, properties.getRecentSearchTtl());
    }

    /**
     * Most recent first.
     */
    public List<String> getRecentSearches(String userId) {
        if (!StringUtils.hasText(userId)) {
            return new ArrayList<>();
        }
        int capacity = Math.max(1, properties.getRecentSearchCapacity());
        return cacheStore.sortedSetReverseRange(recentSearchesKey(userId), 0, capacity - 1L);
    }

    /**
     * @return number of searches removed
     */
    public long clearRecentSearches(String userId) {
        if (!StringUtils.hasText(userId)) {
            return 0L;
        }
        return cacheStore.sortedSetRemoveRangeByRank(recentSearchesKey(userId), 0, -1);
    }

    /**
     * Cached page for the query, null on miss. An unreadable entry counts as a miss.
     */
    public SearchResponse getCachedResult(SearchQuery query) {
        if (!properties.isResultCacheEnabled()) {
            return null;
        }
        String key = resultCacheKey(query);
        String value = cacheStore.get(key);
        if (!StringUtils.hasText(value)) {
            return null;
        }
        try {
            return objectMapper.readValue(value, SearchResponse.class);
        } catch (JsonProcessingException ex) {
            log.warn("unreadable cached search result, key={}, error={}", key, ex.getOriginalMessage());
            return null;
        }
    }

    public void putCachedResult(SearchQuery query, SearchResponse response) {
        if (!properties.isResultCacheEnabled()) {
            return;
        }
        String key = resultCacheKey(query);
        String value;
        try {
            value = objectMapper.writeValueAsString(response);
        } catch (JsonProcessingException ex) {
            throw new CacheUnavailableException("serialize search result failed, key=" + key, ex);
        }
        cacheStore.setWithTtl(key, value, properties.getResultCacheTtl());
    }

    static String recentSearchesKey(String userId) {
        return RECENT_SEARCHES_KEY_PREFIX + userId;
    }

    /**
     * Key over the normalized query tuple. Coordinates are bucketed so nearby callers share entries.
     */
    String resultCacheKey(SearchQuery query) {
        List<String> categoryIds = new ArrayList<>(query.getCategoryIds());
        categoryIds.sort(null);
        String tuple = String.join("|",
            query.getQuery().trim().toLowerCase(Locale.ROOT),
            String.join(",", categoryIds),
            String.valueOf(query.getRating()),
            String.valueOf(query.getRadiusMeters()),
            bucket(query.getLatitude()),
            bucket(query.getLongitude()),
            query.getSortBy().getValue(),
            query.getSortOrder().getValue(),
            String.valueOf(query.getPage()),
            String.valueOf(query.getLimit()));
        return SEARCH_RESULT_KEY_PREFIX + DigestUtils.md5DigestAsHex(tuple.getBytes(StandardCharsets.UTF_8));
    }

    private String bucket(Double coordinate) {
        if (coordinate == null) {
            return "-";
        }
        return BigDecimal.valueOf(coordinate)
            .setScale(properties.getLocationBucketScale(), RoundingMode.HALF_UP)
            .toPlainString();
    }

}
