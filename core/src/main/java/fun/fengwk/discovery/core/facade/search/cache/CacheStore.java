package fun.fengwk.discovery.core.facade.search.cache;

import java.time.Duration;
import java.util.List;

/**
 * Key-value and sorted-set store shared by all search requests.
 * Every operation may throw {@link fun.fengwk.discovery.core.exception.CacheUnavailableException}.
 *
 * @author fengwk
 */
public interface CacheStore {

    /**
     * Add the member or re-score it when already present.
     */
    void sortedSetAdd(String key, String member, double score);

    /**
     * Remove members by ascending rank, negative ranks count from the highest score.
     *
     * @return number of members removed
     */
    long sortedSetRemoveRangeByRank(String key, long start, long end);

    /**
     * Members by descending score, ranks inclusive.
     */
    List<String> sortedSetReverseRange(String key, long start, long end);

    void expire(String key, Duration ttl);

    /**
     * @return the value, or null when absent or expired
     */
    String get(String key);

    void setWithTtl(String key, String value, Duration ttl);

}
