package fun.fengwk.discovery.core.facade.search.history;

import fun.fengwk.discovery.core.facade.search.model.SearchHistoryEntry;

import java.util.List;

/**
 * Durable search history. Failures surface as
 * {@link fun.fengwk.discovery.core.exception.StorageUnavailableException}.
 *
 * @author fengwk
 */
public interface SearchHistoryRepository {

    /**
     * Persist the entry, assigning an id when it has none.
     *
     * @return the stored entry
     */
    SearchHistoryEntry save(SearchHistoryEntry entry);

    /**
     * Active entries of the user, newest first.
     */
    List<SearchHistoryEntry> findByUserId(String userId, long offset, int limit);

    long countByUserId(String userId);

}
