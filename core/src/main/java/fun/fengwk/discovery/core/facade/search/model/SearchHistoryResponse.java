package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * One page of a user's search history, newest first.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class SearchHistoryResponse {

    private List<SearchHistoryEntry> searches;

    private Pagination pagination;

}
