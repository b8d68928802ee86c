package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class ClearRecentSearchesResponse {

    private long clearedCount;

}
