package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Recent searches of a user, most recent first.
 *
 * @author fengwk
 */
@Data
@AllArgsConstructor
public class RecentSearchesResponse {

    private List<String> searches;

    private int count;

}
