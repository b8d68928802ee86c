package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One page of merged business search results.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {

    @Builder.Default
    private List<BusinessResult> businesses = new ArrayList<>();

    private Pagination pagination;

    private SourceCounts sources;

    /**
     * Query text after trimming.
     */
    private String query;

    private SearchFilters filters;

}
