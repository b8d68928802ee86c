package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Filters echoed back with a search response, with defaults and sort fallback applied.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchFilters {

    @Builder.Default
    private List<String> categoryIds = new ArrayList<>();

    private Double rating;

    private int radiusMeters;

    private Double latitude;

    private Double longitude;

    private SortBy sortBy;

    private SortOrder sortOrder;

}
