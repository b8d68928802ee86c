package fun.fengwk.discovery.core.service.search.rank;

import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import fun.fengwk.discovery.core.facade.search.model.Pagination;
import fun.fengwk.discovery.core.facade.search.model.SortBy;
import lombok.Value;

import java.util.List;

/**
 * @author fengwk
 */
@Value
public class RankedPage {

    List<BusinessResult> items;

    Pagination pagination;

    /**
     * Sort key actually applied, after the distance fallback.
     */
    SortBy appliedSortBy;

}
