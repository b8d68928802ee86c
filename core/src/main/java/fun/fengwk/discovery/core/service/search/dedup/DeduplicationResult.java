package fun.fengwk.discovery.core.service.search.dedup;

import fun.fengwk.discovery.core.facade.search.model.BusinessResult;
import lombok.Value;

import java.util.List;

/**
 * @author fengwk
 */
@Value
public class DeduplicationResult {

    /**
     * Catalog records in input order, then the external places nobody absorbed.
     */
    List<BusinessResult> results;

    int localCount;

    int externalCount;

    /**
     * Number of merges performed.
     */
    int deduplicatedCount;

}
