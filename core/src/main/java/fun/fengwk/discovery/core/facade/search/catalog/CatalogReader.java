package fun.fengwk.discovery.core.facade.search.catalog;

import java.util.List;

/**
 * Read access to the business catalog.
 *
 * @author fengwk
 */
public interface CatalogReader {

    /**
     * Find active businesses matching the query.
     *
     * @throws fun.fengwk.discovery.core.exception.StorageUnavailableException if the store cannot be read
     */
    List<CatalogBusinessRecord> findBusinesses(CatalogQuery query);

}
