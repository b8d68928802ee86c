package fun.fengwk.discovery.core.facade.search.catalog;

import fun.fengwk.discovery.core.facade.search.model.BusinessLocation;
import fun.fengwk.discovery.core.facade.search.model.CategorySummary;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Raw business row with its nested categories and locations.
 *
 * @author fengwk
 */
@Value
@Builder
public class CatalogBusinessRecord {

    String id;

    String name;

    String username;

    String logoUrl;

    String about;

    double ratingSum;

    int ratingCount;

    @Builder.Default
    List<CategorySummary> categories = List.of();

    @Builder.Default
    List<BusinessLocation> locations = List.of();

}
