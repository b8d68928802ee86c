package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Pagination {

    private int page;

    private int limit;

    private long total;

    private int totalPages;

    public static Pagination of(int page, int limit, long total) {
        long pages = (total + limit - 1) / limit;
        return new Pagination(page, limit, total, (int) Math.max(1L, pages));
    }

}
