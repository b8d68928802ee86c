package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Durable record of a search performed by a user. Written once, never updated.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchHistoryEntry {

    public static final String STATUS_ACTIVE = "ACTIVE";

    private String id;

    private String userId;

    private String searchText;

    private String status;

    private Instant createdAt;

}
