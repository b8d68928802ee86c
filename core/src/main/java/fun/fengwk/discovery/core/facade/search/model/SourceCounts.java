package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-source result counts of one search.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceCounts {

    private int local;

    private int external;

    /**
     * Number of external places collapsed into catalog records.
     */
    private int deduplicated;

}
