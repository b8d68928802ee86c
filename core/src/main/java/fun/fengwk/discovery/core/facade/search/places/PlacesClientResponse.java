package fun.fengwk.discovery.core.facade.search.places;

import lombok.Builder;
import lombok.Data;

/**
 * Raw response from the places provider.
 *
 * @author fengwk
 */
@Data
@Builder
public class PlacesClientResponse {

    private int statusCode;
    private String body;
    private Throwable error;

    public boolean hasError() {
        return error != null;
    }

}
