package fun.fengwk.discovery.core.facade.search.places;

import lombok.Builder;
import lombok.Value;

/**
 * One outbound places search.
 *
 * @author fengwk
 */
@Value
@Builder
public class PlacesRequest {

    String query;

    Double latitude;

    Double longitude;

    int radiusMeters;

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

}
