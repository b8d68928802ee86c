package fun.fengwk.discovery.core.facade.search.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A physical location of a business.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BusinessLocation {

    private String id;

    private String address;

    private Double latitude;

    private Double longitude;

    private String city;

    private String state;

    private String country;

    public boolean hasCoordinates() {
        return latitude != null && longitude != null;
    }

}
