package fun.fengwk.discovery.core.facade.search.places.google;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Google Places configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "discovery.places.google")
public class GooglePlacesProperties {

    /**
     * Places API base url.
     */
    private String baseUrl = "https://maps.googleapis.com/maps/api/place";

    /**
     * API key, blank disables the provider.
     */
    private String apiKey = "";

    /**
     * Request timeout in milliseconds.
     */
    private int timeoutMs = 4000;

    /**
     * Width requested for photo urls.
     */
    private int photoMaxWidth = 400;

}
