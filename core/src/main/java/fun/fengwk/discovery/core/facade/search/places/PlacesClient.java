package fun.fengwk.discovery.core.facade.search.places;

/**
 * Network access to an external maps/places provider.
 *
 * @author fengwk
 */
public interface PlacesClient {

    /**
     * Whether the provider has credentials. An unconfigured provider is skipped.
     */
    boolean isConfigured();

    /**
     * Issue a single search request. Transport failures are reported in the response, not thrown.
     */
    PlacesClientResponse search(PlacesRequest request);

    /**
     * Public URL of a provider photo reference.
     */
    String photoUrl(String photoReference);

}
