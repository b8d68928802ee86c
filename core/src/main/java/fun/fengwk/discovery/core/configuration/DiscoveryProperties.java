package fun.fengwk.discovery.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Business search configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "discovery.search")
public class DiscoveryProperties {

    /**
     * Upper bound on the external provider call, after which it counts as degraded.
     */
    private long externalTimeoutMs = 4000;

    /**
     * Max external places kept from one provider response, bounds the pairwise matching.
     */
    private int maxExternalResults = 10;

    /**
     * Max distinct queries kept in a user's recent-search list.
     */
    private int recentSearchCapacity = 10;

    /**
     * Idle lifetime of a recent-search list, refreshed on every add.
     */
    private Duration recentSearchTtl = Duration.ofDays(30);

    /**
     * Whether computed pages are cached.
     */
    private boolean resultCacheEnabled = true;

    /**
     * Lifetime of a cached page. Keep it short, ratings change.
     */
    private Duration resultCacheTtl = Duration.ofSeconds(120);

    /**
     * Decimal places kept from coordinates when bucketing cache keys (3 is about 110 m).
     */
    private int locationBucketScale = 3;

    /**
     * Minimum normalized-name similarity for a cross-source match.
     */
    private double nameSimilarityThreshold = 0.8;

    /**
     * Max distance between the closest locations of a cross-source match.
     */
    private double matchDistanceMeters = 150;

}
