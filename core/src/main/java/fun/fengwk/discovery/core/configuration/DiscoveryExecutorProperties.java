package fun.fengwk.discovery.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Thread pool used for source fan-out and background writes.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "discovery.executor")
public class DiscoveryExecutorProperties {

    private int corePoolSize = 8;

    private int maxPoolSize = 32;

    /**
     * Pending task capacity, submissions beyond it are rejected.
     */
    private int queueCapacity = 200;

    private long keepAliveSeconds = 60;

}
