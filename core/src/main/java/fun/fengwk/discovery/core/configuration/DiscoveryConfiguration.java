package fun.fengwk.discovery.core.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * @author fengwk
 */
@Slf4j
@Configuration
public class DiscoveryConfiguration {

    public static final String DISCOVERY_EXECUTOR = "discoveryExecutor";

    @Bean(name = DISCOVERY_EXECUTOR, destroyMethod = "shutdown")
    public ExecutorService discoveryExecutor(DiscoveryExecutorProperties properties) {
        int coreSize = Math.max(1, properties.getCorePoolSize());
        int maxSize = Math.max(coreSize, properties.getMaxPoolSize());
        int capacity = Math.max(1, properties.getQueueCapacity());
        log.info("discovery executor configured, coreSize={}, maxSize={}, queueCapacity={}", coreSize, maxSize, capacity);
        return new ThreadPoolExecutor(
            coreSize,
            maxSize,
            properties.getKeepAliveSeconds(),
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(capacity),
            new DiscoveryThreadFactory(),
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock discoveryClock() {
        return Clock.systemUTC();
    }

    private static class DiscoveryThreadFactory implements ThreadFactory {

        private final AtomicInteger idGen = new AtomicInteger(1);

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName("discovery-search-worker-" + idGen.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }

    }

}
