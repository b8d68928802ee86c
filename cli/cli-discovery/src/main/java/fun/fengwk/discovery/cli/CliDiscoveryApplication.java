package fun.fengwk.discovery.cli;

import fun.fengwk.discovery.core.mcp.DiscoveryMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */

@SpringBootApplication(scanBasePackages = "fun.fengwk.discovery")
public class CliDiscoveryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliDiscoveryApplication.class, args);
    }

    @Bean
    @ConditionalOnProperty(prefix = "spring.ai.mcp.server", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ToolCallbackProvider discoveryTools(DiscoveryMcp discoveryMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(discoveryMcp)
            .build();
    }

}
