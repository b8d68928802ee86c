package fun.fengwk.discovery.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

import java.util.Locale;

/**
 * Template engine for rendering tool results as text.
 *
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    public static final String TEMPLATE_ROOT = "mcp/templates/";

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), TEMPLATE_ROOT);
        cfg.setDefaultEncoding("UTF-8");
        cfg.setLocale(Locale.US);
        cfg.setNumberFormat("computer");
        cfg.setLogTemplateExceptions(false);
        return cfg;
    }

}
