package com.factryl.backend.config;

import com.factryl.backend.exception.AggregationConfigException;
import com.factryl.backend.registry.SourceRegistry;
import com.factryl.backend.registry.SourceRegistryLoader;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

@Configuration
public class AggregationConfig {

    /**
     * Clock used for default timestamps and recency age
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Source credibility table, loaded once at startup
     */
    @Bean
    public SourceRegistry sourceRegistry(SourceRegistryLoader loader, RegistryProperties properties,
                                         ResourceLoader resourceLoader) {
        Resource resource = resourceLoader.getResource(properties.getLocation());
        if (!resource.exists()) {
            throw new AggregationConfigException("Source registry not found at " + properties.getLocation());
        }
        return loader.load(resource);
    }
}
