package com.factryl.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "factryl.registry")
@Data
public class RegistryProperties {

    // Spring resource location of the source credibility table
    private String location = "classpath:source-registry.yml";
}
